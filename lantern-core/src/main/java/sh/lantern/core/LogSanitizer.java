// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core;

import java.util.regex.Pattern;

/**
 * Removes wallet secrets from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts private keys, view keys, seed phrases and passwords, both as JSON fields and as
 * bare Aleo key literals</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final String REDACTED = "***[REDACTED]***";

    /** JSON string fields whose values are always secret. */
    private static final Pattern SECRET_FIELD_PATTERN = Pattern.compile(
            "\"(privateKey|viewKey|seedPhrase|mnemonic|password)\"\\s*:\\s*\"[^\"]*\"");

    /** Bare Aleo private and view keys, e.g. inside JSON-RPC params arrays. */
    private static final Pattern KEY_LITERAL_PATTERN =
            Pattern.compile("(APrivateKey1|AViewKey1)[0-9A-Za-z]+");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.indexOf('"') >= 0) {
            sanitized = SECRET_FIELD_PATTERN.matcher(sanitized).replaceAll("\"$1\":\"" + REDACTED + "\"");
        }

        if (sanitized.contains("APrivateKey1") || sanitized.contains("AViewKey1")) {
            sanitized = KEY_LITERAL_PATTERN.matcher(sanitized).replaceAll("$1" + REDACTED);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
