// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core;

import java.util.Arrays;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opt-in tracing channels for gateway round trips and the transaction lifecycle.
 *
 * <p>
 * Each channel writes to its own SLF4J logger ({@code sh.lantern.trace.rpc},
 * {@code sh.lantern.trace.tx}) and is off unless switched on at runtime or through the
 * {@value #PROPERTY} system property, a comma-separated list of channel names or {@code all}.
 * Messages pass through {@link LogSanitizer} first.
 *
 * <pre>{@code
 * Trace.RPC.log(LogFormatter.formatRpc("balance_get", 812));
 * }</pre>
 */
public enum Trace {
    RPC,
    TX;

    public static final String PROPERTY = "lantern.trace";

    private final Logger logger = LoggerFactory.getLogger("sh.lantern.trace." + name().toLowerCase(Locale.ROOT));
    private volatile boolean enabled = requested(name());

    private static boolean requested(final String channel) {
        final String value = System.getProperty(PROPERTY, "");
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .anyMatch(token -> token.equalsIgnoreCase("all") || token.equalsIgnoreCase(channel));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(final boolean on) {
        enabled = on;
    }

    /** Writes {@code message}, sanitized, if this channel is on. */
    public void log(final String message) {
        if (enabled && logger.isInfoEnabled()) {
            logger.info(LogSanitizer.sanitize(message));
        }
    }

    public static void disableAll() {
        for (Trace channel : values()) {
            channel.enabled = false;
        }
    }
}
