// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.types;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * The scheme, host and port identity of web content talking to the wallet.
 *
 * <p>{@link #of(String)} reduces a full page URL to its origin, so
 * {@code https://App.example:443/path?q=1} and {@code https://app.example} are the same origin.
 * Strings that are not hierarchical URLs (for example {@code about:blank} or {@code unknown}) are
 * kept verbatim.
 */
public record Origin(String value) {

    public Origin {
        Objects.requireNonNull(value, "origin");
        if (value.isBlank()) {
            throw new IllegalArgumentException("origin cannot be blank");
        }
    }

    public static Origin of(final String url) {
        Objects.requireNonNull(url, "url");
        final String trimmed = url.trim();
        try {
            final URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return new Origin(trimmed);
            }
            final String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            final String host = uri.getHost().toLowerCase(Locale.ROOT);
            final int port = uri.getPort();
            if (port == -1 || port == defaultPort(scheme)) {
                return new Origin(scheme + "://" + host);
            }
            return new Origin(scheme + "://" + host + ":" + port);
        } catch (URISyntaxException e) {
            return new Origin(trimmed);
        }
    }

    private static int defaultPort(final String scheme) {
        switch (scheme) {
            case "http":
            case "ws":
                return 80;
            case "https":
            case "wss":
                return 443;
            default:
                return -1;
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
