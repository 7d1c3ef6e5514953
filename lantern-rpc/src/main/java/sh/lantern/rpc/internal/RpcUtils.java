// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.rpc.internal;

import java.util.Map;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared helpers for the JSON-RPC layer.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper. Amounts are read as {@link java.math.BigDecimal}.
     */
    public static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Flattens the {@code data} member of a JSON-RPC error into a string.
     *
     * <p>Strings are returned as-is; maps and lists are searched for the first nested string;
     * anything else falls back to {@code toString()}.
     *
     * @param dataValue the error data object from the response
     * @return the extracted string, or {@code null} if {@code dataValue} is null
     */
    public static String extractErrorData(final Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof CharSequence) {
            return dataValue.toString();
        }
        if (dataValue instanceof Map<?, ?>) {
            return extractFromIterable(((Map<?, ?>) dataValue).values(), dataValue);
        }
        if (dataValue instanceof Iterable<?>) {
            return extractFromIterable((Iterable<?>) dataValue, dataValue);
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (final Object value : iterable) {
            if (value instanceof CharSequence) {
                return value.toString();
            }
            if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
                final String nested = extractErrorData(value);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return fallback.toString();
    }
}
