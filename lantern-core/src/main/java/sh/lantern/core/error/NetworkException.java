// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

import java.util.Locale;

/**
 * Exception thrown when a call to the blockchain gateway fails.
 *
 * <p>
 * Wraps both transport failures (connection refused, timeouts, HTTP errors) and JSON-RPC error
 * objects returned by the wallet daemon.
 *
 * <p>
 * <strong>Error Codes used by the daemon:</strong>
 * <ul>
 * <li><strong>-32700</strong>: Parse error (invalid JSON)</li>
 * <li><strong>-32601</strong>: Method not found</li>
 * <li><strong>-32000</strong>: Transport failure or generic daemon error</li>
 * <li><strong>-32001</strong>: Non-2xx HTTP status</li>
 * <li><strong>-32004</strong>: Resource not found (transaction, program, mapping)</li>
 * </ul>
 *
 * <p>
 * Read paths (balance, status) degrade on this exception; write paths (transfer, execution)
 * surface it to the caller.
 *
 * @since 0.1.0
 */
public final class NetworkException extends LanternException {

    /** JSON-RPC code the daemon uses for unknown transactions and programs. */
    public static final int NOT_FOUND = -32004;

    private final int code;
    private final String data;
    private final Long requestId;

    public NetworkException(
            final int code,
            final String message,
            final String data,
            final Long requestId,
            final Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public NetworkException(final int code, final String message, final String data, final Long requestId) {
        this(code, message, data, requestId, null);
    }

    public int code() {
        return code;
    }

    public String data() {
        return data;
    }

    public Long requestId() {
        return requestId;
    }

    public boolean isNotFound() {
        return code == NOT_FOUND;
    }

    public boolean isInsufficientBalance() {
        final String msg = getMessage();
        return msg != null && msg.toLowerCase(Locale.ROOT).contains("insufficient");
    }

    @Override
    public String toString() {
        return "NetworkException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", requestId="
                + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[requestId=" + requestId + "] " + message;
    }
}
