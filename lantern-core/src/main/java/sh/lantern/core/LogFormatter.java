// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core;

/**
 * Structured one-line formats for gateway and transaction debug logs.
 *
 * <p>
 * All formats use a bracketed operation tag, shortened identifiers
 * ({@code at1abc...wxyz}) and human-readable durations. Status symbols (✓ ✗ ○) mark success,
 * failure and pending states.
 *
 * <pre>{@code
 * Trace.RPC.log(LogFormatter.formatRpc("balance_get", 812));
 * // [RPC] method=balance_get duration=812μs
 *
 * Trace.TX.log(LogFormatter.formatTxStatus("at1qqq...zzzz", "CONFIRMED"));
 * // ✓ [TX-STATUS] txId=at1qqq...zzzz status=CONFIRMED
 * }</pre>
 *
 * @see Trace
 */
public final class LogFormatter {

    private static final int ID_PREFIX_LENGTH = 6;

    private static final int ID_SUFFIX_LENGTH = 4;

    private static final int ID_SHORTEN_THRESHOLD = ID_PREFIX_LENGTH + ID_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: [RPC] method=balance_get duration=1.5ms
     */
    public static String formatRpc(String method, long durationMicros) {
        return String.format("[RPC] method=%s %s", method, duration(durationMicros));
    }

    /**
     * Format: ✗ [RPC-ERROR] method=transfer_public code=-32000 message=boom duration=1.5ms
     */
    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "✗ [RPC-ERROR] method=%s code=%s message=%s %s",
                method, code, message, duration(durationMicros));
    }

    /**
     * Format: [TX-SUBMIT] kind=SEND to=aleo1...wxyz amount=10 fee=0.1
     */
    public static String formatTxSubmit(String kind, String target, Object amount, Object fee) {
        return String.format(
                "[TX-SUBMIT] kind=%s to=%s amount=%s fee=%s",
                kind, shortenId(target), amount, fee);
    }

    /**
     * Format: [TX-ID] txId=at1abc...wxyz duration=1.5ms
     */
    public static String formatTxId(String txId, long durationMicros) {
        return String.format("[TX-ID] txId=%s %s", shortenId(txId), duration(durationMicros));
    }

    /**
     * Format: ✓/✗/○ [TX-STATUS] txId=at1abc...wxyz status=CONFIRMED
     */
    public static String formatTxStatus(String txId, String status) {
        final String symbol = switch (status) {
            case "CONFIRMED" -> "✓";
            case "FAILED" -> "✗";
            default -> "○";
        };
        return String.format("%s [TX-STATUS] txId=%s status=%s", symbol, shortenId(txId), status);
    }

    /**
     * Shortens long identifiers (addresses, transaction ids) to {@code prefix...suffix}.
     */
    public static String shortenId(String id) {
        if (id == null || id.length() <= ID_SHORTEN_THRESHOLD) {
            return id;
        }
        return id.substring(0, ID_PREFIX_LENGTH)
                + "..."
                + id.substring(id.length() - ID_SUFFIX_LENGTH);
    }

    private static String duration(long durationMicros) {
        if (durationMicros < 1_000) {
            return "duration=" + durationMicros + "μs";
        }
        if (durationMicros < 1_000_000) {
            return String.format("duration=%.1fms", durationMicros / 1_000.0);
        }
        return String.format("duration=%.1fs", durationMicros / 1_000_000.0);
    }
}
