// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core;

import java.util.Locale;

/**
 * One-line formats for debug output.
 *
 * <pre>
 * [RPC] method=eth_getLogs duration=1.2ms
 * [RPC-ERROR] method=eth_getLogs code=-32005 message=limit exceeded duration=40.0ms
 * [WATCH] action=start key=ContractEvent[0xabc...:Transfer]
 * </pre>
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;
    private static final int HASH_SUFFIX_LENGTH = 4;

    private LogFormatter() {
    }

    public static String formatRpc(final String method, final long durationMicros) {
        return "[RPC] method=" + method + " duration=" + formatDuration(durationMicros);
    }

    public static String formatRpcError(
            final String method, final int code, final String message, final long durationMicros) {
        return "[RPC-ERROR] method=" + method
                + " code=" + code
                + " message=" + message
                + " duration=" + formatDuration(durationMicros);
    }

    public static String formatWatch(final String action, final Object key) {
        return "[WATCH] action=" + action + " key=" + key;
    }

    public static String formatNotification(final String subscriptionId, final int items) {
        return "[NOTIFY] subscription=" + shortHash(subscriptionId) + " items=" + items;
    }

    /**
     * {@code 0x1234567890abcdef} becomes {@code 0x1234...cdef}; short values are returned as is.
     */
    public static String shortHash(final String hex) {
        if (hex == null) {
            return "null";
        }
        if (hex.length() <= HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH + 3) {
            return hex;
        }
        return hex.substring(0, HASH_PREFIX_LENGTH) + "..." + hex.substring(hex.length() - HASH_SUFFIX_LENGTH);
    }

    static String formatDuration(final long micros) {
        if (micros < 1_000) {
            return micros + "us";
        }
        if (micros < 1_000_000) {
            return String.format(Locale.ROOT, "%.1fms", micros / 1_000.0);
        }
        return String.format(Locale.ROOT, "%.1fs", micros / 1_000_000.0);
    }
}
