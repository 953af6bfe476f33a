// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.error;

import java.util.Locale;

import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC request failed, either with an error object returned by the node
 * or with a transport-level problem mapped onto a JSON-RPC code.
 *
 * <p>
 * <strong>Codes used locally:</strong>
 * <ul>
 * <li><strong>-32700</strong>: the request or response could not be (de)serialized</li>
 * <li><strong>-32000</strong>: network failure, timeout or closed connection</li>
 * <li><strong>-32001</strong>: non-2xx HTTP status</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC Error Specification</a>
 */
public final class RpcException extends ChainwatchException {

    private final int code;
    private final @Nullable String data;
    private final @Nullable Long requestId;

    public RpcException(
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable Long requestId,
            final @Nullable Throwable cause) {
        super(withRequestId(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final @Nullable String data, final @Nullable Long requestId) {
        this(code, message, data, requestId, null);
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable Long requestId() {
        return requestId;
    }

    /**
     * @return true when the node refused an {@code eth_getLogs} range as too wide
     */
    public boolean isBlockRangeTooLarge() {
        return mentions("block range") || mentions("query returned more than");
    }

    private boolean mentions(final String needle) {
        final String msg = getMessage();
        return (msg != null && msg.toLowerCase(Locale.ROOT).contains(needle))
                || (data != null && data.toLowerCase(Locale.ROOT).contains(needle));
    }

    @Override
    public String toString() {
        return "RpcException{code=" + code
                + ", message=" + getMessage()
                + ", data=" + data
                + ", requestId=" + requestId
                + "}";
    }

    private static String withRequestId(final String message, final @Nullable Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[requestId=" + requestId + "] " + message;
    }
}
