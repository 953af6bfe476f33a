// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.util.List;
import java.util.function.Consumer;

import sh.chainwatch.core.error.RpcException;

/**
 * Low-level JSON-RPC transport to an Ethereum node.
 *
 * <p>
 * Implementations serialize requests, move them over the wire and map failures
 * onto {@link RpcException}. Push subscriptions ({@code eth_subscribe}) are only
 * available on connection-oriented transports.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * <p>
 * <strong>Built-in Implementations:</strong>
 * <ul>
 * <li>{@link HttpRpcProvider} - request/response only</li>
 * <li>{@link WebSocketRpcProvider} - requests and push subscriptions</li>
 * </ul>
 */
public interface RpcProvider extends AutoCloseable {

    /**
     * Sends a JSON-RPC request and waits for its response.
     *
     * @param method the JSON-RPC method name
     * @param params positional parameters; {@code null} is sent as {@code []}
     * @return a response without an error object
     * @throws RpcException if the request fails or the node returns an error
     */
    JsonRpcResponse send(String method, List<?> params) throws RpcException;

    /**
     * Opens an {@code eth_subscribe} stream.
     *
     * @param kind           subscription kind: {@code newHeads}, {@code newPendingTransactions}, {@code logs}
     * @param params         extra parameters after the kind, e.g. a log filter object
     * @param onNotification receives each {@code params.result} of the notifications
     * @param onError        invoked at most once when the stream dies (connection closed or failed)
     * @return the node-assigned subscription id
     * @throws RpcException                  if the subscription cannot be opened
     * @throws UnsupportedOperationException if the transport cannot push
     */
    default String subscribe(
            String kind, List<?> params, Consumer<Object> onNotification, Consumer<Throwable> onError)
            throws RpcException {
        throw new UnsupportedOperationException("This provider does not support subscriptions");
    }

    /**
     * Cancels a subscription opened by {@link #subscribe}.
     *
     * @return true if the node confirmed the cancellation
     * @throws RpcException                  if the request fails
     * @throws UnsupportedOperationException if the transport cannot push
     */
    default boolean unsubscribe(String subscriptionId) throws RpcException {
        throw new UnsupportedOperationException("This provider does not support subscriptions");
    }

    /**
     * Releases the connection. Idempotent.
     */
    @Override
    default void close() {
    }
}
