// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

/**
 * Receives events of one subscription kind.
 *
 * <p>Callbacks are compared by identity: registering the same instance twice for a key
 * is a no-op. Anything thrown is logged and does not affect other callbacks or the watch.
 *
 * @param <E> event type
 */
@FunctionalInterface
public interface EventCallback<E> {

    void onEvent(E event) throws Exception;
}
