// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

import sh.chainwatch.core.abi.EventAbi;
import sh.chainwatch.rpc.WatchHandle;

/**
 * Live state of one key, guarded by the registry lock.
 *
 * <p>{@code generation} is bumped whenever the current watch is replaced or dropped;
 * transport callbacks carry the generation they were opened with and are ignored
 * once it no longer matches.
 */
final class SubscriptionState {

    final SubscriptionKey<?> key;
    final EventAbi abi;
    final ReconnectState reconnect;
    // identity semantics, insertion order
    final List<EventCallback<Object>> callbacks = new ArrayList<>(2);
    @Nullable WatchHandle handle;
    long generation;
    // tail of the pending-transaction lookups; each batch starts after the previous one
    CompletableFuture<Void> lookups = CompletableFuture.completedFuture(null);

    SubscriptionState(final SubscriptionKey<?> key, final EventAbi abi, final ReconnectState reconnect) {
        this.key = key;
        this.abi = abi;
        this.reconnect = reconnect;
    }

    boolean contains(final EventCallback<?> callback) {
        for (EventCallback<Object> existing : callbacks) {
            if (existing == callback) {
                return true;
            }
        }
        return false;
    }

    boolean remove(final EventCallback<?> callback) {
        for (int i = 0; i < callbacks.size(); i++) {
            if (callbacks.get(i) == callback) {
                callbacks.remove(i);
                return true;
            }
        }
        return false;
    }
}
