// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

/**
 * Handle returned for one registered callback.
 */
public interface Subscription {

    SubscriptionKey<?> key();

    /**
     * Removes the callback. When it was the last one for its key, the watch is
     * stopped and any pending reconnect is cancelled. Idempotent.
     */
    void unsubscribe();

    /**
     * @return true while the callback is still registered
     */
    boolean isActive();
}
