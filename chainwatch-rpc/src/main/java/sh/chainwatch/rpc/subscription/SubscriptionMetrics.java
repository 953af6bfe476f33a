// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.time.Duration;

/**
 * Hooks for watching subscription health from a metrics system.
 *
 * <p>
 * Every method has an empty default, so implementations override only what they
 * record. Methods may be called from several threads concurrently.
 *
 * <pre>{@code
 * ChainWatcher watcher = ChainWatcher.builder(transport)
 *         .metrics(new MicrometerSubscriptionMetrics(registry))
 *         .build();
 * }</pre>
 */
public interface SubscriptionMetrics {

    /**
     * A transport watch was established, initially or after a reconnect.
     */
    default void onWatchStarted(SubscriptionKey<?> key) {
    }

    /**
     * A watch was stopped because its last callback went away or the watcher shut down.
     */
    default void onWatchStopped(SubscriptionKey<?> key) {
    }

    /**
     * A running watch failed.
     */
    default void onStreamError(SubscriptionKey<?> key, Throwable error) {
    }

    /**
     * @param attempt 1 for the first retry after a healthy period
     */
    default void onReconnectScheduled(SubscriptionKey<?> key, int attempt, Duration delay) {
    }

    /**
     * The key ran out of attempts and is now stalled.
     */
    default void onReconnectExhausted(SubscriptionKey<?> key, int attempts) {
    }

    default void onCallbackError(SubscriptionKey<?> key, Throwable error) {
    }

    /**
     * @param delivered number of historical events handed to the callback
     */
    default void onBackfillCompleted(SubscriptionKey<?> key, int delivered) {
    }

    static SubscriptionMetrics noop() {
        return NoopSubscriptionMetrics.INSTANCE;
    }
}

enum NoopSubscriptionMetrics implements SubscriptionMetrics {
    INSTANCE
}
