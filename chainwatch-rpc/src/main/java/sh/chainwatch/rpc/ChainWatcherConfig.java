// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.time.Duration;
import java.util.Objects;

import sh.chainwatch.rpc.subscription.ReconnectConfig;
import sh.chainwatch.rpc.subscription.SubscriptionMetrics;

/**
 * Settings of a {@link ChainWatcher}.
 *
 * @param reconnect    initial backoff policy, changeable later with
 *                     {@link ChainWatcher#setReconnectConfig(Long, Integer)}
 * @param drainTimeout how long {@code destroy(true)} waits for running backfills and callbacks
 * @param metrics      subscription health hooks
 */
public record ChainWatcherConfig(ReconnectConfig reconnect, Duration drainTimeout, SubscriptionMetrics metrics) {

    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    public ChainWatcherConfig {
        Objects.requireNonNull(reconnect, "reconnect");
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        Objects.requireNonNull(metrics, "metrics");
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout cannot be negative: " + drainTimeout);
        }
    }

    public static ChainWatcherConfig defaults() {
        return new ChainWatcherConfig(ReconnectConfig.defaults(), DEFAULT_DRAIN_TIMEOUT, SubscriptionMetrics.noop());
    }
}
