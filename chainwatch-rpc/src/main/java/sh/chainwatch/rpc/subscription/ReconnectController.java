// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what happens after a watch fails: retry after a linearly growing delay, or
 * give up once the key's attempts are used up.
 *
 * <p>
 * Transitions of a {@link ReconnectState}:
 * <pre>
 * IDLE -> ACTIVE -> ERRORING -> BACKOFF -> ACTIVE
 *                            \-> STALLED
 * </pre>
 *
 * <p>
 * Every method except {@link #configure} must be called while holding the registry lock.
 * At most one timer is pending per key; scheduling a new one cancels the previous.
 */
public final class ReconnectController {

    private static final Logger log = LoggerFactory.getLogger(ReconnectController.class);

    private final TaskScheduler scheduler;
    private final SubscriptionMetrics metrics;
    private volatile ReconnectConfig config;
    private boolean closed;

    public ReconnectController(
            final TaskScheduler scheduler, final ReconnectConfig config, final SubscriptionMetrics metrics) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Replaces the policy for keys created from now on. Keys that already exist keep
     * the policy they were created with.
     */
    public void configure(final ReconnectConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public ReconnectConfig config() {
        return config;
    }

    ReconnectState newState() {
        return new ReconnectState(config);
    }

    void onStarted(final ReconnectState state) {
        state.phase(ReconnectPhase.ACTIVE);
    }

    void onData(final ReconnectState state) {
        state.attempts(0);
        state.phase(ReconnectPhase.ACTIVE);
    }

    /**
     * Handles a failed or unstartable watch.
     *
     * @param restart run by the retry timer
     */
    void onError(
            final SubscriptionKey<?> key,
            final ReconnectState state,
            final Throwable error,
            final Runnable restart) {
        state.phase(ReconnectPhase.ERRORING);
        if (closed) {
            return;
        }
        final int max = state.config().maxAttempts();
        if (state.attempts() >= max) {
            state.cancelTimer();
            state.phase(ReconnectPhase.STALLED);
            log.error("Reconnect attempts exhausted for {} after {} attempts, last error: {}",
                    key.label(), state.attempts(), error.toString());
            metrics.onReconnectExhausted(key, state.attempts());
            return;
        }
        final int attempt = state.attempts() + 1;
        state.attempts(attempt);
        final Duration delay = state.config().delayFor(attempt);
        state.cancelTimer();
        try {
            state.pendingTimer(scheduler.schedule(restart, delay));
        } catch (RejectedExecutionException e) {
            log.debug("Event loop stopped, not retrying {}", key.label());
            return;
        }
        state.phase(ReconnectPhase.BACKOFF);
        log.info("Reconnecting {} in {}ms (attempt {}/{})", key.label(), delay.toMillis(), attempt, max);
        metrics.onReconnectScheduled(key, attempt, delay);
    }

    void onTimerFired(final ReconnectState state) {
        state.pendingTimer(null);
    }

    /**
     * Forgets past failures so the next start begins a fresh retry sequence.
     */
    void reset(final ReconnectState state) {
        state.cancelTimer();
        state.attempts(0);
        state.phase(ReconnectPhase.IDLE);
    }

    void discard(final ReconnectState state) {
        state.cancelTimer();
        state.phase(ReconnectPhase.IDLE);
    }

    void close() {
        closed = true;
    }
}
