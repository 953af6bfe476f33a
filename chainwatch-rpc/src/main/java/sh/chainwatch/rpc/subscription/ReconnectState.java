// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import org.jspecify.annotations.Nullable;

/**
 * Retry bookkeeping of one key. Created with the key's first callback and discarded
 * with its last; keeps the {@link ReconnectConfig} that was in force at creation.
 *
 * <p>Not thread-safe. The registry mutates it only while holding its lock.
 */
public final class ReconnectState {

    private final ReconnectConfig config;
    private int attempts;
    private ReconnectPhase phase = ReconnectPhase.IDLE;
    private @Nullable Cancellable pendingTimer;

    ReconnectState(final ReconnectConfig config) {
        this.config = config;
    }

    public ReconnectConfig config() {
        return config;
    }

    public int attempts() {
        return attempts;
    }

    public ReconnectPhase phase() {
        return phase;
    }

    public boolean hasPendingTimer() {
        return pendingTimer != null;
    }

    void attempts(final int attempts) {
        this.attempts = attempts;
    }

    void phase(final ReconnectPhase phase) {
        this.phase = phase;
    }

    void pendingTimer(final @Nullable Cancellable pendingTimer) {
        this.pendingTimer = pendingTimer;
    }

    void cancelTimer() {
        final Cancellable timer = pendingTimer;
        pendingTimer = null;
        if (timer != null) {
            timer.cancel();
        }
    }
}
