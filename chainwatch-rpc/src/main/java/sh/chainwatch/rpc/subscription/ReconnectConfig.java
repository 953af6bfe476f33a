// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff policy for restarting a failed watch.
 *
 * <p>The n-th consecutive retry of a key waits {@code baseDelay * n}. Once a key has
 * failed {@code maxAttempts} times in a row without receiving any data, it stops
 * retrying and is reported as {@link ReconnectPhase#STALLED}.
 *
 * <p>Example:
 * <pre>{@code
 * ReconnectConfig config = ReconnectConfig.builder()
 *         .baseDelay(Duration.ofSeconds(1))
 *         .maxAttempts(5)
 *         .build();
 * }</pre>
 *
 * @param baseDelay   delay unit, must not be negative
 * @param maxAttempts consecutive failures tolerated before stalling, must not be negative
 */
public record ReconnectConfig(Duration baseDelay, int maxAttempts) {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(3_000);
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    public ReconnectConfig {
        Objects.requireNonNull(baseDelay, "baseDelay");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay cannot be negative: " + baseDelay);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts cannot be negative: " + maxAttempts);
        }
    }

    public static ReconnectConfig defaults() {
        return new ReconnectConfig(DEFAULT_BASE_DELAY, DEFAULT_MAX_ATTEMPTS);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ReconnectConfig withBaseDelay(final Duration baseDelay) {
        return new ReconnectConfig(baseDelay, maxAttempts);
    }

    public ReconnectConfig withMaxAttempts(final int maxAttempts) {
        return new ReconnectConfig(baseDelay, maxAttempts);
    }

    /**
     * @param attempt 1-based retry number
     * @return how long retry {@code attempt} waits
     */
    public Duration delayFor(final int attempt) {
        return baseDelay.multipliedBy(attempt);
    }

    public static final class Builder {
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

        private Builder() {
        }

        public Builder baseDelay(final Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxAttempts(final int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectConfig build() {
            return new ReconnectConfig(baseDelay, maxAttempts);
        }
    }
}
