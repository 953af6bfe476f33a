// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

import sh.chainwatch.core.error.RpcException;

/**
 * Retries one-shot reads ({@code eth_getLogs}, {@code eth_blockNumber},
 * {@code eth_getTransactionByHash}) on transient failures.
 *
 * <p>
 * <strong>Retried:</strong> network I/O failures, timeouts, "header not found"
 * (node behind the head), rate limiting.
 * <strong>Not retried:</strong> invalid parameters, oversized log ranges, anything else.
 *
 * <p>
 * Backoff is linear: {@code base * attempt}, so with the 200ms default the
 * waits are 200ms, 400ms, ...
 *
 * <p>
 * This is unrelated to watch reconnection, which is driven by the subscription
 * reconnect controller.
 */
final class RpcRetry {

    static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(200);

    private RpcRetry() {
    }

    static <T> T run(final Supplier<T> supplier, final int maxAttempts) {
        return run(supplier, maxAttempts, DEFAULT_BASE_DELAY);
    }

    /**
     * @throws RpcException             the last failure, when not retryable or attempts are used up
     * @throws IllegalArgumentException if maxAttempts is below 1
     */
    static <T> T run(final Supplier<T> supplier, final int maxAttempts, final Duration baseDelay) {
        Objects.requireNonNull(supplier, "supplier");
        Objects.requireNonNull(baseDelay, "baseDelay");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        for (int attempt = 1; ; attempt++) {
            try {
                return supplier.get();
            } catch (RpcException e) {
                if (!isRetryable(e) || attempt == maxAttempts) {
                    throw e;
                }
                try {
                    Thread.sleep(baseDelay.toMillis() * attempt);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    static boolean isRetryable(final RpcException e) {
        if (e == null) {
            return false;
        }
        if (e.isBlockRangeTooLarge()) {
            return false;
        }
        if (hasIoCause(e)) {
            return true;
        }
        if (e.code() == -32005) {
            return true;
        }
        final String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("header not found")
                || message.contains("timed out")
                || message.contains("timeout")
                || message.contains("connection reset")
                || message.contains("temporarily unavailable")
                || message.contains("try again")
                || message.contains("rate limit")
                || message.contains("too many requests");
    }

    private static boolean hasIoCause(final Throwable e) {
        Throwable current = e.getCause();
        while (current != null) {
            if (current instanceof IOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
