// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debug output for RPC traffic and subscription lifecycle, routed to the
 * {@code sh.chainwatch.debug} logger. Every line goes through {@link LogSanitizer}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.chainwatch.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!ChainwatchDebug.isRpcLoggingEnabled()) {
            return;
        }
        emit(message, args);
    }

    public static void logSubscription(final String message, final Object... args) {
        if (!ChainwatchDebug.isSubscriptionLoggingEnabled()) {
            return;
        }
        emit(message, args);
    }

    public static void log(final String message, final Object... args) {
        if (!ChainwatchDebug.isEnabled()) {
            return;
        }
        emit(message, args);
    }

    private static void emit(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
