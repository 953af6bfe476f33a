// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core;

/**
 * Global switches for verbose debug logging.
 *
 * <p>The flags are volatile and read independently; a reader may briefly see
 * one flag updated and not the other, which only affects which lines get logged.
 */
public final class ChainwatchDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean subscriptionLogging = false;

    private ChainwatchDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || subscriptionLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        subscriptionLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setSubscriptionLogging(final boolean enabled) {
        subscriptionLogging = enabled;
    }

    public static boolean isSubscriptionLoggingEnabled() {
        return subscriptionLogging;
    }
}
