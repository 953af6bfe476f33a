// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

/**
 * Point-in-time view of one key.
 *
 * @param key           the key
 * @param phase         reconnect phase
 * @param attempts      consecutive failures since the last data
 * @param callbackCount registered callbacks
 * @param watchActive   whether a transport watch is currently open
 */
public record SubscriptionStatus(
        SubscriptionKey<?> key,
        ReconnectPhase phase,
        int attempts,
        int callbackCount,
        boolean watchActive) {

    public boolean isStalled() {
        return phase == ReconnectPhase.STALLED;
    }
}
