// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

/**
 * Where a key is in its watch lifecycle.
 */
public enum ReconnectPhase {
    /** Registered, watch not started yet. */
    IDLE,
    /** Watch running. */
    ACTIVE,
    /** Watch just failed, retry not yet decided. */
    ERRORING,
    /** Waiting for the retry timer. */
    BACKOFF,
    /** Out of attempts. Only {@code resetSubscription} or re-registering revives the key. */
    STALLED
}
