// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

/**
 * Cancels a live watch started through {@link ChainTransport}. Calling it more than once is harmless.
 */
@FunctionalInterface
public interface WatchHandle {

    void cancel();
}
