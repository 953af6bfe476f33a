// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

/**
 * A scheduled task that may still be called off.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * @return true if the task had not started and now never will
     */
    boolean cancel();
}
