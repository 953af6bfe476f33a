// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;

/**
 * The event loop of one watcher: immediate tasks and delayed timers, run one at a time
 * in submission order.
 */
public interface TaskScheduler {

    /**
     * @throws RejectedExecutionException after {@link #shutdown}
     */
    void execute(Runnable task);

    /**
     * @throws RejectedExecutionException after {@link #shutdown}
     */
    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Stops accepting tasks and discards pending timers. With {@code awaitRunning}, waits
     * up to {@code timeout} for a task that is currently running to finish.
     */
    void shutdown(boolean awaitRunning, Duration timeout);
}
