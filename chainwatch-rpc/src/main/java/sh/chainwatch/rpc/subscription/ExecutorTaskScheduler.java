// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TaskScheduler} backed by a single-threaded {@link ScheduledExecutorService}.
 */
public final class ExecutorTaskScheduler implements TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final ScheduledExecutorService executor;

    public ExecutorTaskScheduler(final ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public void execute(final Runnable task) {
        executor.execute(logged(task));
    }

    @Override
    public Cancellable schedule(final Runnable task, final Duration delay) {
        final ScheduledFuture<?> future = executor.schedule(logged(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    // the executor would otherwise park a failure in the task's future, where nobody reads it
    private static Runnable logged(final Runnable task) {
        Objects.requireNonNull(task, "task");
        return () -> {
            try {
                task.run();
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                log.error("Event loop task failed", e);
            }
        };
    }

    @Override
    public void shutdown(final boolean awaitRunning, final Duration timeout) {
        executor.shutdownNow();
        if (!awaitRunning) {
            return;
        }
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Event loop still busy {}ms after shutdown", timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
