// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Executor that queues tasks until the test runs them.
 */
public final class ManualExecutor extends AbstractExecutorService {

    private final Deque<Runnable> queue = new ArrayDeque<>();
    private boolean shutdown;

    @Override
    public synchronized void execute(final Runnable command) {
        if (shutdown) {
            throw new RejectedExecutionException("executor shut down");
        }
        queue.add(command);
    }

    /**
     * Runs queued tasks, including ones they enqueue, until none are left.
     *
     * @return number of tasks run
     */
    public int runAll() {
        int ran = 0;
        while (true) {
            final Runnable next;
            synchronized (this) {
                next = queue.poll();
            }
            if (next == null) {
                return ran;
            }
            next.run();
            ran++;
        }
    }

    public synchronized int queued() {
        return queue.size();
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
    }

    @Override
    public synchronized List<Runnable> shutdownNow() {
        shutdown = true;
        final List<Runnable> pending = new ArrayList<>(queue);
        queue.clear();
        return pending;
    }

    @Override
    public synchronized boolean isShutdown() {
        return shutdown;
    }

    @Override
    public synchronized boolean isTerminated() {
        return shutdown && queue.isEmpty();
    }

    @Override
    public boolean awaitTermination(final long timeout, final TimeUnit unit) {
        return isTerminated();
    }
}
