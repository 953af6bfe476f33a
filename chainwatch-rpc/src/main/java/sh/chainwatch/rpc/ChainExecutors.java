// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Named daemon executors used by a {@link ChainWatcher}.
 *
 * <ul>
 * <li>The <strong>event loop</strong> is single-threaded. Reconnect timers and every
 * callback delivery run on it, so callbacks of one watcher never run concurrently.</li>
 * <li>The <strong>I/O executor</strong> runs blocking RPC reads (historical log scans,
 * pending transaction lookups) so they never stall the event loop.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class ChainExecutors {

    private static final AtomicInteger WATCHER_ID = new AtomicInteger(0);

    private ChainExecutors() {
    }

    /**
     * @return a single-threaded scheduler with a daemon thread named {@code chainwatch-events-N}
     */
    public static ScheduledExecutorService newEventLoop() {
        final int id = WATCHER_ID.getAndIncrement() & 0x7FFFFFFF;
        return Executors.newSingleThreadScheduledExecutor(daemon("chainwatch-events-" + id, false));
    }

    /**
     * @return a cached pool of daemon threads named {@code chainwatch-io-N}
     */
    public static ExecutorService newIoExecutor() {
        return Executors.newCachedThreadPool(daemon("chainwatch-io-", true));
    }

    static ThreadFactory daemon(final String name, final boolean numbered) {
        final AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            final Thread t = new Thread(r, numbered ? name + (counter.getAndIncrement() & 0x7FFFFFFF) : name);
            t.setDaemon(true);
            return t;
        };
    }
}
