// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.chainwatch.rpc.ChainTransport;

/**
 * Tears a watcher down in a fixed order:
 * <ol>
 * <li>drop every key, cancelling watches and retry timers;</li>
 * <li>when draining, wait up to the drain timeout for running backfills, otherwise abandon them;</li>
 * <li>stop delivery and the event loop, then the I/O executor;</li>
 * <li>close the transport, once.</li>
 * </ol>
 *
 * <p>With {@code waitForDrain}, teardown runs on its own thread and the returned future
 * completes only after the event loop has stopped, so no timer or callback runs after it
 * completes. Without it, teardown happens before {@link #shutdown} returns but a callback
 * already running on the event loop may still finish afterwards.
 *
 * <p>Calling {@link #shutdown} again returns the first call's future.
 */
public final class LifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private final SubscriptionRegistry registry;
    private final HistoricalBackfiller backfiller;
    private final EventDispatcher dispatcher;
    private final TaskScheduler scheduler;
    private final ExecutorService ioExecutor;
    private final ChainTransport transport;
    private final Duration drainTimeout;
    private final AtomicBoolean transportClosed = new AtomicBoolean(false);
    private @Nullable CompletableFuture<Void> shutdown;

    public LifecycleManager(
            final SubscriptionRegistry registry,
            final HistoricalBackfiller backfiller,
            final EventDispatcher dispatcher,
            final TaskScheduler scheduler,
            final ExecutorService ioExecutor,
            final ChainTransport transport,
            final Duration drainTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.backfiller = Objects.requireNonNull(backfiller, "backfiller");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
    }

    public synchronized CompletableFuture<Void> shutdown(final boolean waitForDrain) {
        if (shutdown != null) {
            return shutdown;
        }
        final CompletableFuture<Void> future = new CompletableFuture<>();
        shutdown = future;
        if (!waitForDrain) {
            teardown(false, future);
            return future;
        }
        final Thread thread = new Thread(() -> teardown(true, future), "chainwatch-shutdown");
        thread.setDaemon(true);
        thread.start();
        return future;
    }

    public synchronized boolean isShutdown() {
        return shutdown != null;
    }

    private void teardown(final boolean drain, final CompletableFuture<Void> future) {
        try {
            log.debug("Shutting down (drain={})", drain);
            registry.close();
            if (drain) {
                backfiller.awaitInFlight(drainTimeout);
            } else {
                backfiller.abandon();
            }
            dispatcher.close();
            scheduler.shutdown(drain, drainTimeout);
            ioExecutor.shutdownNow();
            if (transportClosed.compareAndSet(false, true)) {
                transport.close();
            }
            future.complete(null);
        } catch (RuntimeException e) {
            log.warn("Shutdown failed", e);
            future.completeExceptionally(e);
        }
    }
}
