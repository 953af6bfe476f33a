// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs callbacks on the event loop.
 *
 * <p>A delivery round hands each event to every callback of a snapshot, in snapshot
 * order. A callback that throws, {@link Error}s included, is logged and skipped; the rest
 * of the round continues.
 * Before each invocation the round asks whether the callback is still wanted, so a
 * callback removed while a round is queued is not called. Once {@link #close() closed},
 * queued rounds are dropped.
 */
public final class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final TaskScheduler scheduler;
    private final SubscriptionMetrics metrics;
    private volatile boolean closed;

    public EventDispatcher(final TaskScheduler scheduler, final SubscriptionMetrics metrics) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Queues one delivery round.
     *
     * @param snapshot callbacks registered when the events arrived
     * @param events   payloads, delivered in list order
     * @param live     re-checked before each invocation
     */
    void dispatch(
            final SubscriptionKey<?> key,
            final List<EventCallback<Object>> snapshot,
            final List<?> events,
            final Predicate<EventCallback<Object>> live) {
        if (closed || snapshot.isEmpty() || events.isEmpty()) {
            return;
        }
        submit(key, () -> {
            for (Object event : events) {
                for (EventCallback<Object> callback : snapshot) {
                    if (closed) {
                        return;
                    }
                    if (!live.test(callback)) {
                        continue;
                    }
                    invoke(key, callback, event);
                }
            }
        });
    }

    /**
     * Delivers historical events to a single callback, stopping early once it is no
     * longer wanted. A failing event is logged and the rest still go out.
     *
     * @return number of events handed to the callback, 0 when the round was dropped
     */
    <E> CompletableFuture<Integer> deliverAll(
            final SubscriptionKey<?> key,
            final EventCallback<? super E> callback,
            final List<? extends E> events,
            final BooleanSupplier stillWanted) {
        final CompletableFuture<Integer> done = new CompletableFuture<>();
        if (closed || events.isEmpty()) {
            done.complete(0);
            return done;
        }
        final boolean queued = submit(key, () -> {
            int delivered = 0;
            try {
                for (E event : events) {
                    if (closed || !stillWanted.getAsBoolean()) {
                        break;
                    }
                    delivered++;
                    try {
                        callback.onEvent(event);
                    } catch (VirtualMachineError e) {
                        throw e;
                    } catch (Throwable e) {
                        log.warn("Backfill callback for {} failed: {}", key.label(), e.toString());
                        metrics.onCallbackError(key, e);
                    }
                }
            } finally {
                done.complete(delivered);
            }
        });
        if (!queued) {
            done.complete(0);
        }
        return done;
    }

    /**
     * Drops queued rounds and refuses new ones. Idempotent.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    private boolean submit(final SubscriptionKey<?> key, final Runnable round) {
        try {
            scheduler.execute(round);
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Event loop stopped, dropping delivery for {}", key.label());
            return false;
        }
    }

    private void invoke(final SubscriptionKey<?> key, final EventCallback<Object> callback, final Object event) {
        try {
            callback.onEvent(event);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.error("Callback for {} threw", key.label(), e);
            metrics.onCallbackError(key, e);
        }
    }
}
