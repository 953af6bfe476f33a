// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.chainwatch.core.error.BackfillException;
import sh.chainwatch.core.model.LogEntry;
import sh.chainwatch.rpc.ChainTransport;
import sh.chainwatch.rpc.LogQuery;

/**
 * Replays past contract events to a newly registered callback.
 *
 * <p>
 * A backfill is one {@code getLogs} over {@code [fromBlock, toBlock]}, run on the I/O
 * executor. Results are sorted by block number, then log index, and delivered on the
 * event loop. The scan runs alongside the live watch, so an event near the head can
 * arrive both ways; callers needing exactly-once handling deduplicate on
 * {@code (transactionHash, logIndex)}.
 *
 * <p>
 * Results are dropped when {@code stillWanted} turns false before or during delivery.
 */
public final class HistoricalBackfiller {

    private static final Logger log = LoggerFactory.getLogger(HistoricalBackfiller.class);

    private final ChainTransport transport;
    private final EventDispatcher dispatcher;
    private final Executor ioExecutor;
    private final SubscriptionMetrics metrics;
    private final Set<CompletableFuture<Integer>> inFlight = ConcurrentHashMap.newKeySet();

    public HistoricalBackfiller(
            final ChainTransport transport,
            final EventDispatcher dispatcher,
            final Executor ioExecutor,
            final SubscriptionMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Starts a backfill.
     *
     * @return completes with the number of events handed to {@code callback}, or
     *         exceptionally with {@link BackfillException} when the scan failed
     */
    public CompletableFuture<Integer> backfill(
            final BackfillRequest request,
            final EventCallback<? super LogEntry> callback,
            final BooleanSupplier stillWanted) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(stillWanted, "stillWanted");
        final SubscriptionKey.ContractEvent key = request.key();
        final CompletableFuture<Integer> result;
        try {
            result = CompletableFuture.supplyAsync(() -> scan(request), ioExecutor)
                    .thenCompose(logs -> stillWanted.getAsBoolean()
                            ? dispatcher.deliverAll(key, callback, logs, stillWanted)
                            : CompletableFuture.completedFuture(0));
        } catch (RejectedExecutionException e) {
            log.debug("I/O executor stopped, skipping backfill for {}", key.label());
            return CompletableFuture.completedFuture(0);
        }
        inFlight.add(result);
        result.whenComplete((delivered, error) -> {
            inFlight.remove(result);
            if (delivered != null) {
                log.debug("Backfill for {} delivered {} events", key.label(), delivered);
                metrics.onBackfillCompleted(key, delivered);
            }
        });
        return result;
    }

    /**
     * Runs the scan synchronously on the calling thread.
     *
     * @return logs sorted by {@link LogEntry#CHAIN_ORDER}
     * @throws BackfillException if resolving the head or fetching logs fails
     */
    public List<LogEntry> scan(final BackfillRequest request) {
        final long from = Math.max(0L, request.fromBlock());
        try {
            final long to = request.toBlock() != null ? request.toBlock() : transport.getBlockNumber();
            if (from > to) {
                return List.of();
            }
            final List<LogEntry> logs = new ArrayList<>(transport.getLogs(new LogQuery(request.filter(), from, to)));
            logs.sort(LogEntry.CHAIN_ORDER);
            return logs;
        } catch (RuntimeException e) {
            throw new BackfillException(
                    "Backfill of " + request.key().label() + " from block " + from + " failed: " + e.getMessage(),
                    request.fromBlock(), request.toBlock(), e);
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Waits for running backfills, whatever their outcome.
     *
     * @return false if some were still running when the timeout elapsed
     */
    public boolean awaitInFlight(final Duration timeout) {
        final List<CompletableFuture<Integer>> pending = new ArrayList<>(inFlight);
        if (pending.isEmpty()) {
            return true;
        }
        final CompletableFuture<?>[] settled = pending.stream()
                .map(f -> f.handle((r, e) -> r))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(settled).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("{} backfills still running after {}ms", inFlight.size(), timeout.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | CancellationException e) {
            // settled futures never fail
            throw new IllegalStateException(e);
        }
    }

    /**
     * Cancels every running backfill; their results are never delivered.
     */
    public void abandon() {
        final List<CompletableFuture<Integer>> pending = new ArrayList<>(inFlight);
        pending.forEach(f -> f.cancel(false));
        if (!pending.isEmpty()) {
            log.debug("Abandoned {} backfills", pending.size());
        }
    }
}
