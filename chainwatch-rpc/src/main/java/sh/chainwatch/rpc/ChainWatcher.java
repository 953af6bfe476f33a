// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.chainwatch.core.abi.EventAbi;
import sh.chainwatch.core.error.BackfillException;
import sh.chainwatch.core.error.TransportStartException;
import sh.chainwatch.core.model.LogEntry;
import sh.chainwatch.core.types.Address;
import sh.chainwatch.rpc.subscription.BackfillRequest;
import sh.chainwatch.rpc.subscription.EventDispatcher;
import sh.chainwatch.rpc.subscription.ExecutorTaskScheduler;
import sh.chainwatch.rpc.subscription.HistoricalBackfiller;
import sh.chainwatch.rpc.subscription.LifecycleManager;
import sh.chainwatch.rpc.subscription.ReconnectConfig;
import sh.chainwatch.rpc.subscription.ReconnectController;
import sh.chainwatch.rpc.subscription.Subscription;
import sh.chainwatch.rpc.subscription.SubscriptionKey;
import sh.chainwatch.rpc.subscription.SubscriptionMetrics;
import sh.chainwatch.rpc.subscription.SubscriptionRegistry;
import sh.chainwatch.rpc.subscription.SubscriptionStatus;
import sh.chainwatch.rpc.subscription.TaskScheduler;

/**
 * Live blocks, pending transactions and contract events over one {@link ChainTransport},
 * with automatic reconnection and optional replay of past events.
 *
 * <p>
 * Callbacks sharing a key share one watch: the first registration starts it, removing the
 * last stops it. A watch that fails is retried after {@code baseDelay * n} for the n-th
 * consecutive failure; any data received resets the count. After {@code maxAttempts}
 * failures the key stalls until {@link #resetSubscription} is called.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * try (ChainWatcher watcher = ChainWatcher.connect("wss://eth.example/ws")) {
 *     watcher.onBlock(block -> System.out.println("block " + block.number()));
 *     Subscription transfers = watcher.onContractEvent(
 *             new Address("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"),
 *             "Transfer",
 *             log -> handle(log),
 *             ContractEventOptions.builder()
 *                     .abi(EventAbi.of("event Transfer(address indexed from, address indexed to, uint256 value)"))
 *                     .fromBlock(19_000_000L)
 *                     .build());
 *     // ...
 *     transfers.unsubscribe();
 * }
 * }</pre>
 *
 * <p>
 * <strong>Threading:</strong> all callbacks of one watcher run on its single event-loop
 * thread, one at a time. Registration methods may be called from any thread, including
 * from inside a callback. A callback that throws is logged and does not affect others.
 *
 * <p>
 * Replayed events run concurrently with the live watch, so an event near the chain head
 * may be delivered twice. Deduplicate on {@code (transactionHash, logIndex)} when that matters.
 *
 * @since 0.1.0
 */
public final class ChainWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChainWatcher.class);

    private final ChainTransport transport;
    private final ReconnectController reconnect;
    private final SubscriptionRegistry registry;
    private final HistoricalBackfiller backfiller;
    private final LifecycleManager lifecycle;

    private ChainWatcher(final Builder builder) {
        this.transport = builder.transport;
        final TaskScheduler scheduler = builder.scheduler != null
                ? builder.scheduler
                : new ExecutorTaskScheduler(ChainExecutors.newEventLoop());
        final ExecutorService io = builder.ioExecutor != null ? builder.ioExecutor : ChainExecutors.newIoExecutor();
        final SubscriptionMetrics metrics = builder.config.metrics();
        final EventDispatcher dispatcher = new EventDispatcher(scheduler, metrics);
        this.reconnect = new ReconnectController(scheduler, builder.config.reconnect(), metrics);
        this.registry = new SubscriptionRegistry(transport, dispatcher, reconnect, io, metrics);
        this.backfiller = new HistoricalBackfiller(transport, dispatcher, io, metrics);
        this.lifecycle = new LifecycleManager(
                registry, backfiller, dispatcher, scheduler, io, transport, builder.config.drainTimeout());
    }

    /**
     * Creates a watcher with default settings. The watcher owns the transport and closes it on destroy.
     */
    public static ChainWatcher create(final ChainTransport transport) {
        return builder(transport).build();
    }

    /**
     * Opens a WebSocket JSON-RPC connection and watches over it.
     */
    public static ChainWatcher connect(final String wsUrl) {
        return create(new RpcChainTransport(WebSocketRpcProvider.create(wsUrl)));
    }

    /**
     * Subscribes over {@code wsUrl} and sends replays, transaction lookups and other reads
     * over {@code httpUrl}, keeping large {@code eth_getLogs} answers off the socket.
     */
    public static ChainWatcher connect(final String wsUrl, final String httpUrl) {
        final HttpRpcProvider reads = HttpRpcProvider.create(httpUrl);
        return create(new RpcChainTransport(reads, WebSocketRpcProvider.create(wsUrl)));
    }

    public static Builder builder(final ChainTransport transport) {
        return new Builder(transport);
    }

    /**
     * @throws TransportStartException if this is the first block listener and the watch cannot start
     * @throws IllegalStateException   after {@link #destroy}
     */
    public Subscription onBlock(final BlockListener listener) {
        return registry.register(SubscriptionKey.BLOCKS, listener);
    }

    /**
     * Pending transaction hashes are resolved to full transactions before delivery;
     * hashes the node no longer knows are skipped.
     *
     * @throws TransportStartException if this is the first transaction listener and the watch cannot start
     * @throws IllegalStateException   after {@link #destroy}
     */
    public Subscription onTransaction(final TransactionListener listener) {
        return registry.register(SubscriptionKey.PENDING_TRANSACTIONS, listener);
    }

    /**
     * Watches every log of {@code address}, since no ABI is given to resolve {@code eventName}.
     */
    public Subscription onContractEvent(
            final Address address, final String eventName, final ContractEventListener listener) {
        return onContractEvent(address, eventName, listener, ContractEventOptions.none());
    }

    /**
     * Watches one event of one contract.
     *
     * <p>When {@code options} carry an ABI declaring {@code eventName}, the watch is narrowed
     * to that event's topic; otherwise every log of the contract is delivered. When they carry
     * a {@code fromBlock}, past events are replayed in chain order. A replay that fails is
     * logged; the live subscription stays in place.
     *
     * @throws TransportStartException if this is the first listener of the key and the watch cannot start
     * @throws IllegalStateException   after {@link #destroy}
     */
    public Subscription onContractEvent(
            final Address address,
            final String eventName,
            final ContractEventListener listener,
            final ContractEventOptions options) {
        Objects.requireNonNull(options, "options");
        final SubscriptionKey.ContractEvent key = SubscriptionKey.contractEvent(address, eventName);
        final Subscription subscription = registry.registerContractEvent(key, listener, options.abi());
        if (options.wantsBackfill()) {
            final BackfillRequest request =
                    new BackfillRequest(address, eventName, options.fromBlock(), options.toBlock(), options.abi());
            backfiller.backfill(request, listener, subscription::isActive)
                    .whenComplete((delivered, error) -> {
                        if (error != null) {
                            reportBackfillFailure(key, error);
                        }
                    });
        }
        return subscription;
    }

    public void offBlock() {
        registry.unregister(SubscriptionKey.BLOCKS);
    }

    public void offTransaction() {
        registry.unregister(SubscriptionKey.PENDING_TRANSACTIONS);
    }

    /**
     * Removes every event subscription of {@code address}.
     */
    public void offContractEvent(final Address address) {
        offContractEvent(address, null);
    }

    /**
     * @param eventName event to remove, or {@code null} for every event of the contract
     */
    public void offContractEvent(final Address address, final @Nullable String eventName) {
        Objects.requireNonNull(address, "address");
        if (eventName != null) {
            registry.unregister(SubscriptionKey.contractEvent(address, eventName));
            return;
        }
        registry.unregisterAll(key -> key instanceof SubscriptionKey.ContractEvent event && event.matches(address));
    }

    /**
     * Changes the backoff policy for keys registered from now on. Keys that already have
     * callbacks keep their current policy. {@code null} leaves a value unchanged.
     */
    public void setReconnectConfig(final @Nullable Long delayMs, final @Nullable Integer maxAttempts) {
        ReconnectConfig next = reconnect.config();
        if (delayMs != null) {
            next = next.withBaseDelay(Duration.ofMillis(delayMs));
        }
        if (maxAttempts != null) {
            next = next.withMaxAttempts(maxAttempts);
        }
        reconnect.configure(next);
        log.debug("Reconnect policy now {}ms x {} attempts", next.baseDelay().toMillis(), next.maxAttempts());
    }

    public ReconnectConfig reconnectConfig() {
        return reconnect.config();
    }

    /**
     * Zeroes the key's failure count and reopens its watch. The way out of
     * {@link sh.chainwatch.rpc.subscription.ReconnectPhase#STALLED}.
     *
     * @return false if the key has no listeners
     */
    public boolean resetSubscription(final SubscriptionKey<?> key) {
        return registry.restart(key);
    }

    public Optional<SubscriptionStatus> status(final SubscriptionKey<?> key) {
        return registry.status(key);
    }

    public List<SubscriptionKey<?>> activeSubscriptions() {
        return registry.activeKeys();
    }

    /**
     * One-shot scan of past logs, sorted by block number then log index.
     *
     * @param toBlock last block inclusive, or {@code null} for the chain head
     * @throws BackfillException if the scan fails
     */
    public List<LogEntry> getContractEvents(
            final Address address,
            final String eventName,
            final long fromBlock,
            final @Nullable Long toBlock,
            final EventAbi abi) {
        ensureOpen();
        return backfiller.scan(new BackfillRequest(address, eventName, fromBlock, toBlock, abi));
    }

    public long getBlockNumber() {
        ensureOpen();
        return transport.getBlockNumber();
    }

    /**
     * Same as {@code destroy(false)}.
     */
    public CompletableFuture<Void> destroy() {
        return destroy(false);
    }

    /**
     * Stops every watch and retry timer and releases the transport.
     *
     * <p>Listeners are detached before anything else, so a replay still running at this
     * point never delivers: with {@code waitForCleanup} its scan is awaited and its results
     * are discarded; without it the replay is cancelled.
     *
     * @param waitForCleanup when true, the future completes only once running replay scans and
     *                       callbacks have finished (bounded by the drain timeout); no callback
     *                       runs after that. When false, teardown is immediate and a callback
     *                       already running may still finish shortly after.
     * @return completes when teardown is done; repeated calls return the same future
     */
    public CompletableFuture<Void> destroy(final boolean waitForCleanup) {
        return lifecycle.shutdown(waitForCleanup);
    }

    public boolean isClosed() {
        return lifecycle.isShutdown();
    }

    /**
     * Equivalent to {@code destroy(true).join()}.
     */
    @Override
    public void close() {
        destroy(true).join();
    }

    private void ensureOpen() {
        if (lifecycle.isShutdown()) {
            throw new IllegalStateException("ChainWatcher is closed");
        }
    }

    private static void reportBackfillFailure(final SubscriptionKey<?> key, final Throwable error) {
        final Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof CancellationException) {
            log.debug("Backfill for {} abandoned", key.label());
            return;
        }
        log.error("Backfill for {} failed", key.label(), cause);
    }

    /**
     * Builder for {@link ChainWatcher}.
     */
    public static final class Builder {
        private final ChainTransport transport;
        private ChainWatcherConfig config = ChainWatcherConfig.defaults();
        private @Nullable TaskScheduler scheduler;
        private @Nullable ExecutorService ioExecutor;

        private Builder(final ChainTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        public Builder config(final ChainWatcherConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder reconnect(final ReconnectConfig reconnect) {
            this.config = new ChainWatcherConfig(reconnect, config.drainTimeout(), config.metrics());
            return this;
        }

        public Builder drainTimeout(final Duration drainTimeout) {
            this.config = new ChainWatcherConfig(config.reconnect(), drainTimeout, config.metrics());
            return this;
        }

        public Builder metrics(final SubscriptionMetrics metrics) {
            this.config = new ChainWatcherConfig(config.reconnect(), config.drainTimeout(), metrics);
            return this;
        }

        /**
         * Replaces the event loop. The watcher shuts it down on destroy.
         */
        public Builder scheduler(final TaskScheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        /**
         * Replaces the executor for blocking reads. The watcher shuts it down on destroy.
         */
        public Builder ioExecutor(final ExecutorService ioExecutor) {
            this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
            return this;
        }

        public ChainWatcher build() {
            return new ChainWatcher(this);
        }
    }
}
