// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Predicate;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.chainwatch.core.DebugLogger;
import sh.chainwatch.core.LogFormatter;
import sh.chainwatch.core.abi.EventAbi;
import sh.chainwatch.core.abi.EventSignature;
import sh.chainwatch.core.error.TransportStartException;
import sh.chainwatch.core.model.LogEntry;
import sh.chainwatch.core.model.Transaction;
import sh.chainwatch.core.types.Hash;
import sh.chainwatch.rpc.ChainTransport;
import sh.chainwatch.rpc.ContractEventFilter;
import sh.chainwatch.rpc.WatchHandle;

/**
 * Owns the callbacks of every key and the single transport watch behind each key.
 *
 * <p>
 * <strong>Invariants:</strong>
 * <ul>
 * <li>A key has an open watch (or a pending retry) exactly while it has callbacks.</li>
 * <li>At most one watch is open per key. A watch that was replaced or dropped can still
 * call back from the transport; such calls are recognised by their generation and ignored.</li>
 * <li>Removing a callback takes effect immediately: it is not invoked afterwards, even
 * for events that were already queued.</li>
 * </ul>
 *
 * <p>
 * <strong>Threading:</strong> state is guarded by one internal lock, held only to update
 * maps and sets. Transport calls and callback delivery happen outside it. Watch
 * callbacks may arrive on any transport thread; deliveries go through the
 * {@link EventDispatcher} onto the event loop. Pending transaction lookups of one key
 * run one batch at a time on the I/O executor, so batches are delivered in the order
 * the transport sent them.
 */
public final class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Object lock = new Object();
    private final Map<SubscriptionKey<?>, SubscriptionState> states = new LinkedHashMap<>();
    private final ChainTransport transport;
    private final EventDispatcher dispatcher;
    private final ReconnectController reconnect;
    private final Executor ioExecutor;
    private final SubscriptionMetrics metrics;
    private final TransactionHydrator hydrator;
    private boolean closed;

    public SubscriptionRegistry(
            final ChainTransport transport,
            final EventDispatcher dispatcher,
            final ReconnectController reconnect,
            final Executor ioExecutor,
            final SubscriptionMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.reconnect = Objects.requireNonNull(reconnect, "reconnect");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.hydrator = new TransactionHydrator(transport);
    }

    /**
     * Adds a callback. The first callback of a key starts its watch before this returns.
     *
     * @return handle removing exactly this callback
     * @throws TransportStartException if the watch for a new key cannot be started;
     *                                 the registration is rolled back
     * @throws IllegalStateException   after {@link #close()}
     */
    public <E> Subscription register(final SubscriptionKey<E> key, final EventCallback<? super E> callback) {
        return add(key, callback, EventAbi.empty());
    }

    /**
     * Like {@link #register}, with an ABI used to narrow the watch to the event's topic.
     * The ABI of the first registration of a key is the one the watch uses.
     */
    public Subscription registerContractEvent(
            final SubscriptionKey.ContractEvent key,
            final EventCallback<? super LogEntry> callback,
            final EventAbi abi) {
        return add(key, callback, Objects.requireNonNull(abi, "abi"));
    }

    /**
     * Removes every callback of {@code key} and stops its watch. No-op for unknown keys.
     */
    public void unregister(final SubscriptionKey<?> key) {
        unregisterAll(key::equals);
    }

    /**
     * Removes every key the selector matches.
     *
     * @return number of keys removed
     */
    public int unregisterAll(final Predicate<SubscriptionKey<?>> selector) {
        final List<SubscriptionState> removed = new ArrayList<>();
        synchronized (lock) {
            states.values().removeIf(state -> {
                if (!selector.test(state.key)) {
                    return false;
                }
                removed.add(state);
                return true;
            });
            removed.forEach(this::detach);
        }
        removed.forEach(this::stopped);
        return removed.size();
    }

    /**
     * Starts a fresh retry sequence for a key: cancels any pending retry, zeroes its
     * attempts and reopens the watch. Revives stalled keys.
     *
     * @return false when the key has no callbacks
     */
    public boolean restart(final SubscriptionKey<?> key) {
        final SubscriptionState state;
        final WatchHandle previous;
        synchronized (lock) {
            state = states.get(key);
            if (closed || state == null || state.callbacks.isEmpty()) {
                return false;
            }
            reconnect.reset(state.reconnect);
            previous = state.handle;
            state.handle = null;
            state.generation++;
        }
        log.info("Restarting watch for {}", key.label());
        cancelQuietly(key, previous);
        startOrBackoff(state);
        return true;
    }

    public boolean isActive(final SubscriptionKey<?> key) {
        synchronized (lock) {
            return states.containsKey(key);
        }
    }

    public boolean isWatchOpen(final SubscriptionKey<?> key) {
        synchronized (lock) {
            final SubscriptionState state = states.get(key);
            return state != null && state.handle != null;
        }
    }

    public int callbackCount(final SubscriptionKey<?> key) {
        synchronized (lock) {
            final SubscriptionState state = states.get(key);
            return state == null ? 0 : state.callbacks.size();
        }
    }

    public List<SubscriptionKey<?>> activeKeys() {
        synchronized (lock) {
            return List.copyOf(states.keySet());
        }
    }

    public Optional<SubscriptionStatus> status(final SubscriptionKey<?> key) {
        synchronized (lock) {
            final SubscriptionState state = states.get(key);
            if (state == null) {
                return Optional.empty();
            }
            return Optional.of(new SubscriptionStatus(
                    key,
                    state.reconnect.phase(),
                    state.reconnect.attempts(),
                    state.callbacks.size(),
                    state.handle != null));
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * Drops every key, cancelling watches and retry timers, and refuses further
     * registrations. Idempotent.
     */
    public void close() {
        final List<SubscriptionState> removed;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            reconnect.close();
            removed = new ArrayList<>(states.values());
            states.clear();
            removed.forEach(this::detach);
        }
        removed.forEach(this::stopped);
    }

    @SuppressWarnings("unchecked")
    private Subscription add(final SubscriptionKey<?> key, final EventCallback<?> callback, final EventAbi abi) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(callback, "callback");
        final EventCallback<Object> cb = (EventCallback<Object>) callback;
        final SubscriptionState state;
        final boolean first;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("ChainWatcher is closed");
            }
            final SubscriptionState existing = states.get(key);
            first = existing == null;
            state = first ? new SubscriptionState(key, abi, reconnect.newState()) : existing;
            if (first) {
                states.put(key, state);
            }
            if (!state.contains(cb)) {
                state.callbacks.add(cb);
            }
        }
        if (first) {
            DebugLogger.logSubscription(LogFormatter.formatWatch("start", key.label()));
            final StartFailure failure = openWatch(state);
            if (failure != null) {
                rollbackOrBackoff(state, cb, failure);
            }
        }
        return new Handle(state, cb);
    }

    /**
     * The first start of a key failed. If the caller is still the only interested party,
     * undo the registration and report the failure to it; otherwise other callers are
     * waiting on the key, so treat it as a stream failure.
     */
    private void rollbackOrBackoff(
            final SubscriptionState state, final EventCallback<Object> cb, final StartFailure failure) {
        synchronized (lock) {
            if (!isCurrent(state, failure.generation())) {
                return;
            }
            final boolean alone = state.callbacks.size() == 1 && state.contains(cb);
            if (!alone) {
                state.generation++;
                reconnect.onError(state.key, state.reconnect, failure.error(), () -> retry(state));
                return;
            }
            states.remove(state.key);
            detach(state);
        }
        final RuntimeException error = failure.error();
        if (error instanceof TransportStartException tse) {
            throw tse;
        }
        throw new TransportStartException("Could not start watch for " + state.key.label(), error);
    }

    private void retry(final SubscriptionState state) {
        synchronized (lock) {
            reconnect.onTimerFired(state.reconnect);
            if (closed || states.get(state.key) != state || state.callbacks.isEmpty()) {
                return;
            }
        }
        startOrBackoff(state);
    }

    private void startOrBackoff(final SubscriptionState state) {
        final StartFailure failure = openWatch(state);
        if (failure == null) {
            return;
        }
        synchronized (lock) {
            if (!isCurrent(state, failure.generation())) {
                return;
            }
            log.warn("Could not restart watch for {}: {}", state.key.label(), failure.error().toString());
            state.generation++;
            reconnect.onError(state.key, state.reconnect, failure.error(), () -> retry(state));
        }
    }

    /**
     * Opens a watch for {@code state} under a new generation.
     *
     * @return the failure if the transport refused, otherwise {@code null}
     */
    private @Nullable StartFailure openWatch(final SubscriptionState state) {
        final long generation;
        synchronized (lock) {
            if (closed || states.get(state.key) != state) {
                return null;
            }
            generation = ++state.generation;
        }
        final WatchHandle handle;
        try {
            handle = open(state, generation);
        } catch (RuntimeException e) {
            return new StartFailure(generation, e);
        }
        final boolean accepted;
        synchronized (lock) {
            accepted = isCurrent(state, generation);
            if (accepted) {
                state.handle = handle;
                reconnect.onStarted(state.reconnect);
            }
        }
        if (!accepted) {
            // superseded while opening
            cancelQuietly(state.key, handle);
            return null;
        }
        log.debug("Watch started for {}", state.key.label());
        metrics.onWatchStarted(state.key);
        return null;
    }

    private WatchHandle open(final SubscriptionState state, final long generation) {
        final SubscriptionKey<?> key = state.key;
        final Consumer<Throwable> onError = error -> onWatchError(state, generation, error);
        if (key instanceof SubscriptionKey.Blocks) {
            return transport.watchBlocks(block -> onData(state, generation, List.of(block)), onError);
        }
        if (key instanceof SubscriptionKey.PendingTransactions) {
            return transport.watchPendingTransactions(hashes -> onPendingHashes(state, generation, hashes), onError);
        }
        final SubscriptionKey.ContractEvent event = (SubscriptionKey.ContractEvent) key;
        return transport.watchContractEvent(
                filterFor(event, state.abi), logs -> onData(state, generation, logs), onError);
    }

    static ContractEventFilter filterFor(final SubscriptionKey.ContractEvent key, final EventAbi abi) {
        final Optional<EventSignature> signature = abi.find(key.eventName());
        if (signature.isEmpty() && !abi.isEmpty()) {
            log.debug("ABI has no event {}, watching all logs of {}", key.eventName(), key.contractAddress().value());
        }
        return new ContractEventFilter(key.contractAddress(), signature.orElse(null));
    }

    private void onData(final SubscriptionState state, final long generation, final List<?> events) {
        final List<EventCallback<Object>> snapshot;
        synchronized (lock) {
            if (!isCurrent(state, generation)) {
                return;
            }
            reconnect.onData(state.reconnect);
            snapshot = List.copyOf(state.callbacks);
        }
        dispatcher.dispatch(state.key, snapshot, events, cb -> isRegistered(state, cb));
    }

    private void onPendingHashes(final SubscriptionState state, final long generation, final List<Hash> hashes) {
        synchronized (lock) {
            if (!isCurrent(state, generation)) {
                return;
            }
            reconnect.onData(state.reconnect);
            if (hashes.isEmpty()) {
                return;
            }
            state.lookups = state.lookups
                    .thenRunAsync(() -> deliverTransactions(state, hydrator.hydrate(hashes)), ioExecutor)
                    .exceptionally(error -> {
                        logDroppedLookup(state, hashes.size(), error);
                        return null;
                    });
        }
    }

    private static void logDroppedLookup(final SubscriptionState state, final int count, final Throwable error) {
        final Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof RejectedExecutionException) {
            log.debug("I/O executor stopped, dropping {} pending transactions", count);
        } else {
            log.warn("Lookup of {} pending transactions for {} failed", count, state.key.label(), cause);
        }
    }

    private void deliverTransactions(final SubscriptionState state, final List<Transaction> transactions) {
        if (transactions.isEmpty()) {
            return;
        }
        final List<EventCallback<Object>> snapshot;
        synchronized (lock) {
            if (closed || states.get(state.key) != state) {
                return;
            }
            snapshot = List.copyOf(state.callbacks);
        }
        dispatcher.dispatch(state.key, snapshot, transactions, cb -> isRegistered(state, cb));
    }

    private void onWatchError(final SubscriptionState state, final long generation, final Throwable error) {
        final WatchHandle failed;
        synchronized (lock) {
            if (!isCurrent(state, generation)) {
                return;
            }
            log.warn("Watch for {} failed: {}", state.key.label(), error.toString());
            state.generation++;
            failed = state.handle;
            state.handle = null;
            reconnect.onError(state.key, state.reconnect, error, () -> retry(state));
        }
        metrics.onStreamError(state.key, error);
        cancelQuietly(state.key, failed);
    }

    private void removeCallback(final SubscriptionState state, final EventCallback<Object> callback) {
        synchronized (lock) {
            if (states.get(state.key) != state || !state.remove(callback)) {
                return;
            }
            if (!state.callbacks.isEmpty()) {
                return;
            }
            states.remove(state.key);
            detach(state);
        }
        stopped(state);
    }

    boolean isRegistered(final SubscriptionState state, final EventCallback<?> callback) {
        synchronized (lock) {
            return !closed && states.get(state.key) == state && state.contains(callback);
        }
    }

    // caller holds lock
    private boolean isCurrent(final SubscriptionState state, final long generation) {
        return !closed && states.get(state.key) == state && state.generation == generation;
    }

    // caller holds lock; the handle is cancelled afterwards by stopped()
    private void detach(final SubscriptionState state) {
        state.generation++;
        state.callbacks.clear();
        reconnect.discard(state.reconnect);
    }

    private void stopped(final SubscriptionState state) {
        final WatchHandle handle;
        synchronized (lock) {
            handle = state.handle;
            state.handle = null;
        }
        cancelQuietly(state.key, handle);
        DebugLogger.logSubscription(LogFormatter.formatWatch("stop", state.key.label()));
        log.debug("Watch stopped for {}", state.key.label());
        metrics.onWatchStopped(state.key);
    }

    private static void cancelQuietly(final SubscriptionKey<?> key, final @Nullable WatchHandle handle) {
        if (handle == null) {
            return;
        }
        try {
            handle.cancel();
        } catch (RuntimeException e) {
            log.warn("Failed to cancel watch for {}", key.label(), e);
        }
    }

    private record StartFailure(long generation, RuntimeException error) {
    }

    private final class Handle implements Subscription {
        private final SubscriptionState state;
        private final EventCallback<Object> callback;

        Handle(final SubscriptionState state, final EventCallback<Object> callback) {
            this.state = state;
            this.callback = callback;
        }

        @Override
        public SubscriptionKey<?> key() {
            return state.key;
        }

        @Override
        public void unsubscribe() {
            removeCallback(state, callback);
        }

        @Override
        public boolean isActive() {
            return isRegistered(state, callback);
        }
    }
}
