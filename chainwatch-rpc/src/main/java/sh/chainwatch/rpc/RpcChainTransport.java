// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.chainwatch.core.error.RpcException;
import sh.chainwatch.core.error.TransportStartException;
import sh.chainwatch.core.model.BlockHeader;
import sh.chainwatch.core.model.LogEntry;
import sh.chainwatch.core.model.Transaction;
import sh.chainwatch.core.types.Hash;
import sh.chainwatch.rpc.internal.BlockParser;
import sh.chainwatch.rpc.internal.LogParser;
import sh.chainwatch.rpc.internal.RpcUtils;
import sh.chainwatch.rpc.internal.TransactionParser;

/**
 * {@link ChainTransport} over JSON-RPC.
 *
 * <ul>
 * <li>Reads use {@code eth_blockNumber}, {@code eth_getBlockByNumber},
 * {@code eth_getTransactionByHash} and {@code eth_getLogs}, retried on transient errors.</li>
 * <li>Watches use {@code eth_subscribe} with {@code newHeads},
 * {@code newPendingTransactions} and {@code logs}, and need a provider that can push,
 * such as {@link WebSocketRpcProvider}.</li>
 * </ul>
 *
 * <p>A notification that cannot be parsed is logged and dropped; the watch stays up.
 * Reads and watches may use separate providers, e.g. HTTP for reads and a WebSocket
 * for subscriptions.
 */
public final class RpcChainTransport implements ChainTransport {

    private static final Logger log = LoggerFactory.getLogger(RpcChainTransport.class);

    static final int DEFAULT_READ_ATTEMPTS = 3;

    private final RpcProvider reads;
    private final RpcProvider provider;
    private final int readAttempts;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RpcChainTransport(final RpcProvider provider) {
        this(provider, provider, DEFAULT_READ_ATTEMPTS);
    }

    public RpcChainTransport(final RpcProvider provider, final int readAttempts) {
        this(provider, provider, readAttempts);
    }

    /**
     * Splits traffic over two connections: {@code reads} answers the one-shot calls,
     * {@code subscriptions} carries the watches. Both are closed with this transport.
     */
    public RpcChainTransport(final RpcProvider reads, final RpcProvider subscriptions) {
        this(reads, subscriptions, DEFAULT_READ_ATTEMPTS);
    }

    public RpcChainTransport(final RpcProvider reads, final RpcProvider subscriptions, final int readAttempts) {
        this.reads = Objects.requireNonNull(reads, "reads");
        this.provider = Objects.requireNonNull(subscriptions, "subscriptions");
        if (readAttempts < 1) {
            throw new IllegalArgumentException("readAttempts must be >= 1");
        }
        this.readAttempts = readAttempts;
    }

    @Override
    public long getBlockNumber() {
        final JsonRpcResponse response = sendWithRetry("eth_blockNumber", List.of());
        final Long number = RpcUtils.decodeHexLong(response.result());
        if (number == null) {
            throw new RpcException(-32000, "eth_blockNumber returned null", null, null);
        }
        return number;
    }

    @Override
    public Optional<BlockHeader> getBlock(final long number) {
        final JsonRpcResponse response =
                sendWithRetry("eth_getBlockByNumber", List.of(RpcUtils.toHexBlock(number), Boolean.FALSE));
        final Map<String, Object> block = response.resultAsMap();
        return block == null ? Optional.empty() : Optional.of(BlockParser.parseHeader(block));
    }

    @Override
    public Optional<Transaction> getTransaction(final Hash hash) {
        Objects.requireNonNull(hash, "hash");
        final JsonRpcResponse response = sendWithRetry("eth_getTransactionByHash", List.of(hash.value()));
        final Map<String, Object> tx = response.resultAsMap();
        return tx == null ? Optional.empty() : Optional.of(TransactionParser.parse(tx));
    }

    @Override
    public List<LogEntry> getLogs(final LogQuery query) {
        Objects.requireNonNull(query, "query");
        final JsonRpcResponse response = sendWithRetry("eth_getLogs", List.of(query.toRpcParams()));
        return LogParser.parseLogs(response.result());
    }

    @Override
    public WatchHandle watchBlocks(final Consumer<BlockHeader> onBlock, final Consumer<Throwable> onError) {
        Objects.requireNonNull(onBlock, "onBlock");
        return watch("newHeads", List.of(), BlockParser::parseHeader, onBlock, onError);
    }

    @Override
    public WatchHandle watchPendingTransactions(
            final Consumer<List<Hash>> onTransactions, final Consumer<Throwable> onError) {
        Objects.requireNonNull(onTransactions, "onTransactions");
        return watch("newPendingTransactions", List.of(),
                result -> List.of(new Hash(result.toString())), onTransactions, onError);
    }

    @Override
    public WatchHandle watchContractEvent(
            final ContractEventFilter filter,
            final Consumer<List<LogEntry>> onLogs,
            final Consumer<Throwable> onError) {
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(onLogs, "onLogs");
        return watch("logs", List.of(filter.toRpcParams()),
                result -> List.of(LogParser.parseNotification(result)),
                onLogs, onError);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            provider.close();
            if (reads != provider) {
                reads.close();
            }
        }
    }

    private <T> WatchHandle watch(
            final String kind,
            final List<?> params,
            final Function<Object, T> parser,
            final Consumer<T> onData,
            final Consumer<Throwable> onError) {
        Objects.requireNonNull(onError, "onError");
        if (closed.get()) {
            throw new TransportStartException("Transport is closed");
        }
        final String subscriptionId;
        try {
            subscriptionId = provider.subscribe(kind, params, result -> {
                final T parsed;
                try {
                    parsed = parser.apply(result);
                } catch (RuntimeException e) {
                    log.warn("Dropping malformed {} notification: {}", kind, e.getMessage());
                    return;
                }
                onData.accept(parsed);
            }, onError);
        } catch (UnsupportedOperationException e) {
            throw new TransportStartException(
                    "Provider " + provider.getClass().getSimpleName() + " cannot push " + kind + " notifications", e);
        } catch (RpcException e) {
            throw new TransportStartException("eth_subscribe(" + kind + ") failed: " + e.getMessage(), e);
        }
        final AtomicBoolean cancelled = new AtomicBoolean(false);
        return () -> {
            if (cancelled.compareAndSet(false, true) && !closed.get()) {
                try {
                    provider.unsubscribe(subscriptionId);
                } catch (RpcException e) {
                    // the subscription dies with the connection anyway
                    log.debug("eth_unsubscribe({}) failed: {}", subscriptionId, e.getMessage());
                }
            }
        };
    }

    private JsonRpcResponse sendWithRetry(final String method, final List<?> params) {
        return RpcRetry.run(() -> reads.send(method, params), readAttempts);
    }
}
