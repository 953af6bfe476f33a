// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import sh.chainwatch.core.error.RpcException;
import sh.chainwatch.core.error.TransportStartException;
import sh.chainwatch.core.model.BlockHeader;
import sh.chainwatch.core.model.LogEntry;
import sh.chainwatch.core.model.Transaction;
import sh.chainwatch.core.types.Hash;

/**
 * What the subscription machinery needs from a chain connection: a few bounded
 * reads and three kinds of live watch.
 *
 * <p>Each {@code watch*} call either throws {@link TransportStartException} or returns
 * a handle for a running watch. A running watch reports at most one failure through
 * its {@code onError} handler and delivers nothing afterwards; restarting is up to the caller.
 * Data and error handlers may be invoked on any thread.
 *
 * @see RpcChainTransport
 */
public interface ChainTransport extends AutoCloseable {

    /**
     * @throws RpcException if the read fails
     */
    long getBlockNumber();

    /**
     * @throws RpcException if the read fails
     */
    Optional<BlockHeader> getBlock(long number);

    /**
     * @return the transaction, or empty when the node no longer knows the hash
     * @throws RpcException if the read fails
     */
    Optional<Transaction> getTransaction(Hash hash);

    /**
     * @return matching logs in the order the node returned them
     * @throws RpcException if the read fails
     */
    List<LogEntry> getLogs(LogQuery query);

    WatchHandle watchBlocks(Consumer<BlockHeader> onBlock, Consumer<Throwable> onError);

    /**
     * @param onTransactions receives hashes of transactions entering the mempool
     */
    WatchHandle watchPendingTransactions(Consumer<List<Hash>> onTransactions, Consumer<Throwable> onError);

    WatchHandle watchContractEvent(
            ContractEventFilter filter, Consumer<List<LogEntry>> onLogs, Consumer<Throwable> onError);

    /**
     * Releases the connection. Idempotent.
     */
    @Override
    void close();
}
