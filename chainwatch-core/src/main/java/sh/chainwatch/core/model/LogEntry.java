// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.chainwatch.core.types.Address;
import sh.chainwatch.core.types.Hash;
import sh.chainwatch.core.types.HexData;

/**
 * A contract log emitted during transaction execution.
 *
 * <p>{@code blockHash} and {@code blockNumber} are {@code null} for logs of pending
 * transactions. {@code removed} is set when a chain reorganization dropped the log.
 *
 * @since 0.1.0
 */
public record LogEntry(
        Address address,
        HexData data,
        List<Hash> topics,
        @Nullable Hash blockHash,
        @Nullable Long blockNumber,
        Hash transactionHash,
        long logIndex,
        boolean removed) {

    /**
     * Chain order: ascending block number, then ascending log index.
     * A missing block number sorts as block zero.
     */
    public static final Comparator<LogEntry> CHAIN_ORDER =
            Comparator.comparingLong(LogEntry::blockNumberOrZero)
                    .thenComparingLong(LogEntry::logIndex);

    public LogEntry {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        topics = List.copyOf(topics);
    }

    /**
     * @return the event selector (first topic), or {@code null} for anonymous events
     */
    public @Nullable Hash topic0() {
        return topics.isEmpty() ? null : topics.get(0);
    }

    long blockNumberOrZero() {
        return blockNumber == null ? 0L : blockNumber;
    }
}
