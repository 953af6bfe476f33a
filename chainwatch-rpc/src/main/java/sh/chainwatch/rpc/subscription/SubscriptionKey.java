// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.util.Objects;

import sh.chainwatch.core.model.BlockHeader;
import sh.chainwatch.core.model.LogEntry;
import sh.chainwatch.core.model.Transaction;
import sh.chainwatch.core.types.Address;

/**
 * Identifies one live watch. All callbacks registered under equal keys share a single
 * transport watch.
 *
 * @param <E> type of the events delivered under this key
 */
public sealed interface SubscriptionKey<E>
        permits SubscriptionKey.Blocks, SubscriptionKey.PendingTransactions, SubscriptionKey.ContractEvent {

    Blocks BLOCKS = new Blocks();

    PendingTransactions PENDING_TRANSACTIONS = new PendingTransactions();

    static ContractEvent contractEvent(final Address contractAddress, final String eventName) {
        return new ContractEvent(contractAddress, eventName);
    }

    /**
     * Short form for log lines, e.g. {@code blocks} or {@code 0xa0b8...:Transfer}.
     */
    String label();

    /** New block headers. */
    record Blocks() implements SubscriptionKey<BlockHeader> {
        @Override
        public String label() {
            return "blocks";
        }
    }

    /** Transactions entering the mempool, resolved from their hashes. */
    record PendingTransactions() implements SubscriptionKey<Transaction> {
        @Override
        public String label() {
            return "pending-transactions";
        }
    }

    /**
     * Logs of one named event on one contract. The address is already lowercase,
     * so differently-cased spellings produce equal keys.
     */
    record ContractEvent(Address contractAddress, String eventName) implements SubscriptionKey<LogEntry> {

        public ContractEvent {
            Objects.requireNonNull(contractAddress, "contractAddress");
            Objects.requireNonNull(eventName, "eventName");
            if (eventName.isBlank()) {
                throw new IllegalArgumentException("eventName cannot be blank");
            }
        }

        public boolean matches(final Address address) {
            return contractAddress.equals(address);
        }

        @Override
        public String label() {
            return contractAddress.value() + ":" + eventName;
        }
    }
}
