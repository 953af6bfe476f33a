// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.chainwatch.core.model.Transaction;
import sh.chainwatch.core.types.Hash;
import sh.chainwatch.rpc.ChainTransport;

/**
 * Resolves pending transaction hashes to full transactions. Blocking; runs on the I/O executor.
 */
final class TransactionHydrator {

    private static final Logger log = LoggerFactory.getLogger(TransactionHydrator.class);

    private final ChainTransport transport;

    TransactionHydrator(final ChainTransport transport) {
        this.transport = transport;
    }

    /**
     * @return transactions in hash order; hashes that fail or are no longer known are skipped
     */
    List<Transaction> hydrate(final List<Hash> hashes) {
        final List<Transaction> result = new ArrayList<>(hashes.size());
        for (Hash hash : hashes) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                final Optional<Transaction> tx = transport.getTransaction(hash);
                if (tx.isPresent()) {
                    result.add(tx.get());
                } else {
                    log.debug("Pending transaction {} no longer known, skipping", hash.value());
                }
            } catch (RuntimeException e) {
                log.warn("Failed to fetch pending transaction {}: {}", hash.value(), e.getMessage());
            }
        }
        return result;
    }
}
