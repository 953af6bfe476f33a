// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import sh.chainwatch.core.model.Transaction;
import sh.chainwatch.rpc.subscription.EventCallback;

/**
 * Receives pending transactions as they enter the node's mempool.
 */
@FunctionalInterface
public interface TransactionListener extends EventCallback<Transaction> {
}
