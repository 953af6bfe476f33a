// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.chainwatch.core.abi.EventAbi;
import sh.chainwatch.core.types.Address;
import sh.chainwatch.rpc.ContractEventFilter;

/**
 * A one-shot scan of past logs of one contract event.
 *
 * @param contractAddress contract emitting the event
 * @param eventName       event name, looked up in {@code abi} to narrow the scan to its topic
 * @param fromBlock       first block, negative values are clamped to 0
 * @param toBlock         last block inclusive, or {@code null} for the chain head at scan time
 * @param abi             event declarations, possibly empty
 */
public record BackfillRequest(
        Address contractAddress,
        String eventName,
        long fromBlock,
        @Nullable Long toBlock,
        EventAbi abi) {

    public BackfillRequest {
        Objects.requireNonNull(contractAddress, "contractAddress");
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(abi, "abi");
    }

    public SubscriptionKey.ContractEvent key() {
        return SubscriptionKey.contractEvent(contractAddress, eventName);
    }

    public ContractEventFilter filter() {
        return SubscriptionRegistry.filterFor(key(), abi);
    }
}
