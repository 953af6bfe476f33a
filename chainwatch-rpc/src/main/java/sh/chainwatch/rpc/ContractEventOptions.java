// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.chainwatch.core.abi.EventAbi;

/**
 * Optional settings of {@link ChainWatcher#onContractEvent(sh.chainwatch.core.types.Address, String,
 * ContractEventListener, ContractEventOptions)}.
 *
 * <pre>{@code
 * ContractEventOptions options = ContractEventOptions.builder()
 *         .abi(EventAbi.of("event Transfer(address indexed from, address indexed to, uint256 value)"))
 *         .fromBlock(19_000_000L)
 *         .build();
 * }</pre>
 *
 * @param abi       declarations used to narrow the watch to the event's topic; empty watches all logs
 * @param fromBlock when set, past events from this block are replayed before/alongside live ones
 * @param toBlock   last block of the replay, or {@code null} for the chain head at registration
 */
public record ContractEventOptions(EventAbi abi, @Nullable Long fromBlock, @Nullable Long toBlock) {

    private static final ContractEventOptions NONE = new ContractEventOptions(EventAbi.empty(), null, null);

    public ContractEventOptions {
        Objects.requireNonNull(abi, "abi");
        if (fromBlock == null && toBlock != null) {
            throw new IllegalArgumentException("toBlock requires fromBlock");
        }
    }

    public static ContractEventOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean wantsBackfill() {
        return fromBlock != null;
    }

    public static final class Builder {
        private EventAbi abi = EventAbi.empty();
        private @Nullable Long fromBlock;
        private @Nullable Long toBlock;

        private Builder() {
        }

        public Builder abi(final EventAbi abi) {
            this.abi = abi;
            return this;
        }

        public Builder fromBlock(final long fromBlock) {
            this.fromBlock = fromBlock;
            return this;
        }

        public Builder toBlock(final long toBlock) {
            this.toBlock = toBlock;
            return this;
        }

        public ContractEventOptions build() {
            return new ContractEventOptions(abi, fromBlock, toBlock);
        }
    }
}
