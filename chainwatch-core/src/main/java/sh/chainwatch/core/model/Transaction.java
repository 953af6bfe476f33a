// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.model;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.chainwatch.core.types.Address;
import sh.chainwatch.core.types.Hash;
import sh.chainwatch.core.types.HexData;

/**
 * A transaction as returned by {@code eth_getTransactionByHash}.
 * <p>
 * Pending transactions have no {@code blockNumber}; contract creations have no {@code to}.
 *
 * @since 0.1.0
 */
public record Transaction(
        Hash hash,
        Address from,
        Optional<Address> to,
        HexData input,
        BigInteger value,
        long nonce,
        @Nullable Long blockNumber) {

    public Transaction {
        Objects.requireNonNull(hash, "hash is required");
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(input, "input is required");
        Objects.requireNonNull(value, "value is required");
        to = to != null ? to : Optional.empty();
    }

    public boolean isPending() {
        return blockNumber == null;
    }
}
