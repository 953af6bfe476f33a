// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.model;

import java.math.BigInteger;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.chainwatch.core.types.Hash;

/**
 * Header of a newly produced block, as pushed by a {@code newHeads} subscription.
 *
 * @param hash          block hash
 * @param number        block height
 * @param parentHash    hash of the parent block
 * @param timestamp     unix seconds
 * @param baseFeePerGas base fee in wei; {@code null} before London
 * @since 0.1.0
 */
public record BlockHeader(
        Hash hash,
        long number,
        Hash parentHash,
        long timestamp,
        @Nullable BigInteger baseFeePerGas) {

    public BlockHeader {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(parentHash, "parentHash cannot be null");
        if (number < 0) {
            throw new IllegalArgumentException("number cannot be negative: " + number);
        }
    }
}
