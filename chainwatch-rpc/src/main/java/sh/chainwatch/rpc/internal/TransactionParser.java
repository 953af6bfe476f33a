// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.internal;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.chainwatch.core.model.Transaction;
import sh.chainwatch.core.types.Address;
import sh.chainwatch.core.types.Hash;
import sh.chainwatch.core.types.HexData;

/**
 * Parses {@code eth_getTransactionByHash} results.
 */
public final class TransactionParser {

    private TransactionParser() {
    }

    /**
     * @throws IllegalArgumentException if {@code hash} or {@code from} is missing or malformed
     */
    public static Transaction parse(final Map<String, Object> map) {
        final String hash = RpcUtils.stringValue(map.get("hash"));
        final String from = RpcUtils.stringValue(map.get("from"));
        if (hash == null || from == null) {
            throw new IllegalArgumentException("incomplete transaction: " + map.keySet());
        }
        final @Nullable String to = RpcUtils.stringValue(map.get("to"));
        final @Nullable String input = RpcUtils.stringValue(map.get("input"));
        final @Nullable BigInteger value = RpcUtils.decodeHexBigInteger(map.get("value"));
        final @Nullable Long nonce = RpcUtils.decodeHexLong(map.get("nonce"));
        return new Transaction(
                new Hash(hash),
                new Address(from),
                Optional.ofNullable(to).map(Address::new),
                input != null ? new HexData(input) : HexData.EMPTY,
                value != null ? value : BigInteger.ZERO,
                nonce != null ? nonce : 0L,
                RpcUtils.decodeHexLong(map.get("blockNumber")));
    }
}
