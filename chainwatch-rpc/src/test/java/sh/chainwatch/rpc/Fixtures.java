// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import sh.chainwatch.core.model.BlockHeader;
import sh.chainwatch.core.model.LogEntry;
import sh.chainwatch.core.model.Transaction;
import sh.chainwatch.core.types.Address;
import sh.chainwatch.core.types.Hash;
import sh.chainwatch.core.types.HexData;

/**
 * Compact builders for chain objects used across tests.
 */
public final class Fixtures {

    public static final Address TOKEN = new Address("0xAAAaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa");
    public static final Address OTHER = new Address("0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb");
    public static final String TRANSFER_DECL =
            "event Transfer(address indexed from, address indexed to, uint256 value)";

    private Fixtures() {
    }

    public static Hash hash(final long n) {
        return new Hash(String.format("0x%064x", n));
    }

    public static BlockHeader header(final long number) {
        return new BlockHeader(hash(1_000 + number), number, hash(999 + number), 1_700_000_000L + number, null);
    }

    public static LogEntry log(final long block, final long index) {
        return log(TOKEN, block, index);
    }

    public static LogEntry log(final Address address, final long block, final long index) {
        return new LogEntry(address, HexData.EMPTY, List.of(), hash(block), block,
                hash(block * 100 + index), index, false);
    }

    public static Transaction tx(final long n) {
        return new Transaction(hash(n), OTHER, Optional.of(TOKEN), HexData.EMPTY, BigInteger.ONE, n, null);
    }
}
