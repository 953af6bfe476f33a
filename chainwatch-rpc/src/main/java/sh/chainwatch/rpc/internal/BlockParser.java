// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.internal;

import static sh.chainwatch.rpc.internal.RpcUtils.MAPPER;

import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;

import sh.chainwatch.core.model.BlockHeader;
import sh.chainwatch.core.types.Hash;

/**
 * Parses block headers from {@code newHeads} notifications.
 */
public final class BlockParser {

    private BlockParser() {
    }

    /**
     * @throws IllegalArgumentException if {@code hash}, {@code parentHash} or {@code number} is missing or malformed
     */
    public static BlockHeader parseHeader(final Object value) {
        final Map<String, Object> map = MAPPER.convertValue(value, new TypeReference<Map<String, Object>>() {});
        if (map == null) {
            throw new IllegalArgumentException("block header is null");
        }
        final String hash = RpcUtils.stringValue(map.get("hash"));
        final String parentHash = RpcUtils.stringValue(map.get("parentHash"));
        final Long number = RpcUtils.decodeHexLong(map.get("number"));
        if (hash == null || parentHash == null || number == null) {
            throw new IllegalArgumentException("incomplete block header: " + map.keySet());
        }
        final Long timestamp = RpcUtils.decodeHexLong(map.get("timestamp"));
        return new BlockHeader(
                new Hash(hash),
                number,
                new Hash(parentHash),
                timestamp != null ? timestamp : 0L,
                RpcUtils.decodeHexBigInteger(map.get("baseFeePerGas")));
    }
}
