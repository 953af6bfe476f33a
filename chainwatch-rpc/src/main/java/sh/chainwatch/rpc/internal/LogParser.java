// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.internal;

import static sh.chainwatch.rpc.internal.RpcUtils.MAPPER;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;

import sh.chainwatch.core.model.LogEntry;
import sh.chainwatch.core.types.Address;
import sh.chainwatch.core.types.Hash;
import sh.chainwatch.core.types.HexData;

/**
 * Parses log objects from {@code eth_getLogs} results and {@code logs} notifications.
 *
 * <p><strong>Null Handling:</strong>
 * <ul>
 *   <li>{@code address}, {@code transactionHash} - required</li>
 *   <li>{@code data} - missing maps to {@link HexData#EMPTY}</li>
 *   <li>{@code blockHash}, {@code blockNumber} - null for pending logs</li>
 *   <li>{@code topics} - missing maps to an empty list</li>
 *   <li>{@code logIndex} - missing maps to 0</li>
 *   <li>{@code removed} - missing maps to false</li>
 * </ul>
 */
public final class LogParser {

    private LogParser() {
    }

    /**
     * @param value a JSON array of log objects, as decoded by Jackson; {@code null} yields an empty list
     */
    public static List<LogEntry> parseLogs(final @Nullable Object value) {
        if (value == null) {
            return List.of();
        }
        final List<Map<String, Object>> raw = MAPPER.convertValue(
                value, new TypeReference<List<Map<String, Object>>>() {});
        final List<LogEntry> logs = new ArrayList<>(raw.size());
        for (Map<String, Object> map : raw) {
            logs.add(parseLog(map));
        }
        return List.copyOf(logs);
    }

    /**
     * Parses the single log carried by a {@code logs} subscription notification.
     */
    public static LogEntry parseNotification(final Object value) {
        final Map<String, Object> map = MAPPER.convertValue(value, new TypeReference<Map<String, Object>>() {});
        if (map == null) {
            throw new IllegalArgumentException("log notification is null");
        }
        return parseLog(map);
    }

    /**
     * @throws NullPointerException     if {@code address} or {@code transactionHash} is missing
     * @throws IllegalArgumentException if a field is not valid hex
     */
    public static LogEntry parseLog(final Map<String, Object> map) {
        final @Nullable String address = RpcUtils.stringValue(map.get("address"));
        final @Nullable String data = RpcUtils.stringValue(map.get("data"));
        final @Nullable String blockHash = RpcUtils.stringValue(map.get("blockHash"));
        final @Nullable String txHash = RpcUtils.stringValue(map.get("transactionHash"));
        final @Nullable Long logIndex = RpcUtils.decodeHexLong(map.get("logIndex"));

        final @Nullable List<String> topicsHex = MAPPER.convertValue(
                map.get("topics"), new TypeReference<List<String>>() {});
        final List<Hash> topics = topicsHex != null
                ? topicsHex.stream().map(Hash::new).toList()
                : List.of();

        if (address == null) {
            throw new NullPointerException("log without address: " + map);
        }
        if (txHash == null) {
            throw new NullPointerException("log without transactionHash: " + map);
        }
        return new LogEntry(
                new Address(address),
                data != null ? new HexData(data) : HexData.EMPTY,
                topics,
                blockHash != null ? new Hash(blockHash) : null,
                RpcUtils.decodeHexLong(map.get("blockNumber")),
                new Hash(txHash),
                logIndex != null ? logIndex : 0L,
                Boolean.TRUE.equals(map.get("removed")));
    }
}
