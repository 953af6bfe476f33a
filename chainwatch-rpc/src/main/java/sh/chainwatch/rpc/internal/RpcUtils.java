// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.internal;

import java.math.BigInteger;
import java.util.Map;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import sh.chainwatch.primitives.Hex;

/**
 * Shared helpers for reading JSON-RPC payloads.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class RpcUtils {

    /**
     * Shared mapper. Unknown properties are ignored because nodes add
     * client-specific fields to blocks and transactions.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private RpcUtils() {
    }

    public static @Nullable String stringValue(final @Nullable Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Decodes a quantity field that may be absent.
     *
     * @return the value, or {@code null} when the field is missing or JSON null
     */
    public static @Nullable Long decodeHexLong(final @Nullable Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        return Hex.decodeQuantity(value.toString());
    }

    public static @Nullable BigInteger decodeHexBigInteger(final @Nullable Object value) {
        if (value == null) {
            return null;
        }
        final String digits = Hex.cleanPrefix(value.toString());
        return digits.isEmpty() ? BigInteger.ZERO : new BigInteger(digits, 16);
    }

    public static String toHexBlock(final long block) {
        return Hex.encodeQuantity(block);
    }

    /**
     * Flattens the {@code data} member of a JSON-RPC error. Nodes nest it in
     * different ways ({@code "0x.."}, {@code {"data":"0x.."}}, {@code ["..."]});
     * the first string found wins.
     */
    public static @Nullable String extractErrorData(final @Nullable Object data) {
        if (data == null) {
            return null;
        }
        if (data instanceof String s) {
            return s;
        }
        if (data instanceof Map<?, ?> map) {
            for (Object nested : map.values()) {
                final String found = extractErrorData(nested);
                if (found != null) {
                    return found;
                }
            }
            return data.toString();
        }
        if (data instanceof Iterable<?> items) {
            for (Object nested : items) {
                final String found = extractErrorData(nested);
                if (found != null) {
                    return found;
                }
            }
            return data.toString();
        }
        return data.toString();
    }
}
