// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.types;

import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.chainwatch.primitives.Hex;

/**
 * Arbitrary-length hex payload such as log data or transaction input.
 * The original spelling is kept, only validated.
 *
 * @since 0.1.0
 */
public record HexData(@JsonValue String value) {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    public static final HexData EMPTY = new HexData("0x");

    public HexData {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
    }

    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(Hex.encode(bytes));
    }

    public int byteLength() {
        return (value.length() - 2) / 2;
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }
}
