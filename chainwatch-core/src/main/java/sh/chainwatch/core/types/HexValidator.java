// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for {@code 0x}-prefixed hex strings of a fixed byte length.
 * Shared by {@link Address} and {@link Hash}.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * @param byteLength exact number of bytes the string must encode
     * @return a pattern accepting {@code 0x} followed by {@code byteLength * 2} hex digits, any case
     */
    public static Pattern fixedLength(final int byteLength) {
        if (byteLength <= 0) {
            throw new IllegalArgumentException("byteLength must be positive: " + byteLength);
        }
        return Pattern.compile("^0x[0-9a-fA-F]{" + (byteLength * 2) + "}$");
    }
}
