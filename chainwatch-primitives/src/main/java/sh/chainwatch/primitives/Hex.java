// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.primitives;

import java.util.Arrays;
import java.util.Locale;

/**
 * Hex encoding helpers for the {@code 0x}-prefixed strings used by Ethereum JSON-RPC.
 *
 * <p>Byte payloads (hashes, addresses, log data) and quantities (block numbers,
 * log indices, nonces) use different encodings on the wire: byte payloads always
 * carry an even number of digits, quantities are minimal and never zero-padded.
 * Both are handled here.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLES = new int[128];

    static {
        Arrays.fill(NIBBLES, -1);
        for (int i = 0; i < 10; i++) {
            NIBBLES['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLES['a' + i] = 10 + i;
            NIBBLES['A' + i] = 10 + i;
        }
    }

    private Hex() {
    }

    /**
     * Decodes a hex string, with or without {@code 0x} prefix, into bytes.
     *
     * @param hex the string to decode
     * @return the decoded bytes; empty for {@code "0x"} or {@code ""}
     * @throws IllegalArgumentException if the input is null, has odd length or contains a non-hex digit
     */
    public static byte[] decode(final String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int start = hasPrefix(hex) ? 2 : 0;
        final int digits = hex.length() - start;
        if ((digits & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hex);
        }
        final byte[] out = new byte[digits / 2];
        for (int i = 0; i < out.length; i++) {
            final int hi = nibble(hex, start + i * 2);
            final int lo = nibble(hex, start + i * 2 + 1);
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    /**
     * Encodes bytes as a lowercase {@code 0x}-prefixed string.
     *
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Encodes bytes as lowercase hex without a prefix.
     *
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = DIGITS[v >>> 4];
            chars[i * 2 + 1] = DIGITS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Encodes a non-negative number as a JSON-RPC quantity ({@code 0x0}, {@code 0x1a}).
     *
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static String encodeQuantity(final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("quantity cannot be negative: " + value);
        }
        return "0x" + Long.toHexString(value);
    }

    /**
     * Decodes a JSON-RPC quantity. An empty string or a bare {@code 0x} decodes to zero,
     * which is what several nodes send for unset counters.
     *
     * @throws IllegalArgumentException if the input is null or not hex
     */
    public static long decodeQuantity(final String quantity) {
        if (quantity == null) {
            throw new IllegalArgumentException("quantity cannot be null");
        }
        final String digits = cleanPrefix(quantity);
        if (digits.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseUnsignedLong(digits.toLowerCase(Locale.ROOT), 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid hex quantity: " + quantity, e);
        }
    }

    /**
     * Strips a leading {@code 0x} or {@code 0X} if present.
     */
    public static String cleanPrefix(final String hex) {
        return hasPrefix(hex) ? hex.substring(2) : hex;
    }

    public static boolean hasPrefix(final String hex) {
        return hex != null
                && hex.length() >= 2
                && hex.charAt(0) == '0'
                && (hex.charAt(1) == 'x' || hex.charAt(1) == 'X');
    }

    private static int nibble(final String hex, final int index) {
        final char c = hex.charAt(index);
        final int v = c < 128 ? NIBBLES[c] : -1;
        if (v < 0) {
            throw new IllegalArgumentException("Invalid hex character '" + c + "' in: " + hex);
        }
        return v;
    }
}
