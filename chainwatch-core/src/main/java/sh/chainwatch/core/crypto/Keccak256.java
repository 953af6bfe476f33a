// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import sh.chainwatch.core.types.Hash;

/**
 * Keccak-256 as used by Ethereum (the pre-standard variant, not SHA3-256).
 * Digest instances are cached per thread.
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
    }

    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Hashes the UTF-8 bytes of {@code text}; used for event signatures such as
     * {@code Transfer(address,address,uint256)}.
     */
    public static Hash hashUtf8(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return Hash.fromBytes(hash(text.getBytes(StandardCharsets.UTF_8)));
    }
}
