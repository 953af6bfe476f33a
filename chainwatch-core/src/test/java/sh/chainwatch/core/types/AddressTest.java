// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class AddressTest {

    @Test
    void normalizesToLowercase() {
        Address checksummed = new Address("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48");
        Address lower = new Address("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48");

        assertEquals(lower, checksummed);
        assertEquals("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", checksummed.value());
    }

    @Test
    void rejectsWrongLengthOrMissingPrefix() {
        assertThrows(IllegalArgumentException.class, () -> new Address("0x1234"));
        assertThrows(IllegalArgumentException.class,
                () -> new Address("a0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"));
        assertThrows(NullPointerException.class, () -> new Address(null));
    }

    @Test
    void bytesRoundTripPreservesValue() {
        Address address = new Address("0x" + "ab".repeat(20));
        assertEquals(address, Address.fromBytes(address.toBytes()));
        assertThrows(IllegalArgumentException.class, () -> Address.fromBytes(new byte[19]));
    }
}
