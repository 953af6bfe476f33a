// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import sh.chainwatch.core.types.Address;
import sh.chainwatch.rpc.Fixtures;

class SubscriptionKeyTest {

    @Test
    void contractKeysIgnoreAddressCase() {
        SubscriptionKey.ContractEvent upper = SubscriptionKey.contractEvent(
                new Address("0xAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA"), "Transfer");
        SubscriptionKey.ContractEvent lower = SubscriptionKey.contractEvent(
                new Address("0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa"), "Transfer");

        assertEquals(upper, lower);
        assertEquals(upper.hashCode(), lower.hashCode());
        assertNotEquals(upper, SubscriptionKey.contractEvent(upper.contractAddress(), "Approval"));
    }

    @Test
    void matchesSelectsByAddress() {
        SubscriptionKey.ContractEvent key = SubscriptionKey.contractEvent(Fixtures.TOKEN, "Transfer");

        assertTrue(key.matches(Fixtures.TOKEN));
        assertFalse(key.matches(Fixtures.OTHER));
    }

    @Test
    void labels() {
        assertEquals("blocks", SubscriptionKey.BLOCKS.label());
        assertEquals("pending-transactions", SubscriptionKey.PENDING_TRANSACTIONS.label());
        assertEquals(Fixtures.TOKEN.value() + ":Transfer",
                SubscriptionKey.contractEvent(Fixtures.TOKEN, "Transfer").label());
    }

    @Test
    void rejectsBlankEventName() {
        assertThrows(IllegalArgumentException.class, () -> SubscriptionKey.contractEvent(Fixtures.TOKEN, " "));
    }
}
