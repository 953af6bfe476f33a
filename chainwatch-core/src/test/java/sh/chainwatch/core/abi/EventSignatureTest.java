// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.abi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import sh.chainwatch.core.error.AbiException;

class EventSignatureTest {

    @Test
    void parsesTransferDeclaration() {
        EventSignature transfer = EventSignature.parse(
                "event Transfer(address indexed from, address indexed to, uint256 value)");

        assertEquals("Transfer", transfer.name());
        assertEquals("Transfer(address,address,uint256)", transfer.canonical());
        assertEquals("0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef",
                transfer.topic().value());
        assertTrue(transfer.inputs().get(0).indexed());
        assertEquals("to", transfer.inputs().get(1).name());
        assertFalse(transfer.inputs().get(2).indexed());
    }

    @Test
    void normalizesIntegerAliases() {
        EventSignature event = EventSignature.parse("Deposit(uint amount, int[] deltas)");
        assertEquals("Deposit(uint256,int256[])", event.canonical());
    }

    @Test
    void expandsTuples() {
        EventSignature event = EventSignature.parse(
                "event Filled((address maker, uint256 amount)[] orders, bytes32 indexed id)");

        assertEquals("Filled((address,uint256)[],bytes32)", event.canonical());
        assertEquals("orders", event.inputs().get(0).name());
        assertTrue(event.inputs().get(1).indexed());
    }

    @Test
    void parsesEmptyAndAnonymousEvents() {
        assertEquals("Paused()", EventSignature.parse("event Paused()").canonical());
        assertTrue(EventSignature.parse("event Ping(uint256 n) anonymous").anonymous());
        assertEquals(EventSignature.parse("event Paused()"), EventSignature.bare("Paused"));
    }

    @Test
    void rejectsMalformedDeclarations() {
        assertThrows(AbiException.class, () -> EventSignature.parse("Transfer"));
        assertThrows(AbiException.class, () -> EventSignature.parse("event Transfer(address"));
        assertThrows(AbiException.class, () -> EventSignature.parse("event Transfer(address,,uint256)"));
        assertThrows(AbiException.class, () -> EventSignature.parse("event Transfer(address) extra"));
        assertThrows(AbiException.class, () -> EventSignature.parse("event 1Bad()"));
    }
}
