// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.abi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import sh.chainwatch.core.error.AbiException;

class EventAbiTest {

    private static final String ERC20_JSON = """
            [
              {"type":"function","name":"transfer","inputs":[{"name":"to","type":"address"}]},
              {"type":"event","name":"Transfer","anonymous":false,"inputs":[
                {"name":"from","type":"address","indexed":true},
                {"name":"to","type":"address","indexed":true},
                {"name":"value","type":"uint256","indexed":false}]},
              {"type":"event","name":"Approval","inputs":[
                {"name":"owner","type":"address","indexed":true},
                {"name":"spender","type":"address","indexed":true},
                {"name":"value","type":"uint256","indexed":false}]}
            ]
            """;

    @Test
    void readsEventsFromJsonAbi() {
        EventAbi abi = EventAbi.fromJson(ERC20_JSON);

        assertEquals(2, abi.events().size());
        assertEquals("0x8c5be1e5ebec7d5bd14f71427d1e84f3dd0314c0f7b2291e5b200ac8c7c3b925",
                abi.find("Approval").orElseThrow().topic().value());
        assertTrue(abi.find("transfer").isEmpty());
    }

    @Test
    void expandsJsonTupleComponents() {
        EventAbi abi = EventAbi.fromJson("""
                [{"type":"event","name":"Batch","inputs":[
                  {"name":"items","type":"tuple[]","components":[
                    {"name":"id","type":"uint"},{"name":"who","type":"address"}]}]}]
                """);

        assertEquals("Batch((uint256,address)[])", abi.find("Batch").orElseThrow().canonical());
    }

    @Test
    void firstOverloadWins() {
        EventAbi abi = EventAbi.of("event Sync(uint112 r0, uint112 r1)", "event Sync(uint256 r)");
        assertEquals("Sync(uint112,uint112)", abi.find("Sync").orElseThrow().canonical());
    }

    @Test
    void rejectsMalformedJson() {
        assertThrows(AbiException.class, () -> EventAbi.fromJson("{not json"));
        assertThrows(AbiException.class, () -> EventAbi.fromJson("{\"type\":\"event\"}"));
    }

    @Test
    void emptyAbiFindsNothing() {
        assertTrue(EventAbi.empty().isEmpty());
        assertTrue(EventAbi.empty().find("Transfer").isEmpty());
    }
}
