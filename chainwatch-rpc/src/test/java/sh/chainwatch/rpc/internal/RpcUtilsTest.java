// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class RpcUtilsTest {

    @Test
    void decodesQuantities() {
        assertEquals(255L, RpcUtils.decodeHexLong("0xff"));
        assertEquals(7L, RpcUtils.decodeHexLong(7));
        assertNull(RpcUtils.decodeHexLong(null));
        assertEquals(new BigInteger("1000000000000000000"), RpcUtils.decodeHexBigInteger("0xde0b6b3a7640000"));
        assertEquals(BigInteger.ZERO, RpcUtils.decodeHexBigInteger("0x"));
    }

    @Test
    void encodesBlockNumbers() {
        assertEquals("0x0", RpcUtils.toHexBlock(0));
        assertEquals("0x12d687", RpcUtils.toHexBlock(1_234_567));
    }

    @Test
    void extractsNestedErrorData() {
        assertEquals("0x08c379a0", RpcUtils.extractErrorData("0x08c379a0"));
        assertEquals("0xdead", RpcUtils.extractErrorData(Map.of("data", "0xdead")));
        assertEquals("first", RpcUtils.extractErrorData(List.of("first", "second")));
        assertEquals("42", RpcUtils.extractErrorData(42));
        assertNull(RpcUtils.extractErrorData(null));
    }
}
