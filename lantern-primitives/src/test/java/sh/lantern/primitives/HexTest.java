// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {

    @Test
    @DisplayName("Encoding produces bare lowercase hex")
    void encodesWithoutPrefix() {
        assertEquals("", Hex.encode(new byte[] {}));
        assertEquals("00ff", Hex.encode(new byte[] {0x00, (byte) 0xFF}));
        assertEquals("0123abcd", Hex.encode(new byte[] {0x01, 0x23, (byte) 0xAB, (byte) 0xCD}));
    }

    @Test
    void decodesWithOrWithoutPrefix() {
        byte[] expected = new byte[] {0x0A, (byte) 0xBC, (byte) 0xDE, (byte) 0xF0};
        assertArrayEquals(expected, Hex.decode("0abcdef0"));
        assertArrayEquals(expected, Hex.decode("0x0AbCdEf0"));
        assertArrayEquals(expected, Hex.decode("0X0aBcDeF0"));
        assertArrayEquals(new byte[] {}, Hex.decode(""));
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("abc"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("zz"));
        assertThrows(IllegalArgumentException.class, () -> Hex.encode(null));
    }

    @Test
    void isHexRequiresNonEmptyEvenLength() {
        assertTrue(Hex.isHex("00"));
        assertTrue(Hex.isHex("0xdeadBEEF"));
        assertFalse(Hex.isHex(""));
        assertFalse(Hex.isHex("0x"));
        assertFalse(Hex.isHex("123"));
        assertFalse(Hex.isHex("gg"));
        assertFalse(Hex.isHex(null));
    }

    @Test
    void detectsPrefix() {
        assertTrue(Hex.hasPrefix("0x1"));
        assertTrue(Hex.hasPrefix("0Xff"));
        assertFalse(Hex.hasPrefix("1"));
        assertFalse(Hex.hasPrefix(null));
    }
}
