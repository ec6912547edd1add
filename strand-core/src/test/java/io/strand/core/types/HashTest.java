// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HashTest {

    @Test
    void normalizesToLowerCase() {
        Hash hash = new Hash("0x" + "AB".repeat(32));
        assertEquals("0x" + "ab".repeat(32), hash.value());
    }

    @Test
    void bytesRoundTrip() {
        byte[] bytes = new byte[32];
        bytes[0] = (byte) 0xff;
        bytes[31] = 0x01;
        Hash hash = Hash.fromBytes(bytes);
        assertEquals("0xff" + "00".repeat(30) + "01", hash.value());
        assertArrayEquals(bytes, hash.toBytes());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0x", "0x1234", "abababababababababababababababababababababababababababababababab", "0xzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzz"})
    void rejectsMalformedHex(String value) {
        assertThrows(IllegalArgumentException.class, () -> new Hash(value));
    }

    @Test
    void rejectsWrongByteLength() {
        assertThrows(IllegalArgumentException.class, () -> Hash.fromBytes(new byte[31]));
    }
}
