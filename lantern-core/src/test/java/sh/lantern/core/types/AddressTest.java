// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import sh.lantern.core.error.ValidationException;

class AddressTest {

    private static final String VALID = "aleo1" + "qpzry9x8gf".repeat(5) + "2tvdw0s3";

    @Test
    void acceptsBech32Address() {
        assertTrue(Address.isValid(VALID));
        assertEquals(VALID, Address.of(VALID).value());
    }

    @Test
    void rejectsMalformedAddresses() {
        assertFalse(Address.isValid(null));
        assertFalse(Address.isValid(VALID.substring(0, 62)));
        assertFalse(Address.isValid("aleo2" + VALID.substring(5)));
        assertFalse(Address.isValid(VALID.substring(0, 62) + "b"));
        assertThrows(ValidationException.class, () -> Address.of("aleo1short"));
    }

    @Test
    void serializesAsBareString() throws Exception {
        assertEquals("\"" + VALID + "\"", new ObjectMapper().writeValueAsString(Address.of(VALID)));
    }
}
