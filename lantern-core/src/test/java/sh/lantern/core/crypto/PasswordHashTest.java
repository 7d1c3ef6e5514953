// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PasswordHashTest {

    @Test
    void hashIsSha256Hex() {
        assertEquals(
                "5e884898da28047151d0e56f8dc6292773603d0d6aabbdd62a11ef721d1542d8",
                PasswordHash.hash("password"));
    }

    @Test
    void matchesOnlyTheSamePassword() {
        final String stored = PasswordHash.hash("password123");

        assertTrue(PasswordHash.matches("password123", stored));
        assertFalse(PasswordHash.matches("password124", stored));
        assertFalse(PasswordHash.matches("password123", "not-hex"));
        assertFalse(PasswordHash.matches(null, stored));
    }
}
