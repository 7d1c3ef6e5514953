// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.lantern.core.error.InvalidKeyFormatException;
import sh.lantern.core.types.Address;

class KeyMaterialTest {

    private static final String ADDRESS = "aleo1" + "qpzry9x8gf".repeat(5) + "2tvdw0s3";

    @Test
    void plaintextParsesBackToSameKeys() {
        final KeyMaterial keys = new KeyMaterial(
                Address.of(ADDRESS),
                SecretBuffer.copyOf(KeyFormatsTest.PRIVATE_KEY),
                SecretBuffer.copyOf(KeyFormatsTest.VIEW_KEY));

        final KeyMaterial parsed = KeyMaterial.fromPlaintext(keys.toPlaintext());

        assertEquals(ADDRESS, parsed.address().value());
        assertEquals(KeyFormatsTest.PRIVATE_KEY, parsed.privateKey().reveal());
        assertEquals(KeyFormatsTest.VIEW_KEY, parsed.viewKey().reveal());
    }

    @Test
    void rejectsMalformedPlaintext() {
        assertThrows(InvalidKeyFormatException.class,
                () -> KeyMaterial.fromPlaintext("only-one-line".getBytes(StandardCharsets.UTF_8)));
        assertThrows(InvalidKeyFormatException.class,
                () -> KeyMaterial.fromPlaintext((ADDRESS + "\n\nview").getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void destroyClearsBothKeys() {
        final char[] privateKey = KeyFormatsTest.PRIVATE_KEY.toCharArray();
        final KeyMaterial keys = new KeyMaterial(
                Address.of(ADDRESS), SecretBuffer.wrap(privateKey), SecretBuffer.copyOf(KeyFormatsTest.VIEW_KEY));

        keys.destroy();

        assertTrue(keys.isDestroyed());
        assertEquals(new String(new char[privateKey.length]), new String(privateKey));
        assertFalse(keys.toString().contains("APrivateKey1"));
    }
}
