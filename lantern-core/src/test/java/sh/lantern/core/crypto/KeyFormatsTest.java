// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.crypto;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import sh.lantern.core.error.InvalidKeyFormatException;

class KeyFormatsTest {

    static final String PRIVATE_KEY = "APrivateKey1zkp8CZNn3yeCseEtxuVPbDCwSyhGW6yZKUYKfgXmcpoGPWH";
    static final String VIEW_KEY = "AViewKey1mSnpFFC8Mj4fXbK5YiWgZ3mjiV8CxA79bYNa8ymUpTrw";

    @Test
    void acceptsCanonicalKeys() {
        assertEquals(59, PRIVATE_KEY.length());
        assertEquals(53, VIEW_KEY.length());
        assertTrue(KeyFormats.isPrivateKey(SecretBuffer.copyOf(PRIVATE_KEY)));
        assertTrue(KeyFormats.isViewKey(SecretBuffer.copyOf(VIEW_KEY)));
        assertDoesNotThrow(() -> KeyFormats.requirePrivateKey(SecretBuffer.copyOf(PRIVATE_KEY)));
    }

    @Test
    void rejectsWrongPrefixOrLength() {
        assertFalse(KeyFormats.isPrivateKey(SecretBuffer.copyOf(PRIVATE_KEY.substring(0, 58))));
        assertFalse(KeyFormats.isPrivateKey(SecretBuffer.copyOf("BPrivateKey1" + PRIVATE_KEY.substring(12))));
        assertFalse(KeyFormats.isPrivateKey(SecretBuffer.copyOf(VIEW_KEY)));
        assertFalse(KeyFormats.isPrivateKey(null));
        assertThrows(InvalidKeyFormatException.class,
                () -> KeyFormats.requirePrivateKey(SecretBuffer.copyOf("APrivateKey1short")));
    }

    @Test
    void normalizesSeedPhrase() {
        final SecretBuffer phrase = SecretBuffer.copyOf(
                "  Abandon ability able about above absent\n absorb abstract absurd abuse access accident  ");

        final SecretBuffer normalized = KeyFormats.normalizeSeedPhrase(phrase);

        assertEquals(
                "abandon ability able about above absent absorb abstract absurd abuse access accident",
                normalized.reveal());
        assertFalse(phrase.isDestroyed());
    }

    @Test
    void rejectsShortSeedPhrase() {
        final SecretBuffer phrase = SecretBuffer.copyOf("one two three four five six seven eight nine ten eleven");

        assertThrows(InvalidKeyFormatException.class, () -> KeyFormats.normalizeSeedPhrase(phrase));
    }
}
