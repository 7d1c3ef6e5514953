// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.crypto;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

import org.junit.jupiter.api.Test;

import sh.lantern.core.error.AuthenticationException;
import sh.lantern.primitives.Hex;

class SecretCipherTest {

    // reduced iterations; the production count is exercised in defaultCipherUsesProductionIterations
    private final SecretCipher cipher = new SecretCipher(1_000, new SecureRandom());

    @Test
    void sealThenOpenReturnsPlaintext() {
        final byte[] plaintext = "hello wallet".getBytes(StandardCharsets.UTF_8);

        final SealedPayload sealed = cipher.seal(plaintext, "correct horse");

        assertArrayEquals(plaintext, cipher.open(sealed, "correct horse"));
    }

    @Test
    void fieldSizesMatchScheme() {
        final SealedPayload sealed = cipher.seal(new byte[] {1, 2, 3}, "password");

        assertEquals(SecretCipher.IV_LENGTH * 2, sealed.iv().length());
        assertEquals(SecretCipher.TAG_LENGTH * 2, sealed.authTag().length());
        assertEquals(SecretCipher.SALT_LENGTH * 2, sealed.salt().length());
        assertEquals(6, sealed.ciphertext().length());
    }

    @Test
    void identicalPlaintextsProduceDifferentPayloads() {
        final byte[] plaintext = "same".getBytes(StandardCharsets.UTF_8);

        final SealedPayload a = cipher.seal(plaintext, "password");
        final SealedPayload b = cipher.seal(plaintext, "password");

        assertNotEquals(a.ciphertext(), b.ciphertext());
        assertNotEquals(a.iv(), b.iv());
        assertNotEquals(a.salt(), b.salt());
    }

    @Test
    void wrongPasswordFailsAuthentication() {
        final SealedPayload sealed = cipher.seal("secret".getBytes(StandardCharsets.UTF_8), "password1");

        assertThrows(AuthenticationException.class, () -> cipher.open(sealed, "password2"));
    }

    @Test
    void tamperedCiphertextFailsAuthentication() {
        final SealedPayload sealed = cipher.seal("secret".getBytes(StandardCharsets.UTF_8), "password");
        final byte[] body = Hex.decode(sealed.ciphertext());
        body[0] ^= 0x01;
        final SealedPayload tampered = new SealedPayload(Hex.encode(body), sealed.iv(), sealed.authTag(), sealed.salt());

        assertThrows(AuthenticationException.class, () -> cipher.open(tampered, "password"));
    }

    @Test
    void tamperedTagFailsAuthentication() {
        final SealedPayload sealed = cipher.seal("secret".getBytes(StandardCharsets.UTF_8), "password");
        final byte[] tag = Hex.decode(sealed.authTag());
        tag[15] ^= 0x01;
        final SealedPayload tampered = new SealedPayload(sealed.ciphertext(), sealed.iv(), Hex.encode(tag), sealed.salt());

        assertThrows(AuthenticationException.class, () -> cipher.open(tampered, "password"));
    }

    @Test
    void defaultCipherUsesProductionIterations() {
        final SecretCipher production = new SecretCipher();
        final SealedPayload sealed = production.seal(new byte[] {42}, "password");

        assertArrayEquals(new byte[] {42}, production.open(sealed, "password"));
        assertThrows(AuthenticationException.class, () -> cipher.open(sealed, "password"));
    }

    @Test
    void rejectsNonPositiveIterations() {
        assertThrows(IllegalArgumentException.class, () -> new SecretCipher(0, new SecureRandom()));
    }
}
