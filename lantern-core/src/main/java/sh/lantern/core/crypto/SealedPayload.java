// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.crypto;

import java.util.Objects;

import sh.lantern.primitives.Hex;

/**
 * Ciphertext plus everything needed to open it again given the password.
 *
 * <p>All fields are lowercase hex without prefix, as stored in {@code wallet.json}.
 *
 * @param ciphertext AES-GCM ciphertext without the tag
 * @param iv         16-byte nonce
 * @param authTag    16-byte GCM authentication tag
 * @param salt       32-byte PBKDF2 salt
 */
public record SealedPayload(String ciphertext, String iv, String authTag, String salt) {

    public SealedPayload {
        requireHex(ciphertext, "ciphertext");
        requireHex(iv, "iv");
        requireHex(authTag, "authTag");
        requireHex(salt, "salt");
    }

    private static void requireHex(final String value, final String field) {
        Objects.requireNonNull(value, field);
        if (!Hex.isHex(value)) {
            throw new IllegalArgumentException(field + " must be non-empty hex");
        }
    }
}
