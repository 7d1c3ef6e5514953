// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import sh.lantern.core.crypto.SealedPayload;

/**
 * The persisted wallet: sealed key material plus the password fingerprint.
 *
 * <p>Exactly one exists per installation. It is written once on create or import and only ever
 * touched again to refresh {@code lastAccessedAt} or to be deleted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EncryptedWalletRecord(
        String ciphertext,
        String iv,
        String authTag,
        String salt,
        String passwordHash,
        long createdAt,
        long lastAccessedAt) {

    public EncryptedWalletRecord {
        Objects.requireNonNull(ciphertext, "ciphertext");
        Objects.requireNonNull(iv, "iv");
        Objects.requireNonNull(authTag, "authTag");
        Objects.requireNonNull(salt, "salt");
        Objects.requireNonNull(passwordHash, "passwordHash");
    }

    public static EncryptedWalletRecord of(final SealedPayload sealed, final String passwordHash, final long now) {
        return new EncryptedWalletRecord(
                sealed.ciphertext(), sealed.iv(), sealed.authTag(), sealed.salt(), passwordHash, now, now);
    }

    @JsonIgnore
    public SealedPayload sealed() {
        return new SealedPayload(ciphertext, iv, authTag, salt);
    }

    public EncryptedWalletRecord accessedAt(final long now) {
        return new EncryptedWalletRecord(ciphertext, iv, authTag, salt, passwordHash, createdAt, now);
    }
}
