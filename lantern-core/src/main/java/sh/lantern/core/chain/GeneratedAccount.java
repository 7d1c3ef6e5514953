// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.chain;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.lantern.core.crypto.KeyMaterial;
import sh.lantern.core.crypto.SecretBuffer;

/**
 * A freshly generated account.
 *
 * @param keys       the account key material
 * @param seedPhrase recovery phrase, when the client derived the account from one
 */
public record GeneratedAccount(KeyMaterial keys, @Nullable SecretBuffer seedPhrase) {

    public GeneratedAccount {
        Objects.requireNonNull(keys, "keys");
    }
}
