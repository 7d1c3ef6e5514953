// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.session;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.lantern.core.crypto.SecretBuffer;
import sh.lantern.core.types.Address;

/**
 * Result of {@link WalletSessionManager#create}.
 *
 * <p>The recovery phrase is handed out exactly once and is never persisted; the caller owns the
 * buffer and should destroy it after showing it to the user.
 *
 * @param address    the new wallet address
 * @param seedPhrase the recovery phrase, when the gateway derived the account from one
 */
public record CreatedWallet(Address address, @Nullable SecretBuffer seedPhrase) {

    public CreatedWallet {
        Objects.requireNonNull(address, "address");
    }
}
