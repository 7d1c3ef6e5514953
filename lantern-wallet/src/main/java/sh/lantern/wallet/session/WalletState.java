// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.session;

import org.jspecify.annotations.Nullable;

import sh.lantern.core.types.Address;

/**
 * Point-in-time view of the session, safe to hand to UI code.
 *
 * @param hasWallet        whether an encrypted wallet is persisted
 * @param unlocked         whether key material is held in memory
 * @param address          wallet address while unlocked
 * @param unlockedAt       when the session was unlocked, epoch millis
 * @param autoLockDeadline when the session locks itself absent activity, epoch millis
 */
public record WalletState(
        boolean hasWallet,
        boolean unlocked,
        @Nullable Address address,
        @Nullable Long unlockedAt,
        @Nullable Long autoLockDeadline) {

    static WalletState locked(final boolean hasWallet) {
        return new WalletState(hasWallet, false, null, null, null);
    }
}
