// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.session;

/**
 * Why a session left the unlocked state.
 */
public enum LockReason {
    /** Explicit {@link WalletSessionManager#lock()} or shutdown. */
    MANUAL,
    /** The inactivity timer fired. */
    AUTO_LOCK,
    /** The persisted wallet was deleted. */
    DELETED
}
