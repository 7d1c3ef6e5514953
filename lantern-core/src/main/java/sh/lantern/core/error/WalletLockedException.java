// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

/**
 * Thrown when an operation needs secret material while the wallet is locked.
 *
 * @since 0.1.0
 */
public final class WalletLockedException extends LanternException {

    public WalletLockedException() {
        super("Wallet is locked");
    }
}
