// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

/**
 * Thrown when a wallet is created or imported while one is already persisted.
 *
 * @since 0.1.0
 */
public final class WalletExistsException extends ValidationException {

    public WalletExistsException() {
        super("Wallet already exists. Delete the existing wallet first.");
    }
}
