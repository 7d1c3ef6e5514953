// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

/**
 * Thrown when an unlock is attempted and no wallet record is persisted.
 *
 * @since 0.1.0
 */
public final class NoWalletException extends ValidationException {

    public NoWalletException() {
        super("No wallet found");
    }
}
