// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

/**
 * Thrown when an imported private key or recovery phrase is not in the network's canonical form.
 *
 * @since 0.1.0
 */
public final class InvalidKeyFormatException extends ValidationException {

    public InvalidKeyFormatException(final String message) {
        super(message);
    }
}
