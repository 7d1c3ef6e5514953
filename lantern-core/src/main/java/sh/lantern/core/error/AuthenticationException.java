// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

/**
 * Thrown when a sealed payload fails authentication, either because the password is wrong or
 * because the ciphertext, IV, salt or tag were altered.
 * <p>
 * No partial plaintext is ever returned alongside this exception.
 *
 * @since 0.1.0
 */
public non-sealed class AuthenticationException extends LanternException {

    public AuthenticationException(final String message) {
        super(message);
    }

    public AuthenticationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
