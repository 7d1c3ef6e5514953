// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

/**
 * Thrown by unlock when the password fails the hash pre-check or the authenticated decryption.
 * The session stays locked.
 *
 * @since 0.1.0
 */
public final class InvalidPasswordException extends AuthenticationException {

    public InvalidPasswordException() {
        super("Invalid password");
    }

    public InvalidPasswordException(final Throwable cause) {
        super("Invalid password", cause);
    }
}
