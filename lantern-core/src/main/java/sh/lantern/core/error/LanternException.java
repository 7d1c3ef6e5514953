// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

/**
 * Base runtime exception for all Lantern wallet failures.
 *
 * <p>
 * This sealed class is the root of the exception hierarchy, so callers at the IPC boundary can
 * catch every wallet error with a single clause while the permitted subtypes stay exhaustive.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * LanternException
 * ├── {@link ValidationException} - bad input, never retried
 * │   ├── {@link InvalidKeyFormatException} - key or phrase not in canonical format
 * │   ├── {@link WalletExistsException} - create/import over an existing wallet
 * │   └── {@link NoWalletException} - unlock without a persisted wallet
 * ├── {@link AuthenticationException} - authentication tag mismatch
 * │   └── {@link InvalidPasswordException} - wrong password on unlock
 * ├── {@link WalletLockedException} - secret material requested while locked
 * ├── {@link PermissionDeniedException} - user or grant table refused the origin
 * │   └── {@link NotConnectedException} - origin holds no connect grant
 * ├── {@link ApprovalTimeoutException} - approval window elapsed
 * ├── {@link NetworkException} - gateway communication failure
 * └── {@link StorageException} - local persistence failure
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     sessions.unlock(password);
 * } catch (InvalidPasswordException e) {
 *     // prompt again, session is still locked
 * } catch (LanternException e) {
 *     // any other wallet error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class LanternException extends RuntimeException
        permits ValidationException,
        AuthenticationException,
        WalletLockedException,
        PermissionDeniedException,
        ApprovalTimeoutException,
        NetworkException,
        StorageException {

    public LanternException(final String message) {
        super(message);
    }

    public LanternException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
