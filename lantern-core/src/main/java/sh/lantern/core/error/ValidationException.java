// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

/**
 * Thrown when caller input is rejected: a short password, a malformed address, a non-positive
 * amount or an unaffordable transfer.
 * <p>
 * Validation failures are always surfaced to the caller and never retried. The class is
 * {@code non-sealed} so the wallet-specific preconditions below can refine it.
 *
 * @since 0.1.0
 */
public non-sealed class ValidationException extends LanternException {

    public ValidationException(final String message) {
        super(message);
    }

    public ValidationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
