// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

/**
 * Thrown when a local store cannot be read or written.
 *
 * @since 0.1.0
 */
public final class StorageException extends LanternException {

    public StorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
