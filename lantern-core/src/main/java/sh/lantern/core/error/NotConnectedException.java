// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

/**
 * Thrown when an origin without a connect grant calls a dApp operation.
 *
 * @since 0.1.0
 */
public final class NotConnectedException extends PermissionDeniedException {

    public NotConnectedException(final String origin) {
        super(origin, "Not connected: " + origin);
    }
}
