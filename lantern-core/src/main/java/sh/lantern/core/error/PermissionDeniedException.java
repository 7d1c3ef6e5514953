// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

/**
 * Thrown to a requesting origin when a capability is refused, either by the user or because the
 * origin lacks the required grant.
 *
 * @since 0.1.0
 */
public non-sealed class PermissionDeniedException extends LanternException {

    private final String origin;

    public PermissionDeniedException(final String origin, final String message) {
        super(message);
        this.origin = origin;
    }

    public String origin() {
        return origin;
    }
}
