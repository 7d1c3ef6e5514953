// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

import java.time.Duration;

/**
 * Thrown to the suspended caller of a capability request when the user did not answer within the
 * approval window. The pending entry is already gone when this is raised.
 *
 * @since 0.1.0
 */
public final class ApprovalTimeoutException extends LanternException {

    private final String requestId;
    private final Duration timeout;

    public ApprovalTimeoutException(final String requestId, final Duration timeout) {
        super("Permission request " + requestId + " timed out after " + timeout.toSeconds() + "s");
        this.requestId = requestId;
        this.timeout = timeout;
    }

    public String requestId() {
        return requestId;
    }

    public Duration timeout() {
        return timeout;
    }
}
