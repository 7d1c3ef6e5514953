// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.permission;

/**
 * Outbound half of the approval protocol: how pending requests reach the user interface.
 *
 * <p>
 * The UI answers through {@link PermissionBroker#resolve(String, boolean)}. Implementations must
 * not block; {@link #publish} is called while the requesting thread waits to receive its future.
 */
public interface ApprovalChannel {

    void publish(ApprovalRequest request);

    /**
     * The request left the pending set without an answer (timeout or shutdown), so its dialog
     * should close.
     */
    default void withdraw(final String requestId) {
    }
}
