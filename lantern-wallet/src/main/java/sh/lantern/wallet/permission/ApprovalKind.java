// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.permission;

/**
 * Which approval dialog the UI should show for a request.
 */
public enum ApprovalKind {
    CONNECT,
    TRANSACTION,
    SIGN_MESSAGE,
    VIEW_KEY,
    RECORDS,
    DECRYPT
}
