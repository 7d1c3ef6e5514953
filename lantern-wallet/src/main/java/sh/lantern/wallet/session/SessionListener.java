// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.session;

import sh.lantern.core.types.Address;

/**
 * Receives session state transitions. Callbacks run on the thread that caused the transition
 * while the session monitor is held, so they must not call back into the session manager from
 * another thread and wait for it.
 */
public interface SessionListener {

    default void onUnlocked(Address address) {
    }

    default void onLocked(LockReason reason) {
    }
}
