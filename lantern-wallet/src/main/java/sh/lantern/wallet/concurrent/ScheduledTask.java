// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.concurrent;

/**
 * Handle for a task submitted to a {@link TaskScheduler}.
 */
public interface ScheduledTask {

    /** A handle for nothing, cancelling it does nothing. */
    ScheduledTask NONE = new ScheduledTask() {
        @Override
        public void cancel() {
        }

        @Override
        public boolean isCancelled() {
            return true;
        }
    };

    /**
     * Prevents further runs. A run already in progress is not interrupted.
     */
    void cancel();

    boolean isCancelled();
}
