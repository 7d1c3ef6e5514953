// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.concurrent;

import java.time.Duration;

/**
 * Clock and timer source shared by the wallet services.
 *
 * <p>
 * Auto-lock deadlines, approval timeouts and the reconciliation loop all go through this
 * interface, so tests can drive time explicitly instead of sleeping.
 *
 * @since 0.1.0
 */
public interface TaskScheduler extends AutoCloseable {

    /**
     * Current time in epoch milliseconds.
     */
    long now();

    /**
     * Runs {@code task} once after {@code delay}.
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Runs {@code task} after {@code initialDelay} and then every {@code period} until cancelled.
     */
    ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    /**
     * Cancels outstanding tasks and releases threads. Idempotent.
     */
    @Override
    void close();
}
