// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.concurrent;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the executors the wallet services run on.
 *
 * <p>
 * <ul>
 * <li><strong>Timers</strong> (auto-lock, approval timeouts, reconciliation ticks): one
 * platform thread named {@code lantern-scheduler}</li>
 * <li><strong>Gateway I/O</strong> (transaction status lookups): a cached pool of threads named
 * {@code lantern-io-N}</li>
 * </ul>
 *
 * <p>
 * All threads are daemons, so an embedding process can exit without closing the wallet first.
 *
 * @since 0.1.0
 */
public final class LanternExecutors {

    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);

    private LanternExecutors() {
        // Utility class
    }

    /**
     * Creates the single-threaded timer executor.
     *
     * <p>
     * Cancelled tasks are removed from the queue immediately, since auto-lock re-arms on every
     * authenticated call.
     */
    public static ScheduledExecutorService newScheduler() {
        final ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "lantern-scheduler");
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * Creates an executor for blocking gateway calls.
     */
    public static ExecutorService newIoBoundExecutor() {
        return Executors.newCachedThreadPool(r -> {
            // Mask off sign bit to keep ids non-negative after overflow
            int id = IO_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            Thread t = new Thread(r, "lantern-io-" + id);
            t.setDaemon(true);
            return t;
        });
    }
}
