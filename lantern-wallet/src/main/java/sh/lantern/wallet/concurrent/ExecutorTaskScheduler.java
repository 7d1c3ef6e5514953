// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.concurrent;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TaskScheduler} backed by a {@link ScheduledExecutorService} and a {@link Clock}.
 *
 * <p>
 * Exceptions escaping a task are logged; a periodic task keeps running after a failed tick.
 */
public final class ExecutorTaskScheduler implements TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final ScheduledExecutorService executor;
    private final Clock clock;

    public ExecutorTaskScheduler(final ScheduledExecutorService executor, final Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a scheduler on a fresh {@link LanternExecutors#newScheduler()} and the system clock.
     */
    public static ExecutorTaskScheduler create() {
        return new ExecutorTaskScheduler(LanternExecutors.newScheduler(), Clock.systemUTC());
    }

    @Override
    public long now() {
        return clock.millis();
    }

    @Override
    public ScheduledTask schedule(final Runnable task, final Duration delay) {
        final ScheduledFuture<?> future =
                executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(final Runnable task, final Duration initialDelay, final Duration period) {
        final ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                guarded(task), initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static Runnable guarded(final Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled task failed", e);
            }
        };
    }

    private static final class FutureTask implements ScheduledTask {
        private final ScheduledFuture<?> future;

        FutureTask(final ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
