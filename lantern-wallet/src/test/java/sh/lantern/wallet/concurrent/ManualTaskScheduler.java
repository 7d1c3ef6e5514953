// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.concurrent;

import java.time.Duration;
import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Deterministic {@link TaskScheduler} for tests: time only moves on {@link #advance(Duration)}.
 */
public final class ManualTaskScheduler implements TaskScheduler {

    private final PriorityQueue<Entry> queue = new PriorityQueue<>(
            Comparator.comparingLong((Entry e) -> e.dueAt).thenComparingLong(e -> e.sequence));
    private long now;
    private long sequence;
    private boolean closed;

    public ManualTaskScheduler() {
        this(1_700_000_000_000L);
    }

    public ManualTaskScheduler(final long startMillis) {
        this.now = startMillis;
    }

    @Override
    public synchronized long now() {
        return now;
    }

    @Override
    public synchronized ScheduledTask schedule(final Runnable task, final Duration delay) {
        return enqueue(task, now + delay.toMillis(), 0);
    }

    @Override
    public synchronized ScheduledTask scheduleAtFixedRate(
            final Runnable task, final Duration initialDelay, final Duration period) {
        return enqueue(task, now + initialDelay.toMillis(), period.toMillis());
    }

    /**
     * Moves the clock forward, running every task that falls due on the way in due order.
     */
    public void advance(final Duration duration) {
        final long target;
        synchronized (this) {
            target = now + duration.toMillis();
        }
        while (true) {
            final Entry next;
            synchronized (this) {
                next = queue.peek();
                if (next == null || next.dueAt > target) {
                    now = target;
                    return;
                }
                queue.poll();
                if (next.cancelled) {
                    continue;
                }
                now = next.dueAt;
                if (next.period > 0) {
                    next.dueAt += next.period;
                    next.sequence = sequence++;
                    queue.add(next);
                }
            }
            next.task.run();
        }
    }

    /**
     * Runs tasks that are due now without moving the clock.
     */
    public void runDue() {
        advance(Duration.ZERO);
    }

    /**
     * Number of scheduled, not cancelled tasks.
     */
    public synchronized int pendingTasks() {
        return (int) queue.stream().filter(e -> !e.cancelled).count();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        closed = true;
        queue.forEach(e -> e.cancelled = true);
        queue.clear();
    }

    private ScheduledTask enqueue(final Runnable task, final long dueAt, final long period) {
        final Entry entry = new Entry(task, dueAt, period, sequence++);
        if (!closed) {
            queue.add(entry);
        } else {
            entry.cancelled = true;
        }
        return entry;
    }

    private final class Entry implements ScheduledTask {
        final Runnable task;
        final long period;
        long dueAt;
        long sequence;
        volatile boolean cancelled;

        Entry(final Runnable task, final long dueAt, final long period, final long sequence) {
            this.task = task;
            this.dueAt = dueAt;
            this.period = period;
            this.sequence = sequence;
        }

        @Override
        public void cancel() {
            synchronized (ManualTaskScheduler.this) {
                cancelled = true;
                queue.remove(this);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
