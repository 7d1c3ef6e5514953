// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.concurrent;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ExecutorTaskSchedulerTest {

    private final ExecutorTaskScheduler scheduler = ExecutorTaskScheduler.create();

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void runsOneShotOnSchedulerThread() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        AtomicReference<Thread> thread = new AtomicReference<>();

        scheduler.schedule(() -> {
            thread.set(Thread.currentThread());
            ran.countDown();
        }, Duration.ofMillis(10));

        assertTrue(ran.await(5, TimeUnit.SECONDS));
        assertEquals("lantern-scheduler", thread.get().getName());
        assertTrue(thread.get().isDaemon());
    }

    @Test
    void cancelledTaskNeverRuns() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        ScheduledTask task = scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(200));

        task.cancel();
        Thread.sleep(400);

        assertTrue(task.isCancelled());
        assertEquals(0, runs.get());
    }

    @Test
    void periodicTaskSurvivesFailingTick() throws Exception {
        CountDownLatch ticks = new CountDownLatch(3);
        AtomicInteger count = new AtomicInteger();

        ScheduledTask task = scheduler.scheduleAtFixedRate(() -> {
            ticks.countDown();
            if (count.incrementAndGet() == 1) {
                throw new IllegalStateException("first tick fails");
            }
        }, Duration.ZERO, Duration.ofMillis(20));

        assertTrue(ticks.await(5, TimeUnit.SECONDS));
        task.cancel();
    }

    @Test
    void nowReadsTheClock() {
        Clock fixed = Clock.fixed(Instant.ofEpochMilli(42_000L), ZoneOffset.UTC);
        try (ExecutorTaskScheduler fixedScheduler =
                new ExecutorTaskScheduler(LanternExecutors.newScheduler(), fixed)) {
            assertEquals(42_000L, fixedScheduler.now());
        }
    }

    @Test
    void ioThreadsAreNamedDaemons() throws Exception {
        var executor = LanternExecutors.newIoBoundExecutor();
        try {
            Thread worker = executor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
            assertTrue(worker.getName().startsWith("lantern-io-"));
            assertTrue(worker.isDaemon());
        } finally {
            executor.shutdownNow();
        }
    }
}
