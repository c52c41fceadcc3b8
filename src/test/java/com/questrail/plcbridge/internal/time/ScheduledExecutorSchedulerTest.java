package com.questrail.plcbridge.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs against real time; waits are generous so a loaded machine does not
 * produce false failures.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static long inMillis(long millis) {
        return SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(millis);
    }

    @Test
    void firesAtDeadline() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);

        scheduler.scheduleAtNanos(inMillis(30), fired::countDown);

        assertTrue(fired.await(1, TimeUnit.SECONDS));
    }

    @Test
    void deadlineInThePastFiresPromptly() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);

        scheduler.scheduleAtNanos(inMillis(-1000), fired::countDown);

        assertTrue(fired.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void rearmedDebounceFiresOnlyTheLastTask() throws InterruptedException {
        List<String> fired = new CopyOnWriteArrayList<>();
        CountDownLatch last = new CountDownLatch(1);

        Cancellable first = scheduler.scheduleAtNanos(inMillis(80), () -> fired.add("first"));
        assertTrue(first.cancel());
        scheduler.scheduleAtNanos(inMillis(100), () -> {
            fired.add("second");
            last.countDown();
        });

        assertTrue(last.await(1, TimeUnit.SECONDS));
        Thread.sleep(50);
        assertEquals(List.of("second"), fired);
    }

    @Test
    void cancelAfterRunReportsFalse() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        AtomicBoolean ran = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAtNanos(inMillis(0), () -> {
            ran.set(true);
            fired.countDown();
        });

        assertTrue(fired.await(500, TimeUnit.MILLISECONDS));
        assertTrue(ran.get());
        assertFalse(handle.cancel());
    }
}
