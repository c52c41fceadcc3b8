package com.questrail.plcbridge.internal.exec;

import com.questrail.plcbridge.internal.events.BridgeEvent;
import com.questrail.plcbridge.internal.events.RebirthEvent;
import com.questrail.plcbridge.observability.BridgeErrorEvent;
import com.questrail.plcbridge.observability.RecordingObservabilitySink;
import com.questrail.plcbridge.time.ManualWallClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BridgeOperationalDriverTest {

    private final ManualWallClock wallClock = new ManualWallClock();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private BridgeOperationalDriver driver;

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.stop();
        }
    }

    private BridgeOperationalDriver driver(Consumer<BridgeEvent> processor) {
        driver = new BridgeOperationalDriver(processor, wallClock, sink);
        return driver;
    }

    private RebirthEvent.RebirthDue due(long seq) {
        return new RebirthEvent.RebirthDue(wallClock.now(), seq);
    }

    @Test
    void startAndStopAreIdempotent() {
        driver(e -> { });

        driver.start();
        driver.start();
        assertTrue(driver.isRunning());

        driver.stop();
        driver.stop();
        assertFalse(driver.isRunning());
    }

    @Test
    void eventsAreProcessedInSubmissionOrder() throws InterruptedException {
        List<Long> seen = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(5);
        driver(e -> {
            synchronized (seen) {
                seen.add(((RebirthEvent.RebirthDue) e).sequence());
            }
            done.countDown();
        }).start();

        for (long i = 1; i <= 5; i++) {
            driver.submitEvent(due(i));
        }

        assertTrue(done.await(1, TimeUnit.SECONDS));
        synchronized (seen) {
            assertEquals(List.of(1L, 2L, 3L, 4L, 5L), seen);
        }
    }

    @Test
    void failingEventIsReportedAndLoopContinues() throws InterruptedException {
        CountDownLatch survived = new CountDownLatch(1);
        driver(e -> {
            if (((RebirthEvent.RebirthDue) e).sequence() == 1) {
                throw new IllegalStateException("boom");
            }
            survived.countDown();
        }).start();

        driver.submitEvent(due(1));
        driver.submitEvent(due(2));

        assertTrue(survived.await(1, TimeUnit.SECONDS));
        assertEquals(1, sink.getErrors(BridgeErrorEvent.Kind.PROCESSING_FAILURE).size());
    }

    @Test
    void eventsSubmittedWhileStoppedAreDiscarded() throws InterruptedException {
        CountDownLatch processed = new CountDownLatch(1);
        driver(e -> processed.countDown());

        driver.submitEvent(due(1));
        driver.start();

        assertFalse(processed.await(100, TimeUnit.MILLISECONDS));
    }
}
