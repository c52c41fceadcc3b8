package com.questrail.plcbridge.runtime;

import com.questrail.plcbridge.api.CommandMetric;
import com.questrail.plcbridge.api.FilterPolicy;
import com.questrail.plcbridge.api.VariableKind;
import com.questrail.plcbridge.config.BridgeConfig;
import com.questrail.plcbridge.config.PolicyConfig;
import com.questrail.plcbridge.internal.events.BridgeEvent;
import com.questrail.plcbridge.internal.events.VariableUpdateEvent.SingleUpdate;
import com.questrail.plcbridge.observability.RecordingObservabilitySink;
import com.questrail.plcbridge.support.RecordingCommandSender;
import com.questrail.plcbridge.support.RecordingTelemetryPublisher;
import com.questrail.plcbridge.time.DeterministicScheduler;
import com.questrail.plcbridge.time.ManualMonotonicClock;
import com.questrail.plcbridge.time.ManualWallClock;
import com.questrail.plcbridge.transport.VariableEventSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BridgeRuntimeTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final ManualWallClock wallClock = new ManualWallClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingTelemetryPublisher publisher = new RecordingTelemetryPublisher();
    private final RecordingCommandSender commands = new RecordingCommandSender();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final AtomicReference<Consumer<BridgeEvent>> source = new AtomicReference<>();

    private BridgeRuntime runtime;

    @BeforeEach
    void setUp() {
        VariableEventSource eventSource = new VariableEventSource() {
            @Override
            public void start(Consumer<BridgeEvent> sink) {
                source.set(sink);
            }

            @Override
            public void stop() {
                source.set(null);
            }
        };

        runtime = BridgeRuntime.builder()
                .withConfig(BridgeConfig.defaults("edge-01"))
                .withTelemetryPublisher(publisher)
                .withCommandSender(commands)
                .withObservabilitySink(sink)
                .withEventSource(eventSource)
                .withScheduler(scheduler, clock)
                .withWallClock(wallClock)
                .build();
        runtime.start();
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + 2_000_000_000L;
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met in time");
            }
            Thread.sleep(5);
        }
    }

    private void settle() {
        clock.advanceMillis(BridgeConfig.DEFAULT_REBIRTH_DEBOUNCE.toMillis());
        scheduler.runDueTasks();
    }

    @Test
    void sourceEventsFlowThroughToAnnouncement() throws InterruptedException {
        source.get().accept(SingleUpdate.of(wallClock.now(), "plc", "temp", VariableKind.NUMBER, 20.0));
        await(() -> scheduler.liveTaskCount() == 1);
        assertEquals(1, sink.getSchemaChanges().size());

        settle();
        await(() -> publisher.schemaCalls().size() == 1);

        assertEquals(20.0, publisher.lastSchema().metric("temp").orElseThrow().value());
    }

    @Test
    void commandsAreRoutedOnTheLoop() throws InterruptedException {
        runtime.submit(SingleUpdate.of(wallClock.now(), "pid", "setpoint", VariableKind.NUMBER, 1.0));
        runtime.onCommand("edge-01", List.of(new CommandMetric("setpoint", 5)));

        await(() -> !commands.commands().isEmpty());
        assertEquals("pid", commands.single().ownerModuleId());
    }

    @Test
    void explicitRebirthAnnouncesAgain() throws InterruptedException {
        runtime.submit(SingleUpdate.of(wallClock.now(), "plc", "temp", VariableKind.NUMBER, 20.0));
        await(() -> scheduler.liveTaskCount() == 1);
        settle();
        await(() -> publisher.schemaCalls().size() == 1);

        runtime.requestRebirth();
        await(() -> scheduler.liveTaskCount() == 1);
        settle();
        await(() -> publisher.schemaCalls().size() == 2);
    }

    @Test
    void policyUpdatesApplyToLaterEvents() throws InterruptedException {
        runtime.submit(SingleUpdate.of(wallClock.now(), "plc", "temp", VariableKind.NUMBER, 20.0));
        await(() -> scheduler.liveTaskCount() == 1);
        settle();
        await(() -> publisher.schemaCalls().size() == 1);

        runtime.updatePolicies(PolicyConfig.builder().withDefaultPolicy(FilterPolicy.deadband(10.0)).build());
        runtime.submit(SingleUpdate.of(wallClock.now(), "plc", "temp", VariableKind.NUMBER, 25.0));
        runtime.submit(SingleUpdate.of(wallClock.now(), "plc", "temp", VariableKind.NUMBER, 31.0));

        await(() -> publisher.publishedValues().size() == 1);
        assertEquals(31.0, publisher.publishedValues().get(0).value());
    }

    @Test
    void stopUnsubscribesAndStopsTheLoop() {
        assertTrue(runtime.isRunning());

        runtime.stop();

        assertFalse(runtime.isRunning());
        assertNull(source.get());
    }
}
