package com.questrail.plcbridge.support;

import com.questrail.plcbridge.api.FilterPolicy;
import com.questrail.plcbridge.api.StructureTemplate;
import com.questrail.plcbridge.api.VariableKind;
import com.questrail.plcbridge.config.BridgeConfig;
import com.questrail.plcbridge.config.PolicyConfig;
import com.questrail.plcbridge.internal.command.CommandRouter;
import com.questrail.plcbridge.internal.events.BridgeEvent;
import com.questrail.plcbridge.internal.events.VariableUpdateEvent.SingleUpdate;
import com.questrail.plcbridge.internal.exec.BridgeEventProcessor;
import com.questrail.plcbridge.internal.filter.ExceptionFilter;
import com.questrail.plcbridge.internal.mapping.TemplateDecomposer;
import com.questrail.plcbridge.internal.policy.PolicyTable;
import com.questrail.plcbridge.internal.rebirth.RebirthCoordinator;
import com.questrail.plcbridge.internal.registry.TemplateTable;
import com.questrail.plcbridge.internal.registry.VariableRegistry;
import com.questrail.plcbridge.observability.RecordingObservabilitySink;
import com.questrail.plcbridge.time.DeterministicScheduler;
import com.questrail.plcbridge.time.ManualMonotonicClock;
import com.questrail.plcbridge.time.ManualWallClock;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fully wired bridge core on deterministic time, without the driver thread.
 *
 * <p>Events the bridge feeds back to itself (debounce expiries) are queued
 * and processed synchronously by {@link #process} and {@link #advanceMillis},
 * which is exactly what the event loop would do.</p>
 */
public final class BridgeHarness {

    public static final String SCOPE = "edge-01";
    public static final String PLC = "plc";

    public final BridgeConfig config;
    public final ManualMonotonicClock clock = new ManualMonotonicClock();
    public final ManualWallClock wallClock = new ManualWallClock();
    public final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    public final RecordingTelemetryPublisher publisher = new RecordingTelemetryPublisher();
    public final RecordingCommandSender commands = new RecordingCommandSender();
    public final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    public final TemplateDecomposer decomposer;
    public final VariableRegistry registry;
    public final ExceptionFilter filter;
    public final PolicyTable policies;
    public final RebirthCoordinator coordinator;
    public final CommandRouter router;
    public final BridgeEventProcessor processor;

    private final Deque<BridgeEvent> loopback = new ArrayDeque<>();

    private BridgeHarness(BridgeConfig config, PolicyConfig policyConfig) {
        this.config = config;
        this.decomposer = new TemplateDecomposer(config.templateMode());
        this.registry = new VariableRegistry(decomposer, new TemplateTable());
        this.filter = new ExceptionFilter(clock, wallClock);
        this.policies = new PolicyTable(policyConfig);
        this.coordinator = new RebirthCoordinator(config.scope(), config.rebirthDebounce(), registry, filter,
                publisher, loopback::add, clock, scheduler, wallClock, sink);
        this.router = new CommandRouter(registry, decomposer, commands, config.fallbackCommandModuleId(), wallClock, sink);
        this.processor = new BridgeEventProcessor(config, registry, decomposer, filter, policies, coordinator,
                router, publisher, wallClock, sink);
    }

    public static BridgeHarness create() {
        return new BridgeHarness(BridgeConfig.defaults(SCOPE), PolicyConfig.none());
    }

    public static BridgeHarness create(BridgeConfig config) {
        return new BridgeHarness(config, PolicyConfig.none());
    }

    public static BridgeHarness create(BridgeConfig config, PolicyConfig policyConfig) {
        return new BridgeHarness(config, policyConfig);
    }

    public void process(BridgeEvent event) {
        processor.process(event);
        drainLoopback();
    }

    /**
     * Advances both clocks, fires due timers and processes what they fed back.
     */
    public void advanceMillis(long millis) {
        clock.advanceMillis(millis);
        wallClock.advance(Duration.ofMillis(millis));
        scheduler.runDueTasks();
        drainLoopback();
    }

    /**
     * Lets the rebirth debounce expire.
     */
    public void settle() {
        advanceMillis(config.rebirthDebounce().toMillis());
    }

    private void drainLoopback() {
        while (!loopback.isEmpty()) {
            processor.process(loopback.poll());
        }
    }

    // ------------------------------------------------------------------
    // Event factories
    // ------------------------------------------------------------------

    public SingleUpdate update(String variableId, VariableKind kind, Object value) {
        return SingleUpdate.of(wallClock.now(), PLC, variableId, kind, value);
    }

    public SingleUpdate number(String variableId, double value) {
        return update(variableId, VariableKind.NUMBER, value);
    }

    public SingleUpdate number(String variableId, double value, FilterPolicy policy) {
        return number(variableId, value).withPolicy(policy);
    }

    public SingleUpdate structured(String variableId, Object value, StructureTemplate template) {
        return update(variableId, VariableKind.STRUCTURED, value).withTemplate(template);
    }
}
