package com.questrail.plcbridge.runtime;

import com.questrail.plcbridge.api.CommandMetric;
import com.questrail.plcbridge.api.ModuleCommandSender;
import com.questrail.plcbridge.api.TelemetryPublisher;
import com.questrail.plcbridge.config.BridgeConfig;
import com.questrail.plcbridge.config.PolicyConfig;
import com.questrail.plcbridge.internal.command.CommandRouter;
import com.questrail.plcbridge.internal.events.BridgeEvent;
import com.questrail.plcbridge.internal.events.RebirthEvent;
import com.questrail.plcbridge.internal.events.TelemetryCommandEvent;
import com.questrail.plcbridge.internal.exec.BridgeEventProcessor;
import com.questrail.plcbridge.internal.exec.BridgeOperationalDriver;
import com.questrail.plcbridge.internal.filter.ExceptionFilter;
import com.questrail.plcbridge.internal.mapping.TemplateDecomposer;
import com.questrail.plcbridge.internal.policy.PolicyTable;
import com.questrail.plcbridge.internal.rebirth.RebirthCoordinator;
import com.questrail.plcbridge.internal.registry.TemplateTable;
import com.questrail.plcbridge.internal.registry.VariableRegistry;
import com.questrail.plcbridge.internal.time.MonotonicClock;
import com.questrail.plcbridge.internal.time.MonotonicScheduler;
import com.questrail.plcbridge.internal.time.ScheduledExecutorScheduler;
import com.questrail.plcbridge.internal.time.SystemMonotonicClock;
import com.questrail.plcbridge.internal.time.SystemWallClock;
import com.questrail.plcbridge.internal.time.WallClock;
import com.questrail.plcbridge.observability.BridgeObservabilitySink;
import com.questrail.plcbridge.observability.NullObservabilitySink;
import com.questrail.plcbridge.transport.VariableEventSource;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * BridgeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one bridge instance.
 *
 * <h2>Wiring</h2>
 * The runtime builds the registry, filter, policy table, rebirth coordinator
 * and command router, binds them into a {@link BridgeEventProcessor} and runs
 * that processor on a {@link BridgeOperationalDriver}. Debounce expiries are
 * fed back into the same driver.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.start()  → event loop, then inbound subscription
 *   runtime.stop()   → inbound subscription, then event loop, then timers
 * </pre>
 *
 * <h2>Threading</h2>
 * {@link #submit}, {@link #onCommand}, {@link #requestRebirth},
 * {@link #updatePolicies} and {@link #updateOverride} may be called from any
 * thread.
 */
public final class BridgeRuntime
{
    private final BridgeConfig config;
    private final BridgeOperationalDriver driver;
    private final RebirthCoordinator coordinator;
    private final PolicyTable policies;
    private final VariableEventSource eventSource;
    private final ScheduledExecutorService ownedSchedulerExecutor;
    private final WallClock wallClock;

    private BridgeRuntime(BridgeConfig config,
                          BridgeOperationalDriver driver,
                          RebirthCoordinator coordinator,
                          PolicyTable policies,
                          VariableEventSource eventSource,
                          ScheduledExecutorService ownedSchedulerExecutor,
                          WallClock wallClock) {
        this.config = config;
        this.driver = driver;
        this.coordinator = coordinator;
        this.policies = policies;
        this.eventSource = eventSource;
        this.ownedSchedulerExecutor = ownedSchedulerExecutor;
        this.wallClock = wallClock;
    }

    public void start() {
        driver.start();
        if (eventSource != null) {
            eventSource.start(driver::submitEvent);
        }
    }

    public void stop() {
        if (eventSource != null) {
            eventSource.stop();
        }
        driver.stop();
        coordinator.cancel();

        if (ownedSchedulerExecutor != null) {
            ownedSchedulerExecutor.shutdown();
            try {
                if (!ownedSchedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedSchedulerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedSchedulerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public BridgeConfig config() {
        return config;
    }

    public boolean isRunning() {
        return driver.isRunning();
    }

    /**
     * Submits an event to the bridge loop. Used by event sources that are not
     * registered with the builder.
     */
    public void submit(BridgeEvent event) {
        driver.submitEvent(event);
    }

    /**
     * Entry point for reverse commands received by the telemetry side.
     */
    public void onCommand(String scope, List<CommandMetric> metrics) {
        driver.submitEvent(new TelemetryCommandEvent.CommandReceived(wallClock.now(), scope, metrics));
    }

    /**
     * Requests a full re-announcement, for example after the telemetry
     * session was re-established.
     */
    public void requestRebirth() {
        driver.submitEvent(new RebirthEvent.RebirthRequested(wallClock.now()));
    }

    /**
     * Replaces the whole policy configuration. Takes effect from the next
     * event processed.
     */
    public void updatePolicies(PolicyConfig config) {
        policies.replace(config);
    }

    /**
     * Replaces the override of a single variable.
     */
    public void updateOverride(String variableId, PolicyConfig.VariableOverride override) {
        policies.put(variableId, override);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeConfig config;
        private TelemetryPublisher publisher;
        private ModuleCommandSender commandSender;
        private PolicyConfig policyConfig = PolicyConfig.none();
        private BridgeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private VariableEventSource eventSource;
        private MonotonicClock clock;
        private MonotonicScheduler scheduler;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(BridgeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTelemetryPublisher(TelemetryPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder withCommandSender(ModuleCommandSender sender) {
            this.commandSender = sender;
            return this;
        }

        public Builder withPolicyConfig(PolicyConfig policyConfig) {
            this.policyConfig = policyConfig;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withEventSource(VariableEventSource source) {
            this.eventSource = source;
            return this;
        }

        /**
         * Supplies the timer and its clock. Both must share one tick domain.
         * When not set, a single-threaded scheduled executor owned by the
         * runtime is used.
         */
        public Builder withScheduler(MonotonicScheduler scheduler, MonotonicClock clock) {
            this.scheduler = scheduler;
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public BridgeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(publisher, "publisher");
            Objects.requireNonNull(commandSender, "commandSender");
            Objects.requireNonNull(policyConfig, "policyConfig");
            Objects.requireNonNull(wallClock, "wallClock");
            BridgeObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Time
            MonotonicClock monotonicClock = clock;
            MonotonicScheduler timer = scheduler;
            ScheduledExecutorService ownedExecutor = null;
            if (timer == null) {
                monotonicClock = SystemMonotonicClock.INSTANCE;
                ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "plc-bridge-scheduler");
                    t.setDaemon(true);
                    return t;
                });
                timer = new ScheduledExecutorScheduler(ownedExecutor, monotonicClock);
            }
            Objects.requireNonNull(monotonicClock, "clock");

            // 2. State owned by the event loop
            TemplateDecomposer decomposer = new TemplateDecomposer(config.templateMode());
            VariableRegistry registry = new VariableRegistry(decomposer, new TemplateTable());
            ExceptionFilter filter = new ExceptionFilter(monotonicClock, wallClock);
            PolicyTable policies = new PolicyTable(policyConfig);

            // 3. The driver needs the processor and the coordinator needs the
            //    driver; the forwarding lambda closes the loop.
            BridgeOperationalDriver[] driverRef = new BridgeOperationalDriver[1];
            RebirthCoordinator coordinator = new RebirthCoordinator(
                    config.scope(),
                    config.rebirthDebounce(),
                    registry,
                    filter,
                    publisher,
                    event -> driverRef[0].submitEvent(event),
                    monotonicClock,
                    timer,
                    wallClock,
                    sink);

            CommandRouter router = new CommandRouter(
                    registry,
                    decomposer,
                    commandSender,
                    config.fallbackCommandModuleId(),
                    wallClock,
                    sink);

            BridgeEventProcessor processor = new BridgeEventProcessor(
                    config,
                    registry,
                    decomposer,
                    filter,
                    policies,
                    coordinator,
                    router,
                    publisher,
                    wallClock,
                    sink);

            BridgeOperationalDriver driver = new BridgeOperationalDriver(processor::process, wallClock, sink);
            driverRef[0] = driver;

            return new BridgeRuntime(config, driver, coordinator, policies, eventSource, ownedExecutor, wallClock);
        }
    }
}
