package com.questrail.plcbridge.internal.exec;

import com.questrail.plcbridge.api.FilterPolicy;
import com.questrail.plcbridge.api.MetricValue;
import com.questrail.plcbridge.api.PublisherUnavailableException;
import com.questrail.plcbridge.api.StructureTemplate;
import com.questrail.plcbridge.api.TelemetryPublisher;
import com.questrail.plcbridge.api.VariableKind;
import com.questrail.plcbridge.config.BridgeConfig;
import com.questrail.plcbridge.config.TemplateMode;
import com.questrail.plcbridge.internal.command.CommandRouter;
import com.questrail.plcbridge.internal.events.BridgeEvent;
import com.questrail.plcbridge.internal.events.RebirthEvent;
import com.questrail.plcbridge.internal.events.TelemetryCommandEvent;
import com.questrail.plcbridge.internal.events.VariableUpdateEvent;
import com.questrail.plcbridge.internal.events.VariableUpdateEvent.BatchItem;
import com.questrail.plcbridge.internal.events.VariableUpdateEvent.BatchUpdate;
import com.questrail.plcbridge.internal.events.VariableUpdateEvent.SingleUpdate;
import com.questrail.plcbridge.internal.filter.ExceptionFilter;
import com.questrail.plcbridge.internal.mapping.TemplateDecomposer;
import com.questrail.plcbridge.internal.mapping.TypeMapper;
import com.questrail.plcbridge.internal.policy.EffectivePolicy;
import com.questrail.plcbridge.internal.policy.PolicyTable;
import com.questrail.plcbridge.internal.rebirth.RebirthCoordinator;
import com.questrail.plcbridge.internal.registry.TemplateTable;
import com.questrail.plcbridge.internal.registry.UpsertResult;
import com.questrail.plcbridge.internal.registry.Variable;
import com.questrail.plcbridge.internal.registry.VariableRegistry;
import com.questrail.plcbridge.internal.registry.VariableUpdate;
import com.questrail.plcbridge.internal.time.WallClock;
import com.questrail.plcbridge.observability.BridgeErrorEvent;
import com.questrail.plcbridge.observability.BridgeObservabilitySink;
import com.questrail.plcbridge.observability.SchemaChangeEvent;
import com.questrail.plcbridge.observability.ValuesPublishedEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * BridgeEventProcessor
 * =============================================================================
 * Processes one {@link BridgeEvent} to completion.
 *
 * <h2>Role in the architecture</h2>
 * The processor is the unit of work run by {@link BridgeOperationalDriver}.
 * It owns no thread; it is called with one event at a time and is the only
 * code that touches the registry, the exception filter, the rebirth
 * coordinator and the command router.
 *
 * <h2>Variable updates</h2>
 * <ol>
 *   <li>Events from ignored source modules are dropped.</li>
 *   <li>The effective policy is resolved; a variable disabled by an override
 *       is dropped.</li>
 *   <li>Structured values are decomposed before anything is mutated.</li>
 *   <li>The registry is updated. A new metric or a changed representation
 *       requests a rebirth and nothing is published for it now; the next
 *       announcement carries its value.</li>
 *   <li>Otherwise, unless a rebirth is pending, the value goes through the
 *       exception filter and is published if it passes.</li>
 * </ol>
 *
 * <h2>Failure isolation</h2>
 * Any exception while processing an event is reported to the observability
 * sink and the event is dropped. Publisher unavailability is not retried.
 */
public final class BridgeEventProcessor
{
    private final BridgeConfig config;
    private final VariableRegistry registry;
    private final TemplateDecomposer decomposer;
    private final ExceptionFilter filter;
    private final PolicyTable policies;
    private final RebirthCoordinator coordinator;
    private final CommandRouter router;
    private final TelemetryPublisher publisher;
    private final WallClock wallClock;
    private final BridgeObservabilitySink sink;

    public BridgeEventProcessor(BridgeConfig config,
                                VariableRegistry registry,
                                TemplateDecomposer decomposer,
                                ExceptionFilter filter,
                                PolicyTable policies,
                                RebirthCoordinator coordinator,
                                CommandRouter router,
                                TelemetryPublisher publisher,
                                WallClock wallClock,
                                BridgeObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.decomposer = Objects.requireNonNull(decomposer, "decomposer");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.policies = Objects.requireNonNull(policies, "policies");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.router = Objects.requireNonNull(router, "router");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void process(BridgeEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            if (event instanceof SingleUpdate single) {
                onSingleUpdate(single);
            } else if (event instanceof BatchUpdate batch) {
                onBatchUpdate(batch);
            } else if (event instanceof TelemetryCommandEvent.CommandReceived command) {
                onCommand(command);
            } else if (event instanceof RebirthEvent.RebirthDue due) {
                coordinator.onRebirthDue(due);
            } else if (event instanceof RebirthEvent.RebirthRequested) {
                coordinator.requestRebirth();
            } else {
                sink.onError(BridgeErrorEvent.of(wallClock.now(), BridgeErrorEvent.Kind.PROCESSING_FAILURE,
                        "unsupported event " + event.getClass().getSimpleName()));
            }
        } catch (RuntimeException e) {
            sink.onError(new BridgeErrorEvent(wallClock.now(), BridgeErrorEvent.Kind.PROCESSING_FAILURE,
                    "failed to process " + event, e));
        }
    }

    // ---------------------------------------------------------------------
    // Single-value updates
    // ---------------------------------------------------------------------

    private void onSingleUpdate(SingleUpdate u) {
        if (isIgnored(u)) {
            return;
        }
        coordinator.requestRebirthIfOwed();

        Optional<EffectivePolicy> effective = policies.resolve(u.variableId(), u.policy());
        if (effective.isEmpty()) {
            return;
        }
        FilterPolicy policy = effective.get().orNull();

        VariableUpdate update = VariableUpdate.of(u.variableId(), u.ownerModuleId(), u.declaredKind(), u.value(), policy, null)
                .withFilterDisabled(u.filterDisabled().orElse(null))
                .withDescription(u.description().orElse(null));

        if (TypeMapper.resolveKind(u.declaredKind(), u.value()) == VariableKind.STRUCTURED) {
            onStructured(update, u.template(), u.timestamp());
            return;
        }

        UpsertResult result = registry.upsert(update);
        if (result.requiresAnnouncement()) {
            reportSchemaChange(result, u.timestamp());
            coordinator.requestRebirth();
            return;
        }
        publishIfChanged(result.variable(), Optional.ofNullable(policy), u.timestamp());
    }

    // ---------------------------------------------------------------------
    // Structured updates
    // ---------------------------------------------------------------------

    private void onStructured(VariableUpdate update, Optional<StructureTemplate> declared, Instant timestamp) {
        StructureTemplate template = declared.orElseGet(() -> registry.find(update.id())
                .flatMap(Variable::template)
                .orElse(null));

        // A whole structured metric without a policy is compared by deep equality.
        Optional<FilterPolicy> filterPolicy = Optional.of(update.policy() == null ? FilterPolicy.ON_CHANGE : update.policy());

        if (template == null) {
            // No template: published as a JSON text metric.
            UpsertResult result = registry.upsert(update);
            if (result.requiresAnnouncement()) {
                reportSchemaChange(result, timestamp);
                coordinator.requestRebirth();
                return;
            }
            publishIfChanged(result.variable(), filterPolicy, timestamp);
            return;
        }

        // Decompose before any mutation; a failure here leaves no partial state.
        StructureTemplate effective = registry.templates().find(template.name()).orElse(template);
        Map<String, Object> normalized = decomposer.normalize(effective, update.value());
        List<TemplateDecomposer.FlatMember> members = decomposer.mode() == TemplateMode.FLAT
                ? decomposer.flatten(update.id(), effective, normalized)
                : List.of();

        TemplateTable.Registration registration = registry.templates().register(template);
        if (registration.outcome() == TemplateTable.Outcome.MISMATCH) {
            sink.onError(BridgeErrorEvent.of(timestamp, BridgeErrorEvent.Kind.TEMPLATE_MISMATCH,
                    "template " + template.name() + " re-declared by " + update.id()
                            + " with a different shape; keeping the first registration"));
        }

        UpsertResult parent = registry.upsert(new VariableUpdate(update.id(), update.ownerModuleId(), VariableKind.STRUCTURED,
                normalized, update.policy(), update.filterDisabled(), registration.template(), update.description(),
                null, null));

        if (decomposer.mode() == TemplateMode.NESTED) {
            boolean definitionAdded = registration.isNew();
            if (parent.requiresAnnouncement() || definitionAdded) {
                reportSchemaChange(parent, timestamp);
                coordinator.requestRebirth();
                return;
            }
            publishIfChanged(parent.variable(), filterPolicy, timestamp);
            return;
        }

        boolean announce = parent.schemaChanged();
        if (announce) {
            reportSchemaChange(parent, timestamp);
        }
        Boolean disabled = parent.variable().filterDisabled();
        List<Variable> candidates = new ArrayList<>(members.size());
        for (TemplateDecomposer.FlatMember member : members) {
            UpsertResult result = registry.upsert(
                    VariableUpdate.of(member.metricName(), update.ownerModuleId(), member.kind(), member.value(), update.policy(), null)
                            .withFilterDisabled(disabled)
                            .asMemberOf(update.id(), member.memberName()));
            if (result.requiresAnnouncement()) {
                reportSchemaChange(result, timestamp);
                announce = true;
            } else {
                candidates.add(result.variable());
            }
        }

        if (announce) {
            coordinator.requestRebirth();
            return;
        }
        // Flat members are ordinary primitive metrics: no policy means no filtering.
        publishFiltered(candidates, Optional.ofNullable(update.policy()), timestamp);
    }

    // ---------------------------------------------------------------------
    // Batch updates
    // ---------------------------------------------------------------------

    private void onBatchUpdate(BatchUpdate batch) {
        if (isIgnored(batch)) {
            return;
        }
        coordinator.requestRebirthIfOwed();

        boolean rebirth = false;
        List<Variable> candidates = new ArrayList<>();
        List<Optional<FilterPolicy>> candidatePolicies = new ArrayList<>();

        for (BatchItem item : batch.items()) {
            Optional<EffectivePolicy> effective = policies.resolve(item.variableId(), item.policy());
            if (effective.isEmpty()) {
                continue;
            }
            FilterPolicy policy = effective.get().orNull();
            VariableUpdate update = VariableUpdate.of(
                    item.variableId(), batch.ownerModuleId(), item.declaredKind(), item.value(), policy, null);

            if (TypeMapper.resolveKind(item.declaredKind(), item.value()) == VariableKind.STRUCTURED) {
                onStructured(update, Optional.empty(), batch.timestamp());
                continue;
            }

            UpsertResult result = registry.upsert(update);
            if (result.requiresAnnouncement()) {
                reportSchemaChange(result, batch.timestamp());
                rebirth = true;
            } else {
                candidates.add(result.variable());
                candidatePolicies.add(Optional.ofNullable(policy));
            }
        }

        if (rebirth) {
            coordinator.requestRebirth();
        }
        if (coordinator.isPending()) {
            return;
        }

        List<MetricValue> values = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            collectIfChanged(candidates.get(i), candidatePolicies.get(i), batch.timestamp(), values);
        }
        if (!values.isEmpty()) {
            publish(values);
        }
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    private void onCommand(TelemetryCommandEvent.CommandReceived command) {
        if (!config.scope().equals(command.scope())) {
            sink.onError(BridgeErrorEvent.of(command.timestamp(), BridgeErrorEvent.Kind.PROCESSING_FAILURE,
                    "command for scope " + command.scope() + " ignored; this bridge serves " + config.scope()));
            return;
        }
        router.routeAll(command.metrics());
    }

    // ---------------------------------------------------------------------
    // Publication
    // ---------------------------------------------------------------------

    private void publishIfChanged(Variable variable, Optional<FilterPolicy> policy, Instant timestamp) {
        publishFiltered(List.of(variable), policy, timestamp);
    }

    private void publishFiltered(List<Variable> variables, Optional<FilterPolicy> policy, Instant timestamp) {
        if (coordinator.isPending()) {
            return;
        }
        List<MetricValue> values = new ArrayList<>(variables.size());
        for (Variable v : variables) {
            collectIfChanged(v, policy, timestamp, values);
        }
        if (!values.isEmpty()) {
            publish(values);
        }
    }

    private void collectIfChanged(Variable v, Optional<FilterPolicy> policy, Instant timestamp, List<MetricValue> out) {
        if (v.metricType().isEmpty()) {
            return;
        }
        Object value = registry.publishedValue(v);
        if (filter.shouldPublish(v.id(), value, policy, v.filterDisabled())) {
            out.add(new MetricValue(v.id(), v.metricType().get(), value, timestamp));
        }
    }

    private void publish(List<MetricValue> values) {
        try {
            publisher.publishValues(config.scope(), values);
        } catch (PublisherUnavailableException e) {
            sink.onError(new BridgeErrorEvent(wallClock.now(), BridgeErrorEvent.Kind.PUBLISHER_UNAVAILABLE,
                    values.size() + " value(s) for " + config.scope() + " dropped", e));
            return;
        }
        for (MetricValue value : values) {
            filter.recordPublish(value.metricName(), value.value());
        }
        sink.onValuesPublished(new ValuesPublishedEvent(wallClock.now(), config.scope(), values));
    }

    private boolean isIgnored(VariableUpdateEvent event) {
        return config.ignoredSourceModules().contains(event.ownerModuleId());
    }

    private void reportSchemaChange(UpsertResult result, Instant timestamp) {
        Variable v = result.variable();
        sink.onSchemaChange(new SchemaChangeEvent(
                timestamp,
                v.id(),
                result.previousType(),
                v.metricType().orElse(null)));
    }
}
