package com.questrail.plcbridge.internal.command;

import com.questrail.plcbridge.api.CommandMetric;
import com.questrail.plcbridge.api.ModuleCommand;
import com.questrail.plcbridge.api.ModuleCommandSender;
import com.questrail.plcbridge.api.TemplateValue;
import com.questrail.plcbridge.api.VariableKind;
import com.questrail.plcbridge.internal.mapping.TemplateDecomposer;
import com.questrail.plcbridge.internal.mapping.TypeMapper;
import com.questrail.plcbridge.internal.registry.Variable;
import com.questrail.plcbridge.internal.registry.VariableRegistry;
import com.questrail.plcbridge.internal.time.WallClock;
import com.questrail.plcbridge.observability.BridgeErrorEvent;
import com.questrail.plcbridge.observability.BridgeObservabilitySink;
import com.questrail.plcbridge.observability.CommandRoutedEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CommandRouter
 * =============================================================================
 * Routes reverse commands from the telemetry side to the module that owns the
 * addressed variable.
 *
 * <h2>Resolution</h2>
 * A metric name is looked up as a variable id first. If that fails and the
 * name contains {@code '/'}, its last segment is tried. Names that still do
 * not resolve are forwarded to the fallback module with their value passed
 * through by runtime shape and marked unverified.
 *
 * <h2>Shapes</h2>
 * <ul>
 *   <li>templated structured variable with a member-list payload: one member
 *       command per listed member</li>
 *   <li>flat-mode member variable: one member command addressed to the
 *       parent</li>
 *   <li>anything else: one scalar command, value converted with the
 *       variable's kind</li>
 * </ul>
 *
 * <p>After a command is sent, the registry value is updated. Nothing is
 * published; the owning module echoes the new value through the normal data
 * path.</p>
 *
 * <p>Runs on the bridge event loop.</p>
 */
public final class CommandRouter
{
    private final VariableRegistry registry;
    private final TemplateDecomposer decomposer;
    private final ModuleCommandSender sender;
    private final String fallbackModuleId;
    private final WallClock wallClock;
    private final BridgeObservabilitySink sink;

    public CommandRouter(VariableRegistry registry,
                         TemplateDecomposer decomposer,
                         ModuleCommandSender sender,
                         String fallbackModuleId,
                         WallClock wallClock,
                         BridgeObservabilitySink sink)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.decomposer = Objects.requireNonNull(decomposer, "decomposer");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.fallbackModuleId = Objects.requireNonNull(fallbackModuleId, "fallbackModuleId");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Routes every metric of one command independently. A failure on one
     * metric is reported and does not stop the others.
     */
    public List<RoutingResult> routeAll(List<CommandMetric> metrics) {
        List<RoutingResult> results = new ArrayList<>(metrics.size());
        for (CommandMetric metric : metrics) {
            try {
                results.add(route(metric.metricName(), metric.value()));
            } catch (RuntimeException e) {
                sink.onError(new BridgeErrorEvent(wallClock.now(), BridgeErrorEvent.Kind.PROCESSING_FAILURE,
                        "command for " + metric.metricName() + " failed", e));
                results.add(new RoutingResult.Failed(metric.metricName(), e));
            }
        }
        return results;
    }

    public RoutingResult route(String metricName, Object rawValue) {
        Objects.requireNonNull(metricName, "metricName");

        String variableId = metricName;
        Optional<Variable> resolved = registry.find(metricName);
        if (resolved.isEmpty() && metricName.contains("/")) {
            variableId = metricName.substring(metricName.lastIndexOf('/') + 1);
            resolved = registry.find(variableId);
        }

        if (resolved.isEmpty()) {
            return routeUnknown(metricName, variableId, rawValue);
        }

        Variable variable = resolved.get();
        if (variable.kind() == VariableKind.STRUCTURED
                && variable.template().isPresent()
                && rawValue instanceof TemplateValue payload) {
            return routeMembers(metricName, variable, payload);
        }
        if (variable.isFlatMember()) {
            return routeFlatMember(metricName, variable, rawValue);
        }
        return routeScalar(metricName, variable, rawValue);
    }

    private RoutingResult routeMembers(String metricName, Variable variable, TemplateValue payload) {
        List<ModuleCommand> sent = new ArrayList<>();
        for (TemplateDecomposer.MemberCommand mc : decomposer.memberCommands(variable.template().get(), payload)) {
            ModuleCommand command = ModuleCommand.member(
                    variable.ownerModuleId(), variable.id(), mc.memberName(), mc.value());
            send(metricName, command);
            registry.applyMemberCommandValue(variable, mc.memberName(), mc.value());
            sent.add(command);
        }
        return new RoutingResult.Routed(metricName, variable.id(), sent);
    }

    private RoutingResult routeFlatMember(String metricName, Variable variable, Object rawValue) {
        Object value = TypeMapper.toDomain(rawValue, variable.kind());
        String parentId = variable.parentId().orElseThrow();
        String memberName = variable.memberName().orElseThrow();

        ModuleCommand command = ModuleCommand.member(variable.ownerModuleId(), parentId, memberName, value);
        send(metricName, command);

        registry.applyCommandValue(variable, value);
        registry.find(parentId).ifPresent(parent -> registry.applyMemberCommandValue(parent, memberName, value));
        return new RoutingResult.Routed(metricName, variable.id(), List.of(command));
    }

    private RoutingResult routeScalar(String metricName, Variable variable, Object rawValue) {
        Object value = TypeMapper.toDomain(rawValue, variable.kind());

        ModuleCommand command = ModuleCommand.scalar(variable.ownerModuleId(), variable.id(), value);
        send(metricName, command);

        if (!registry.applyCommandValue(variable, value)) {
            sink.onError(BridgeErrorEvent.of(wallClock.now(), BridgeErrorEvent.Kind.PROCESSING_FAILURE,
                    "command for " + metricName + " sent, but " + variable.id()
                            + " keeps its value: structured variables only accept member maps"));
        }
        return new RoutingResult.Routed(metricName, variable.id(), List.of(command));
    }

    private RoutingResult routeUnknown(String metricName, String variableId, Object rawValue) {
        ModuleCommand command = ModuleCommand.unverified(fallbackModuleId, variableId, TypeMapper.inferDomain(rawValue));

        sink.onError(BridgeErrorEvent.of(wallClock.now(), BridgeErrorEvent.Kind.UNKNOWN_VARIABLE_COMMAND,
                "variable " + variableId + " not yet discovered, forwarding to " + fallbackModuleId));
        send(metricName, command);
        return new RoutingResult.UnknownVariable(metricName, command);
    }

    private void send(String metricName, ModuleCommand command) {
        sender.sendCommand(command);
        sink.onCommandRouted(new CommandRoutedEvent(wallClock.now(), metricName, command));
    }
}
