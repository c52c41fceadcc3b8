package com.questrail.plcbridge.internal.command;

import com.questrail.plcbridge.api.ModuleCommand;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of routing one reverse-command metric.
 */
public sealed interface RoutingResult
        permits RoutingResult.Routed, RoutingResult.UnknownVariable, RoutingResult.Failed
{
    String metricName();

    /**
     * The metric resolved to a known variable; one or more commands were sent.
     */
    record Routed(String metricName, String variableId, List<ModuleCommand> commands) implements RoutingResult
    {
        public Routed {
            Objects.requireNonNull(metricName, "metricName");
            Objects.requireNonNull(variableId, "variableId");
            commands = List.copyOf(commands);
        }
    }

    /**
     * The metric did not resolve; the value was forwarded unverified to the
     * fallback module.
     */
    record UnknownVariable(String metricName, ModuleCommand command) implements RoutingResult
    {
        public UnknownVariable {
            Objects.requireNonNull(metricName, "metricName");
            Objects.requireNonNull(command, "command");
        }
    }

    /**
     * Routing or sending failed; other metrics of the same command are
     * unaffected.
     */
    record Failed(String metricName, RuntimeException cause) implements RoutingResult
    {
        public Failed {
            Objects.requireNonNull(metricName, "metricName");
            Objects.requireNonNull(cause, "cause");
        }
    }
}
