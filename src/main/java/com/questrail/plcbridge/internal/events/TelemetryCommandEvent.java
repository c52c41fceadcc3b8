package com.questrail.plcbridge.internal.events;

import com.questrail.plcbridge.api.CommandMetric;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Reverse commands received from the telemetry side.
 */
public sealed interface TelemetryCommandEvent extends BridgeEvent
        permits TelemetryCommandEvent.CommandReceived
{
    final class CommandReceived extends BridgeEvent.Base implements TelemetryCommandEvent {
        private final String scope;
        private final List<CommandMetric> metrics;

        public CommandReceived(Instant timestamp, String scope, List<CommandMetric> metrics) {
            super(timestamp);
            this.scope = Objects.requireNonNull(scope, "scope");
            this.metrics = List.copyOf(Objects.requireNonNull(metrics, "metrics"));
        }

        public String scope() {
            return scope;
        }

        public List<CommandMetric> metrics() {
            return metrics;
        }
    }
}
