package com.questrail.plcbridge.observability;

import com.questrail.plcbridge.api.ModuleCommand;

import java.time.Instant;

/**
 * A reverse command was handed to the owning module's command channel.
 *
 * @param metricName the metric name as it arrived from the telemetry side
 */
public record CommandRoutedEvent(
    Instant timestamp,
    String metricName,
    ModuleCommand command
) {
}
