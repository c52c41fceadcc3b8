package com.questrail.plcbridge.observability;

import com.questrail.plcbridge.api.MetricValue;

import java.time.Instant;
import java.util.List;

/**
 * One value publication was accepted by the telemetry publisher.
 */
public record ValuesPublishedEvent(
    Instant timestamp,
    String scope,
    List<MetricValue> values
) {
    public ValuesPublishedEvent {
        values = List.copyOf(values);
    }
}
