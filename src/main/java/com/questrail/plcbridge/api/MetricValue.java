package com.questrail.plcbridge.api;

import java.time.Instant;
import java.util.Objects;

/**
 * A single value publication for a metric that is already part of the
 * announced schema.
 */
public record MetricValue(String metricName, PrimitiveType type, Object value, Instant timestamp)
{
    public MetricValue {
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
