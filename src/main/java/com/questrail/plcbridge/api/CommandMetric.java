package com.questrail.plcbridge.api;

import java.util.Objects;

/**
 * One metric of a reverse command received from the telemetry side.
 *
 * <p>{@code value} is a protocol primitive ({@code Double}, {@code Long},
 * {@code Boolean}, {@code String}) or, for commands aimed at a nested
 * structured metric, a {@link TemplateValue} listing the changed members.</p>
 */
public record CommandMetric(String metricName, Object value)
{
    public CommandMetric {
        Objects.requireNonNull(metricName, "metricName");
    }
}
