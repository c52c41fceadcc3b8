package com.questrail.plcbridge.api;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Metric
 * -----------------------------------------------------------------------------
 * One entry of a full schema announcement.
 *
 * <p>{@code properties} carries descriptive metadata the telemetry consumer
 * can display (declared datatype, source, quality, owning module, deadband).
 * Values are {@code String}, {@code Double} or {@code Long}.</p>
 */
public record Metric(String name,
                     PrimitiveType type,
                     Object value,
                     Instant timestamp,
                     Map<String, Object> properties)
{
    public Metric {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        properties = Map.copyOf(Objects.requireNonNull(properties, "properties"));
    }

    /**
     * Whether this metric is a template definition rather than a variable.
     */
    public boolean isTemplateDefinition() {
        return value instanceof TemplateValue tv && tv.definition();
    }
}
