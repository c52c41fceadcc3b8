package com.questrail.plcbridge.observability;

import com.questrail.plcbridge.api.PrimitiveType;

import java.time.Instant;

/**
 * A metric was added to the schema, or its type was corrected. Either way a
 * re-announcement has been requested.
 *
 * @param previousType {@code null} for a newly discovered metric
 */
public record SchemaChangeEvent(
    Instant timestamp,
    String metricName,
    PrimitiveType previousType,
    PrimitiveType newType
) {
    public boolean isNewMetric() {
        return previousType == null;
    }
}
