package com.questrail.plcbridge.observability;

import java.time.Instant;

/**
 * A full schema announcement was accepted by the telemetry publisher.
 */
public record SchemaAnnouncedEvent(
    Instant timestamp,
    String scope,
    int metricCount,
    int templateDefinitionCount
) {
}
