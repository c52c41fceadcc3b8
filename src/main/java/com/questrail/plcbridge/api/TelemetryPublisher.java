package com.questrail.plcbridge.api;

import java.util.List;

/**
 * TelemetryPublisher
 * -----------------------------------------------------------------------------
 * Port to the telemetry protocol node (birth/data publication).
 *
 * <h2>Boundary</h2>
 * The bridge only ever hands over logical metric sets. Wire encoding, session
 * handshake, sequence numbers and broker reconnection all live behind this
 * port.
 *
 * <h2>Failure contract</h2>
 * Implementations that cannot currently accept a publication throw
 * {@link PublisherUnavailableException}. The bridge drops that attempt and does
 * not retry; retry and backoff belong to the implementation.
 *
 * <h2>Threading</h2>
 * Both methods are invoked from the bridge's single event-loop thread and
 * should not block for long. Fire-and-forget implementations are acceptable.
 */
public interface TelemetryPublisher
{
    /**
     * Announces the full current metric set of a scope (a "birth").
     *
     * @param scope   grouping key (device) the metrics belong to
     * @param metrics template definitions first, then every known metric
     */
    void publishSchema(String scope, List<Metric> metrics);

    /**
     * Publishes value changes for metrics already announced for {@code scope}.
     */
    void publishValues(String scope, List<MetricValue> values);
}
