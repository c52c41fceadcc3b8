package com.questrail.plcbridge.observability;

/**
 * Receiver of bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked on the bridge's event-loop thread, except
 * {@link #onError} for malformed inbound payloads, which is called from the
 * transport's delivery thread. Implementations must be thread-safe and must
 * not block.</p>
 */
public interface BridgeObservabilitySink {
    /**
     * Called when a metric is discovered or its type is corrected.
     */
    void onSchemaChange(SchemaChangeEvent event);

    /**
     * Called after a full schema announcement was accepted by the publisher.
     */
    void onSchemaAnnounced(SchemaAnnouncedEvent event);

    /**
     * Called after a value publication was accepted by the publisher.
     */
    void onValuesPublished(ValuesPublishedEvent event);

    /**
     * Called for every command handed to a module's command channel.
     */
    void onCommandRouted(CommandRoutedEvent event);

    /**
     * Called when an event was dropped or degraded.
     */
    void onError(BridgeErrorEvent event);
}
