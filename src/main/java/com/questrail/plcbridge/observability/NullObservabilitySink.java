package com.questrail.plcbridge.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSchemaChange(SchemaChangeEvent event) {}

    @Override
    public void onSchemaAnnounced(SchemaAnnouncedEvent event) {}

    @Override
    public void onValuesPublished(ValuesPublishedEvent event) {}

    @Override
    public void onCommandRouted(CommandRoutedEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
