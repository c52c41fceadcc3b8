package com.questrail.plcbridge.observability;

import com.questrail.plcbridge.api.ModuleCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onSchemaChange(SchemaChangeEvent event) {
        if (event.isNewMetric()) {
            log.info("New metric {} ({})", event.metricName(), event.newType());
        } else {
            log.info("Correcting metric type for {}: {} -> {}",
                event.metricName(),
                event.previousType(),
                event.newType());
        }
    }

    @Override
    public void onSchemaAnnounced(SchemaAnnouncedEvent event) {
        log.info("Published schema for {} with {} metrics ({} template definitions)",
            event.scope(),
            event.metricCount(),
            event.templateDefinitionCount());
    }

    @Override
    public void onValuesPublished(ValuesPublishedEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Published {} values for {}", event.values().size(), event.scope());
        }
    }

    @Override
    public void onCommandRouted(CommandRoutedEvent event) {
        ModuleCommand command = event.command();
        log.info("Command {} -> {}.{} = {}{}",
            event.metricName(),
            command.ownerModuleId(),
            command.target(),
            command.value(),
            command.verified() ? "" : " (unverified)");
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        switch (event.kind()) {
            case UNKNOWN_VARIABLE_COMMAND, TEMPLATE_MISMATCH ->
                log.warn("{}: {}", event.kind(), event.message());
            case MALFORMED_EVENT, PUBLISHER_UNAVAILABLE ->
                log.warn("{}: {}", event.kind(), event.message(), event.cause());
            default ->
                log.error("{}: {}", event.kind(), event.message(), event.cause());
        }
    }
}
