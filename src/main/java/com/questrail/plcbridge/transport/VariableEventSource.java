package com.questrail.plcbridge.transport;

import com.questrail.plcbridge.internal.events.BridgeEvent;

import java.util.function.Consumer;

/**
 * Minimal port for the inbound stream of variable updates.
 */
public interface VariableEventSource
{
    /**
     * Starts delivering decoded events to {@code sink}. The sink is
     * thread-safe and non-blocking.
     */
    void start(Consumer<BridgeEvent> sink);

    /**
     * Stops delivery. No events reach the sink once this returns.
     */
    void stop();
}
