package com.questrail.plcbridge.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * BridgeEvent
 * -----------------------------------------------------------------------------
 * Marker interface for every unit of work processed by the bridge event loop.
 *
 * <p>Inbound variable updates, reverse commands from the telemetry side and
 * debounce expiries all enter the bridge as events. The loop handles them one
 * at a time, which is what makes the registry, filter state and rebirth
 * coordinator single-threaded.</p>
 *
 * <p>Events are immutable and carry only the information needed to process
 * them.</p>
 */
public interface BridgeEvent
{
    /**
     * Time at which the event occurred or was received. Observability only.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements BridgeEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
