package com.questrail.plcbridge.internal.events;

import java.time.Instant;

/**
 * Timer events of the rebirth batching coordinator.
 */
public sealed interface RebirthEvent extends BridgeEvent
        permits RebirthEvent.RebirthRequested, RebirthEvent.RebirthDue
{
    /**
     * The telemetry side asked for a full re-announcement (for example after
     * its session was re-established).
     */
    final class RebirthRequested extends BridgeEvent.Base implements RebirthEvent {
        public RebirthRequested(Instant timestamp) {
            super(timestamp);
        }
    }

    /**
     * The debounce armed with {@code sequence} expired. A due event whose
     * sequence is no longer current is stale and ignored.
     */
    final class RebirthDue extends BridgeEvent.Base implements RebirthEvent {
        private final long sequence;

        public RebirthDue(Instant timestamp, long sequence) {
            super(timestamp);
            this.sequence = sequence;
        }

        public long sequence() {
            return sequence;
        }
    }
}
