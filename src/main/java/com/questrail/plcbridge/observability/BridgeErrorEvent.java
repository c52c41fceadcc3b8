package com.questrail.plcbridge.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing an error or anomaly in the bridge. None of these are
 * fatal; each is isolated to the event that caused it.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    Kind kind,
    String message,
    Throwable cause
) {
    public enum Kind {
        /** Inbound event failed to parse or lacked required fields; dropped. */
        MALFORMED_EVENT,
        /** Reverse command for a variable never seen; forwarded best-effort. */
        UNKNOWN_VARIABLE_COMMAND,
        /** Telemetry publisher refused a publication; the attempt was dropped. */
        PUBLISHER_UNAVAILABLE,
        /** Template re-registered with a different shape; the first one wins. */
        TEMPLATE_MISMATCH,
        /** Any other failure while processing a single event. */
        PROCESSING_FAILURE
    }

    public BridgeErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static BridgeErrorEvent of(Instant timestamp, Kind kind, String message) {
        return new BridgeErrorEvent(timestamp, kind, message, null);
    }
}
