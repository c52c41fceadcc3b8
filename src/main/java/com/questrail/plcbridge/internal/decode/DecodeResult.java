package com.questrail.plcbridge.internal.decode;

import com.questrail.plcbridge.internal.events.VariableUpdateEvent;

import java.util.Objects;

/**
 * Result of decoding one inbound data payload.
 */
public sealed interface DecodeResult permits DecodeResult.Decoded, DecodeResult.Malformed
{
    record Decoded(VariableUpdateEvent event) implements DecodeResult
    {
        public Decoded {
            Objects.requireNonNull(event, "event");
        }
    }

    /**
     * @param subject subject the payload arrived on, for diagnostics
     */
    record Malformed(String subject, String reason, Throwable cause) implements DecodeResult
    {
        public Malformed {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
