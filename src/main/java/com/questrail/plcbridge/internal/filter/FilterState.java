package com.questrail.plcbridge.internal.filter;

import java.time.Instant;
import java.util.Objects;

/**
 * Last forwarded value of one variable.
 *
 * @param lastPublishedNanos monotonic tick of the forward, used for staleness
 * @param lastPublishedAt    wall-clock instant of the forward, observability only
 */
public record FilterState(Object lastPublishedValue, long lastPublishedNanos, Instant lastPublishedAt)
{
    public FilterState {
        Objects.requireNonNull(lastPublishedAt, "lastPublishedAt");
    }
}
