package com.questrail.plcbridge.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for metric timestamps and observability records.
 * Never used for elapsed-time decisions.
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
