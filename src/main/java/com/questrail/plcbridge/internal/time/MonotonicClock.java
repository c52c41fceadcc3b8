package com.questrail.plcbridge.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Elapsed-time source for the bridge.
 *
 * <p>Debounce deadlines and report-by-exception staleness are both computed
 * from this clock, never from wall-clock instants, so an NTP step on the edge
 * gateway cannot suppress or force publications.</p>
 */
@FunctionalInterface
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick in nanoseconds. Only
     * differences between two ticks are meaningful.
     */
    long nowNanos();
}
