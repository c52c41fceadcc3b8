package com.questrail.plcbridge.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Timer capability injected into the bridge.
 *
 * <p>The bridge never touches a JVM timer directly. Production wiring uses
 * {@link ScheduledExecutorScheduler}; tests substitute a deterministic
 * scheduler driven by a manual clock, which makes debounce behavior exactly
 * reproducible.</p>
 *
 * <p>Scheduled tasks run on the scheduler's own thread. Tasks that need to
 * touch bridge state must hand an event back to the event loop rather than
 * mutate anything themselves.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in the tick domain of the paired {@link MonotonicClock}
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task {@code delay} after the clock's current tick.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
