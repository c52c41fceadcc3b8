package com.questrail.plcbridge.time;

import com.questrail.plcbridge.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock that only moves when a test moves it. Starts at zero.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong ticks = new AtomicLong();

    @Override
    public long nowNanos() {
        return ticks.get();
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("monotonic time cannot go back: " + delta);
        }
        ticks.addAndGet(delta.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
