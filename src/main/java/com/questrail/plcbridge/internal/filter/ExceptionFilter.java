package com.questrail.plcbridge.internal.filter;

import com.questrail.plcbridge.api.FilterPolicy;
import com.questrail.plcbridge.internal.time.MonotonicClock;
import com.questrail.plcbridge.internal.time.WallClock;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ExceptionFilter
 * =============================================================================
 * Report-by-exception filter deciding whether an in-schema value change is
 * forwarded.
 *
 * <h2>Decision order</h2>
 * The first matching rule wins:
 * <ol>
 *   <li>filtering disabled for the variable: forward</li>
 *   <li>no policy: forward</li>
 *   <li>nothing forwarded yet: forward</li>
 *   <li>{@code maxInterval} set and at least that long since the last
 *       forward: forward</li>
 *   <li>both values numeric: forward iff {@code |value - last| > threshold}</li>
 *   <li>otherwise: forward iff the value differs from the last one</li>
 * </ol>
 *
 * <h2>Time</h2>
 * Staleness is measured on the injected {@link MonotonicClock}; wall-clock
 * instants are kept for observability only.
 *
 * <p>{@link #shouldPublish} has no side effects. Callers invoke
 * {@link #recordPublish} once for each value actually forwarded.</p>
 *
 * <p>Owned by the bridge event loop; not thread-safe.</p>
 */
public final class ExceptionFilter
{
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Map<String, FilterState> states = new HashMap<>();

    public ExceptionFilter(MonotonicClock clock, WallClock wallClock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public boolean shouldPublish(String id, Object value, Optional<FilterPolicy> policy, boolean disabled) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(policy, "policy");

        if (disabled || policy.isEmpty()) {
            return true;
        }

        FilterState state = states.get(id);
        if (state == null) {
            return true;
        }

        FilterPolicy p = policy.get();
        if (p.maxInterval().isPresent()) {
            long elapsed = clock.nowNanos() - state.lastPublishedNanos();
            if (elapsed >= p.maxInterval().get().toNanos()) {
                return true;
            }
        }

        Object last = state.lastPublishedValue();
        if (value instanceof Number v && last instanceof Number l) {
            double current = v.doubleValue();
            double previous = l.doubleValue();
            if (!Double.isNaN(current) && !Double.isNaN(previous)) {
                return Math.abs(current - previous) > p.threshold();
            }
        }
        return !Objects.equals(value, last);
    }

    public void recordPublish(String id, Object value) {
        Objects.requireNonNull(id, "id");
        states.put(id, new FilterState(value, clock.nowNanos(), wallClock.now()));
    }

    public Optional<FilterState> state(String id) {
        return Optional.ofNullable(states.get(id));
    }
}
