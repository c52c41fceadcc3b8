package com.questrail.plcbridge.api;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * FilterPolicy
 * -----------------------------------------------------------------------------
 * Report-by-exception settings for one variable.
 *
 * <ul>
 *   <li><b>threshold</b>: deadband for numeric values. A change is forwarded
 *       only when {@code |value - lastPublished| > threshold} (strictly
 *       greater).</li>
 *   <li><b>maxInterval</b>: optional staleness bound. Once this much time has
 *       elapsed since the last forwarded value, the next update is forwarded
 *       even if it is inside the deadband.</li>
 * </ul>
 *
 * <p>A threshold of zero is the "publish on any change" setting. It is not
 * "publish nothing", and it is not the same as having no policy: the
 * first-observation and staleness rules still apply.</p>
 */
public record FilterPolicy(double threshold, Optional<Duration> maxInterval)
{
    /**
     * Policy used for structured values that arrive without one: forward on
     * any change, never on repetition.
     */
    public static final FilterPolicy ON_CHANGE = new FilterPolicy(0.0, Optional.empty());

    public FilterPolicy {
        Objects.requireNonNull(maxInterval, "maxInterval");

        if (Double.isNaN(threshold) || threshold < 0.0) {
            throw new IllegalArgumentException("threshold must be a non-negative number");
        }
        if (maxInterval.isPresent() && (maxInterval.get().isNegative() || maxInterval.get().isZero())) {
            throw new IllegalArgumentException("maxInterval must be positive when present");
        }
    }

    public static FilterPolicy deadband(double threshold) {
        return new FilterPolicy(threshold, Optional.empty());
    }

    public static FilterPolicy deadband(double threshold, Duration maxInterval) {
        return new FilterPolicy(threshold, Optional.of(maxInterval));
    }
}
