package com.questrail.plcbridge.internal.filter;

import com.questrail.plcbridge.api.FilterPolicy;
import com.questrail.plcbridge.time.ManualMonotonicClock;
import com.questrail.plcbridge.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * ExceptionFilterTest
 * -----------------------------------------------------------------------------
 * Decision order of the report-by-exception filter, on a manual clock.
 */
class ExceptionFilterTest {

    private ManualMonotonicClock clock;
    private ExceptionFilter filter;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        filter = new ExceptionFilter(clock, new ManualWallClock());
    }

    @Test
    void firstObservationAlwaysPublishes() {
        assertTrue(filter.shouldPublish("temp", 20.0, Optional.of(FilterPolicy.deadband(100.0)), false));
    }

    @Test
    void noPolicyAlwaysPublishes() {
        filter.recordPublish("temp", 20.0);
        assertTrue(filter.shouldPublish("temp", 20.0, Optional.empty(), false));
    }

    @Test
    void disabledFilterAlwaysPublishes() {
        filter.recordPublish("temp", 20.0);
        assertTrue(filter.shouldPublish("temp", 20.0, Optional.of(FilterPolicy.deadband(5.0)), true));
    }

    @Test
    void changesInsideDeadbandAreSuppressed() {
        Optional<FilterPolicy> policy = Optional.of(FilterPolicy.deadband(1.0));
        filter.recordPublish("temp", 20.0);

        assertFalse(filter.shouldPublish("temp", 20.5, policy, false));
        assertFalse(filter.shouldPublish("temp", 21.0, policy, false), "boundary is strict");
        assertTrue(filter.shouldPublish("temp", 21.01, policy, false));
        assertTrue(filter.shouldPublish("temp", 18.5, policy, false));
    }

    @Test
    void suppressedValuesDoNotMoveTheReference() {
        Optional<FilterPolicy> policy = Optional.of(FilterPolicy.deadband(1.0));
        filter.recordPublish("temp", 20.0);

        // Creeping by 0.6 twice: each step is inside the deadband, but the
        // second is measured against the last forwarded value.
        assertFalse(filter.shouldPublish("temp", 20.6, policy, false));
        assertTrue(filter.shouldPublish("temp", 21.2, policy, false));
    }

    @Test
    void zeroThresholdPublishesOnAnyChangeButNotOnRepeat() {
        Optional<FilterPolicy> policy = Optional.of(FilterPolicy.deadband(0.0));
        filter.recordPublish("temp", 20.0);

        assertFalse(filter.shouldPublish("temp", 20.0, policy, false));
        assertTrue(filter.shouldPublish("temp", 20.0001, policy, false));
    }

    @Test
    void stalenessOverridesDeadband() {
        Optional<FilterPolicy> policy = Optional.of(FilterPolicy.deadband(10.0, Duration.ofSeconds(5)));
        filter.recordPublish("temp", 20.0);

        clock.advanceMillis(4_999);
        assertFalse(filter.shouldPublish("temp", 20.0, policy, false));

        clock.advanceMillis(1);
        assertTrue(filter.shouldPublish("temp", 20.0, policy, false));
    }

    @Test
    void nonNumericValuesCompareByEquality() {
        Optional<FilterPolicy> policy = Optional.of(FilterPolicy.deadband(5.0));
        filter.recordPublish("mode", "AUTO");

        assertFalse(filter.shouldPublish("mode", "AUTO", policy, false));
        assertTrue(filter.shouldPublish("mode", "MANUAL", policy, false));
    }

    @Test
    void structuredValuesCompareDeeply() {
        Optional<FilterPolicy> policy = Optional.of(FilterPolicy.ON_CHANGE);
        filter.recordPublish("motor", Map.of("speed", 10.0, "running", true));

        assertFalse(filter.shouldPublish("motor", Map.of("running", true, "speed", 10.0), policy, false));
        assertTrue(filter.shouldPublish("motor", Map.of("running", false, "speed", 10.0), policy, false));
    }

    @Test
    void recordPublishOverwritesState() {
        filter.recordPublish("temp", 20.0);
        clock.advanceMillis(10);
        filter.recordPublish("temp", 25.0);

        FilterState state = filter.state("temp").orElseThrow();
        assertEquals(25.0, state.lastPublishedValue());
        assertEquals(10_000_000L, state.lastPublishedNanos());
    }
}
