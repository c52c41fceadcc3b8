package com.questrail.plcbridge.internal.rebirth;

import com.questrail.plcbridge.api.Metric;
import com.questrail.plcbridge.api.PublisherUnavailableException;
import com.questrail.plcbridge.api.TelemetryPublisher;
import com.questrail.plcbridge.internal.events.BridgeEvent;
import com.questrail.plcbridge.internal.events.RebirthEvent;
import com.questrail.plcbridge.internal.filter.ExceptionFilter;
import com.questrail.plcbridge.internal.registry.VariableRegistry;
import com.questrail.plcbridge.internal.time.Cancellable;
import com.questrail.plcbridge.internal.time.MonotonicClock;
import com.questrail.plcbridge.internal.time.MonotonicScheduler;
import com.questrail.plcbridge.internal.time.WallClock;
import com.questrail.plcbridge.observability.BridgeErrorEvent;
import com.questrail.plcbridge.observability.BridgeObservabilitySink;
import com.questrail.plcbridge.observability.SchemaAnnouncedEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * RebirthCoordinator
 * =============================================================================
 * Debounces schema changes into a single full re-announcement.
 *
 * <h2>States</h2>
 * <pre>
 *   IDLE    --requestRebirth-->  PENDING (debounce armed)
 *   PENDING --requestRebirth-->  PENDING (debounce re-armed)
 *   PENDING --RebirthDue(seq)--> IDLE    (schema announced)
 * </pre>
 *
 * <h2>Threading</h2>
 * The debounce timer runs on the scheduler's thread. It never touches bridge
 * state: it injects a {@link RebirthEvent.RebirthDue} into the bridge event
 * loop, which calls {@link #onRebirthDue} on the loop thread. At most one
 * debounce is armed at a time; a due event carrying a superseded sequence
 * number is ignored.
 *
 * <h2>Announcement</h2>
 * On expiry the coordinator snapshots the full metric set, hands it to the
 * publisher and records every announced value with the exception filter.
 * While {@link #isPending()} no individual values are published. If the
 * publisher refuses the announcement, one is owed and
 * {@link #requestRebirthIfOwed()} arms a new debounce on the next update.
 */
public final class RebirthCoordinator
{
    public enum State { IDLE, PENDING }

    private final String scope;
    private final Duration debounce;
    private final VariableRegistry registry;
    private final ExceptionFilter filter;
    private final TelemetryPublisher publisher;
    private final Consumer<BridgeEvent> eventSink;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final BridgeObservabilitySink sink;

    // Only the most recently armed debounce may fire.
    private final AtomicLong lastArmedSequence = new AtomicLong(0);
    private volatile long armedSequenceSnapshot = 0;
    private volatile Cancellable armedDebounce = null;

    private volatile State state = State.IDLE;
    private boolean announcementOwed = false;

    public RebirthCoordinator(String scope,
                              Duration debounce,
                              VariableRegistry registry,
                              ExceptionFilter filter,
                              TelemetryPublisher publisher,
                              Consumer<BridgeEvent> eventSink,
                              MonotonicClock clock,
                              MonotonicScheduler scheduler,
                              WallClock wallClock,
                              BridgeObservabilitySink sink)
    {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.debounce = Objects.requireNonNull(debounce, "debounce");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public State state() {
        return state;
    }

    public boolean isPending() {
        return state == State.PENDING;
    }

    public boolean isAnnouncementOwed() {
        return announcementOwed;
    }

    /**
     * Enters PENDING, or restarts the debounce if already pending.
     */
    public void requestRebirth() {
        cancelArmedDebounce();

        long seq = lastArmedSequence.incrementAndGet();
        armedSequenceSnapshot = seq;
        state = State.PENDING;

        long deadline = clock.nowNanos() + debounce.toNanos();
        armedDebounce = scheduler.scheduleAtNanos(deadline,
                () -> eventSink.accept(new RebirthEvent.RebirthDue(wallClock.now(), seq)));
    }

    /**
     * Re-arms the debounce if the last announcement was refused by the
     * publisher and nothing is pending.
     *
     * @return whether a rebirth was requested
     */
    public boolean requestRebirthIfOwed() {
        if (announcementOwed && state == State.IDLE) {
            requestRebirth();
            return true;
        }
        return false;
    }

    /**
     * Handles an expired debounce on the event-loop thread.
     *
     * @return whether the schema was announced
     */
    public boolean onRebirthDue(RebirthEvent.RebirthDue due) {
        Objects.requireNonNull(due, "due");

        // Stale guard: a later request re-armed the debounce.
        if (state != State.PENDING || due.sequence() != armedSequenceSnapshot) {
            return false;
        }
        armedDebounce = null;
        return announce();
    }

    /**
     * Cancels any armed debounce. Used on shutdown.
     */
    public void cancel() {
        cancelArmedDebounce();
    }

    private boolean announce() {
        Instant now = wallClock.now();
        List<Metric> metrics = registry.metricSet(now);

        try {
            publisher.publishSchema(scope, metrics);
        } catch (PublisherUnavailableException e) {
            state = State.IDLE;
            announcementOwed = true;
            sink.onError(new BridgeErrorEvent(now, BridgeErrorEvent.Kind.PUBLISHER_UNAVAILABLE,
                    "schema announcement for " + scope + " dropped", e));
            return false;
        }

        int definitions = 0;
        for (Metric metric : metrics) {
            if (metric.isTemplateDefinition()) {
                definitions++;
            } else {
                filter.recordPublish(metric.name(), metric.value());
            }
        }

        state = State.IDLE;
        announcementOwed = false;
        sink.onSchemaAnnounced(new SchemaAnnouncedEvent(now, scope, metrics.size(), definitions));
        return true;
    }

    private void cancelArmedDebounce() {
        Cancellable prior = armedDebounce;
        if (prior != null) {
            prior.cancel();
            armedDebounce = null;
        }
    }
}
