package com.questrail.plcbridge.internal.exec;

import com.questrail.plcbridge.internal.events.BridgeEvent;
import com.questrail.plcbridge.internal.time.WallClock;
import com.questrail.plcbridge.observability.BridgeErrorEvent;
import com.questrail.plcbridge.observability.BridgeObservabilitySink;
import com.questrail.plcbridge.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * BridgeOperationalDriver
 * =============================================================================
 * Runs the serialized event loop of the bridge.
 *
 * <h2>Threading Model</h2>
 * The driver owns a single event-processing thread. Inbound data, reverse
 * commands and debounce expiries are all submitted to one queue and handed
 * to the processor one at a time. This ensures:
 * <ul>
 *   <li>No concurrent access to registry, filter state or coordinator</li>
 *   <li>Events from one source are processed in arrival order</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()           → starts event loop thread
 *   driver.submitEvent(...)  → enqueues event for processing
 *   driver.stop()            → stops between units of work
 * </pre>
 *
 * Events submitted while the driver is not running are discarded.
 */
public final class BridgeOperationalDriver
{
    private final Consumer<BridgeEvent> processor;
    private final WallClock wallClock;
    private final BridgeObservabilitySink observabilitySink;

    private final BlockingQueue<BridgeEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread eventLoopThread;

    /**
     * @param processor unit of work applied to each event (typically
     *                  {@link BridgeEventProcessor#process})
     */
    public BridgeOperationalDriver(Consumer<BridgeEvent> processor,
                                   WallClock wallClock,
                                   BridgeObservabilitySink observabilitySink)
    {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the event loop thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, "plc-bridge-event-loop");
            eventLoopThread.start();
        }
    }

    /**
     * Stops the event loop thread. The unit of work in progress completes;
     * queued events are discarded. Blocks until the thread terminates.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread thread = eventLoopThread;
            if (thread != null) {
                thread.interrupt();
                if (thread != Thread.currentThread()) {
                    try {
                        thread.join(5000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
            eventQueue.clear();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Submits an event for processing.
     * Events are processed sequentially in submission order.
     *
     * @param event the event to process (must not be null)
     */
    public void submitEvent(BridgeEvent event) {
        Objects.requireNonNull(event, "event");
        if (running.get()) {
            eventQueue.offer(event);
        }
    }

    private void runEventLoop() {
        while (running.get()) {
            try {
                BridgeEvent event = eventQueue.take();
                if (running.get()) {
                    processor.accept(event);
                }
            } catch (InterruptedException e) {
                // Expected during shutdown; the loop condition ends the thread.
                if (!running.get()) {
                    return;
                }
            } catch (Exception e) {
                observabilitySink.onError(new BridgeErrorEvent(
                    wallClock.now(),
                    BridgeErrorEvent.Kind.PROCESSING_FAILURE,
                    "Event processing error",
                    e
                ));
            }
        }
    }
}
