package com.questrail.plcbridge.transport.nats;

import com.questrail.plcbridge.internal.decode.DecodeResult;
import com.questrail.plcbridge.internal.decode.VariableEventDecoder;
import com.questrail.plcbridge.internal.events.BridgeEvent;
import com.questrail.plcbridge.internal.time.WallClock;
import com.questrail.plcbridge.observability.BridgeErrorEvent;
import com.questrail.plcbridge.observability.BridgeObservabilitySink;
import com.questrail.plcbridge.transport.VariableEventSource;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * NatsVariableEventSubscriber
 * -----------------------------------------------------------------------------
 * Subscribes to module data subjects and feeds decoded events to the bridge.
 *
 * <p>Messages are delivered on the jnats dispatcher thread, decoded there and
 * handed to the sink. Payloads that do not decode are reported as
 * {@link BridgeErrorEvent.Kind#MALFORMED_EVENT} and dropped.</p>
 */
public final class NatsVariableEventSubscriber implements VariableEventSource
{
    private final Connection connection;
    private final String subject;
    private final VariableEventDecoder decoder;
    private final WallClock wallClock;
    private final BridgeObservabilitySink observabilitySink;

    private volatile Dispatcher dispatcher;

    public NatsVariableEventSubscriber(Connection connection,
                                       VariableEventDecoder decoder,
                                       WallClock wallClock,
                                       BridgeObservabilitySink observabilitySink) {
        this(connection, NatsSubjects.ALL_DATA, decoder, wallClock, observabilitySink);
    }

    public NatsVariableEventSubscriber(Connection connection,
                                       String subject,
                                       VariableEventDecoder decoder,
                                       WallClock wallClock,
                                       BridgeObservabilitySink observabilitySink) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.subject = Objects.requireNonNull(subject, "subject");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    @Override
    public synchronized void start(Consumer<BridgeEvent> sink) {
        Objects.requireNonNull(sink, "sink");
        if (dispatcher != null) {
            return;
        }
        Dispatcher d = connection.createDispatcher(msg -> onMessage(msg.getSubject(), msg.getData(), sink));
        d.subscribe(subject);
        dispatcher = d;
    }

    @Override
    public synchronized void stop() {
        Dispatcher d = dispatcher;
        if (d != null) {
            dispatcher = null;
            connection.closeDispatcher(d);
        }
    }

    /**
     * Decodes one message and forwards it.
     */
    void onMessage(String messageSubject, byte[] data, Consumer<BridgeEvent> sink) {
        DecodeResult result = decoder.decode(messageSubject, data == null ? new byte[0] : data);
        if (result instanceof DecodeResult.Decoded decoded) {
            sink.accept(decoded.event());
        } else if (result instanceof DecodeResult.Malformed malformed) {
            observabilitySink.onError(new BridgeErrorEvent(
                    wallClock.now(),
                    BridgeErrorEvent.Kind.MALFORMED_EVENT,
                    "dropping payload on " + messageSubject + ": " + malformed.reason(),
                    malformed.cause()));
        }
    }
}
