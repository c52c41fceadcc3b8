package com.questrail.plcbridge.transport.nats;

import com.questrail.plcbridge.api.ModuleCommand;
import com.questrail.plcbridge.api.ModuleCommandSender;
import com.questrail.plcbridge.internal.mapping.TypeMapper;
import io.nats.client.Connection;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Sends module commands as plain-text NATS messages.
 *
 * <p>The subject is {@code {owner}.command.{variableId}} or
 * {@code {owner}.command.{variableId}/{member}}. The payload is the value as
 * text; whole-number doubles are written without a fraction and structured
 * values as JSON.</p>
 */
public final class NatsModuleCommandSender implements ModuleCommandSender
{
    private final BiConsumer<String, byte[]> publish;

    public NatsModuleCommandSender(Connection connection) {
        this(Objects.requireNonNull(connection, "connection")::publish);
    }

    NatsModuleCommandSender(BiConsumer<String, byte[]> publish) {
        this.publish = Objects.requireNonNull(publish, "publish");
    }

    @Override
    public void sendCommand(ModuleCommand command) {
        Objects.requireNonNull(command, "command");
        publish.accept(NatsSubjects.command(command), payload(command.value()).getBytes(StandardCharsets.UTF_8));
    }

    static String payload(Object value) {
        if (value instanceof Double d && isWhole(d)) {
            return Long.toString(d.longValue());
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return TypeMapper.toJson(value);
        }
        return String.valueOf(value);
    }

    private static boolean isWhole(double d) {
        return !Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15;
    }
}
