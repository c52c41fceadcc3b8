package com.questrail.plcbridge.transport.nats;

import com.questrail.plcbridge.api.ModuleCommand;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NatsModuleCommandSenderTest {

    private record Published(String subject, String payload) {}

    @Test
    void publishesRenderedValueOnCommandSubject() {
        List<Published> published = new ArrayList<>();
        NatsModuleCommandSender sender = new NatsModuleCommandSender(
                (subject, data) -> published.add(new Published(subject, new String(data, StandardCharsets.UTF_8))));

        sender.sendCommand(ModuleCommand.member("plc", "m1", "speed", 1200.0));
        sender.sendCommand(ModuleCommand.unverified("ethernetip", "valve", true));

        assertEquals(List.of(
                new Published("plc.command.m1/speed", "1200"),
                new Published("ethernetip.command.valve", "true")), published);
    }

    @Test
    void payloadRendering() {
        assertEquals("42", NatsModuleCommandSender.payload(42.0));
        assertEquals("42.5", NatsModuleCommandSender.payload(42.5));
        assertEquals("NaN", NatsModuleCommandSender.payload(Double.NaN));
        assertEquals("7", NatsModuleCommandSender.payload(7));
        assertEquals("auto", NatsModuleCommandSender.payload("auto"));
        assertEquals("{\"a\":1}", NatsModuleCommandSender.payload(Map.of("a", 1)));
        assertEquals("null", NatsModuleCommandSender.payload(null));
    }
}
