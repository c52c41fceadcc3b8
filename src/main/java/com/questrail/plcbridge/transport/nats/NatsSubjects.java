package com.questrail.plcbridge.transport.nats;

import com.questrail.plcbridge.api.ModuleCommand;

import java.util.Objects;

/**
 * Subject naming shared by the control modules and the bridge.
 *
 * <pre>
 *   {moduleId}.data.{variableId}                 data published by a module
 *   {moduleId}.command.{variableId}[/{member}]   writes addressed to a module
 * </pre>
 */
public final class NatsSubjects
{
    /** Every data subject of every module. */
    public static final String ALL_DATA = "*.data.>";

    private NatsSubjects() {}

    public static String data(String moduleId, String variableId) {
        return Objects.requireNonNull(moduleId, "moduleId") + ".data." + Objects.requireNonNull(variableId, "variableId");
    }

    public static String command(ModuleCommand command) {
        Objects.requireNonNull(command, "command");
        return command.ownerModuleId() + ".command." + command.target();
    }

    /**
     * Module that published on {@code subject}: its first token.
     */
    public static String moduleOf(String subject) {
        Objects.requireNonNull(subject, "subject");
        int dot = subject.indexOf('.');
        return dot < 0 ? subject : subject.substring(0, dot);
    }
}
