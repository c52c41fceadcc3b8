package com.questrail.plcbridge.api;

import java.util.Objects;
import java.util.Optional;

/**
 * ModuleCommand
 * -----------------------------------------------------------------------------
 * A write request addressed to the control module that owns a variable.
 *
 * <ul>
 *   <li>{@code memberName} is present when the command targets one member of
 *       a structured variable.</li>
 *   <li>{@code verified} is {@code false} when the variable was unknown to the
 *       bridge and the value was converted from its runtime shape alone.</li>
 * </ul>
 */
public record ModuleCommand(String ownerModuleId,
                            String variableId,
                            Optional<String> memberName,
                            Object value,
                            boolean verified)
{
    public ModuleCommand {
        Objects.requireNonNull(ownerModuleId, "ownerModuleId");
        Objects.requireNonNull(variableId, "variableId");
        Objects.requireNonNull(memberName, "memberName");
    }

    public static ModuleCommand scalar(String ownerModuleId, String variableId, Object value) {
        return new ModuleCommand(ownerModuleId, variableId, Optional.empty(), value, true);
    }

    public static ModuleCommand member(String ownerModuleId, String variableId, String memberName, Object value) {
        return new ModuleCommand(ownerModuleId, variableId, Optional.of(memberName), value, true);
    }

    public static ModuleCommand unverified(String ownerModuleId, String variableId, Object value) {
        return new ModuleCommand(ownerModuleId, variableId, Optional.empty(), value, false);
    }

    /**
     * Address of the target within its module: {@code variableId} or
     * {@code variableId/memberName}.
     */
    public String target() {
        return memberName.map(m -> variableId + "/" + m).orElse(variableId);
    }
}
