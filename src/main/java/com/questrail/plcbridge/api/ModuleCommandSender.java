package com.questrail.plcbridge.api;

/**
 * Port to the command channel of the upstream control modules.
 *
 * <p>Implementations must be non-blocking; they are called from the bridge's
 * event-loop thread.</p>
 */
@FunctionalInterface
public interface ModuleCommandSender
{
    void sendCommand(ModuleCommand command);
}
