package com.questrail.plcbridge.internal.decode;

/**
 * Indicates that an inbound data payload could not be translated into a
 * variable update event.
 *
 * This typically reflects:
 * <ul>
 *   <li>Payload that is not a JSON object</li>
 *   <li>Missing required field (module, variable id, value)</li>
 *   <li>Illegal deadband or template shape</li>
 * </ul>
 *
 * The decoder never lets this escape; it is reported as
 * {@link DecodeResult.Malformed}.
 */
public final class VariableDecodeException extends RuntimeException
{
    public VariableDecodeException(String message) {
        super(message);
    }

    public VariableDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
