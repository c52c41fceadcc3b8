package com.questrail.plcbridge.api;

/**
 * Thrown by a {@link TelemetryPublisher} that cannot currently accept a
 * publication (not connected, session not established, buffer full).
 */
public final class PublisherUnavailableException extends RuntimeException
{
    public PublisherUnavailableException(String message) {
        super(message);
    }

    public PublisherUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
