package com.telemetryrelay.sdk.exception;

/**
 * Base exception for Telemetry Relay errors
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
