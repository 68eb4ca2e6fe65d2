package com.telemetryrelay.sdk.exception;

/**
 * Invalid relay configuration. Raised while building components and never
 * recovered from.
 */
public class RelayConfigurationException extends RelayException {

    public RelayConfigurationException(String message) {
        super(message);
    }

    public RelayConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
