package com.telemetryrelay.server.exception;

public class RelayUnavailableException extends RuntimeException {

    private final String correlationId;

    public RelayUnavailableException(String correlationId, String message) {
        super(message);
        this.correlationId = correlationId;
    }

    public String getCorrelationId() { return correlationId; }
}
