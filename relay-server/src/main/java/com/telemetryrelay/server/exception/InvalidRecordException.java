package com.telemetryrelay.server.exception;

public class InvalidRecordException extends RuntimeException {

    private final String correlationId;

    public InvalidRecordException(String correlationId, String message) {
        super(message);
        this.correlationId = correlationId;
    }

    public String getCorrelationId() { return correlationId; }
}
