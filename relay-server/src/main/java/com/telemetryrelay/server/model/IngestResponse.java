package com.telemetryrelay.server.model;

public record IngestResponse(
        boolean accepted,
        String correlationId,
        long bufferDepth) {
}
