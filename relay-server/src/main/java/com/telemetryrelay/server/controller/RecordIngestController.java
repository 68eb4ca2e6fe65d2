package com.telemetryrelay.server.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetryrelay.sdk.client.TelemetryRelay;
import com.telemetryrelay.server.exception.InvalidRecordException;
import com.telemetryrelay.server.exception.RelayUnavailableException;
import com.telemetryrelay.server.model.IngestResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Accepts records from local producers and hands them to the relay.
 *
 * <p>The body is stored byte-for-byte; it is parsed only to reject documents
 * that are not JSON. The response never waits for the sink.</p>
 */
@RestController
@RequestMapping("/v1/records")
public class RecordIngestController {

    static final String CORRELATION_HEADER = "X-Correlation-Id";

    private final TelemetryRelay relay;
    private final ObjectMapper objectMapper;

    public RecordIngestController(TelemetryRelay relay, ObjectMapper objectMapper) {
        this.relay = relay;
        this.objectMapper = objectMapper;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public IngestResponse ingest(@RequestBody String body,
                                 @RequestHeader(value = CORRELATION_HEADER, required = false) String correlationId) {
        String resolvedId = correlationId != null && !correlationId.isBlank()
                ? correlationId.trim()
                : UUID.randomUUID().toString();

        if (body == null || body.isBlank()) {
            throw new InvalidRecordException(resolvedId, "Record body must not be empty");
        }
        try {
            objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidRecordException(resolvedId, "Record body is not valid JSON");
        }

        if (!relay.enqueue(body.getBytes(StandardCharsets.UTF_8), resolvedId)) {
            throw new RelayUnavailableException(resolvedId, "Relay is shutting down");
        }
        return new IngestResponse(true, resolvedId, relay.getBufferDepth());
    }
}
