package com.telemetryrelay.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Telemetry Record - a single opaque, already-serialized unit of telemetry
 *
 * <p>The relay never inspects the payload. It is carried byte-for-byte from the
 * producer to the sink, together with an optional correlation identifier and the
 * instant it was handed to the relay.</p>
 *
 * <pre>{@code
 * TelemetryRecord record = TelemetryRecord.of("{\"duration_ms\":42}", "corr-123");
 * relay.enqueue(record);
 * }</pre>
 *
 * <p>Instances are immutable.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TelemetryRecord {

    @JsonProperty("payload")
    private final byte[] payload;

    @JsonProperty("correlationId")
    private final String correlationId;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonCreator
    public TelemetryRecord(
            @JsonProperty("payload") byte[] payload,
            @JsonProperty("correlationId") String correlationId,
            @JsonProperty("timestamp") Instant timestamp) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        this.payload = payload.clone();
        this.correlationId = correlationId;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    /**
     * Create a record stamped with the current time
     */
    public static TelemetryRecord of(byte[] payload, String correlationId) {
        return new TelemetryRecord(payload, correlationId, Instant.now());
    }

    /**
     * Create a record from a UTF-8 string payload (typically JSON)
     */
    public static TelemetryRecord of(String payload, String correlationId) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        return of(payload.getBytes(StandardCharsets.UTF_8), correlationId);
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    @JsonIgnore
    public String getPayloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Approximate footprint used for the buffer byte ceiling
     */
    @JsonIgnore
    public long sizeBytes() {
        long size = payload.length;
        if (correlationId != null) {
            size += correlationId.length();
        }
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TelemetryRecord)) return false;
        TelemetryRecord that = (TelemetryRecord) o;
        return Arrays.equals(payload, that.payload)
                && Objects.equals(correlationId, that.correlationId)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(correlationId, timestamp);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "TelemetryRecord{correlationId='" + correlationId + "', bytes=" + payload.length
                + ", timestamp=" + timestamp + "}";
    }
}
