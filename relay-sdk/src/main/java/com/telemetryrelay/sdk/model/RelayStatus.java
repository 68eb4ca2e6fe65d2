package com.telemetryrelay.sdk.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Health document describing one relay instance.
 *
 * <p>{@code status} is {@code "ok"} while the circuit is closed and
 * {@code "degraded"} otherwise; records keep buffering either way.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RelayStatus {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_DEGRADED = "degraded";

    @JsonProperty("status")
    private final String status;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("uptimeSeconds")
    private final long uptimeSeconds;

    @JsonProperty("circuitState")
    private final CircuitState circuitState;

    @JsonProperty("failureCount")
    private final int failureCount;

    @JsonProperty("buffer")
    private final BufferStats buffer;

    @JsonProperty("replay")
    private final ReplayStatus replay;

    @JsonProperty("lastError")
    private final String lastError;

    public RelayStatus(Instant timestamp, long uptimeSeconds, CircuitState circuitState, int failureCount,
                       BufferStats buffer, ReplayStatus replay, String lastError) {
        this.status = circuitState == CircuitState.CLOSED ? STATUS_OK : STATUS_DEGRADED;
        this.timestamp = timestamp;
        this.uptimeSeconds = uptimeSeconds;
        this.circuitState = circuitState;
        this.failureCount = failureCount;
        this.buffer = buffer;
        this.replay = replay;
        this.lastError = lastError;
    }

    public String getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getUptimeSeconds() {
        return uptimeSeconds;
    }

    public CircuitState getCircuitState() {
        return circuitState;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public BufferStats getBuffer() {
        return buffer;
    }

    public ReplayStatus getReplay() {
        return replay;
    }

    public String getLastError() {
        return lastError;
    }
}
