package com.telemetryrelay.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Persisted circuit breaker snapshot.
 *
 * <p>This is the document written to the breaker state file on every transition
 * and read back at start-up. Times are epoch milliseconds.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CircuitBreakerState {

    @JsonProperty("state")
    private final CircuitState state;

    @JsonProperty("failureCount")
    private final int failureCount;

    @JsonProperty("lastFailureTime")
    private final Long lastFailureTime;

    @JsonProperty("lastStateChangeTime")
    private final long lastStateChangeTime;

    @JsonCreator
    public CircuitBreakerState(
            @JsonProperty("state") CircuitState state,
            @JsonProperty("failureCount") int failureCount,
            @JsonProperty("lastFailureTime") Long lastFailureTime,
            @JsonProperty("lastStateChangeTime") long lastStateChangeTime) {
        this.state = state;
        this.failureCount = failureCount;
        this.lastFailureTime = lastFailureTime;
        this.lastStateChangeTime = lastStateChangeTime;
    }

    public static CircuitBreakerState closed(long now) {
        return new CircuitBreakerState(CircuitState.CLOSED, 0, null, now);
    }

    public CircuitState getState() {
        return state;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public Long getLastFailureTime() {
        return lastFailureTime;
    }

    public long getLastStateChangeTime() {
        return lastStateChangeTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CircuitBreakerState)) return false;
        CircuitBreakerState that = (CircuitBreakerState) o;
        return failureCount == that.failureCount
                && lastStateChangeTime == that.lastStateChangeTime
                && state == that.state
                && Objects.equals(lastFailureTime, that.lastFailureTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, failureCount, lastFailureTime, lastStateChangeTime);
    }

    @Override
    public String toString() {
        return "CircuitBreakerState{state=" + state + ", failureCount=" + failureCount
                + ", lastFailureTime=" + lastFailureTime + ", lastStateChangeTime=" + lastStateChangeTime + "}";
    }
}
