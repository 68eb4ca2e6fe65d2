package com.telemetryrelay.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Circuit breaker gate position
 */
public enum CircuitState {
    CLOSED("CLOSED"),
    OPEN("OPEN"),
    HALF_OPEN("HALF_OPEN");

    private final String value;

    CircuitState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CircuitState fromValue(String value) {
        for (CircuitState state : CircuitState.values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown CircuitState: " + value);
    }
}
