package com.telemetryrelay.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a buffered entry currently lives
 */
public enum StorageTier {
    MEMORY("memory"),
    DISK("disk");

    private final String value;

    StorageTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static StorageTier fromValue(String value) {
        for (StorageTier tier : StorageTier.values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown StorageTier: " + value);
    }
}
