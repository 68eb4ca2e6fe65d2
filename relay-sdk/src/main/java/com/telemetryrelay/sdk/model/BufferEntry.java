package com.telemetryrelay.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A record held by the durable buffer, tagged with its insertion sequence.
 *
 * <p>Sequences increase monotonically per buffer and survive restarts, so they
 * double as the acknowledgement id handed back to {@code acknowledge}.</p>
 */
public final class BufferEntry {

    @JsonProperty("sequence")
    private final long sequence;

    @JsonProperty("record")
    private final TelemetryRecord record;

    @JsonProperty("tier")
    private final StorageTier tier;

    @JsonCreator
    public BufferEntry(
            @JsonProperty("sequence") long sequence,
            @JsonProperty("record") TelemetryRecord record,
            @JsonProperty("tier") StorageTier tier) {
        this.sequence = sequence;
        this.record = Objects.requireNonNull(record, "record");
        this.tier = tier != null ? tier : StorageTier.MEMORY;
    }

    public long getSequence() {
        return sequence;
    }

    public TelemetryRecord getRecord() {
        return record;
    }

    public StorageTier getTier() {
        return tier;
    }

    public BufferEntry withTier(StorageTier newTier) {
        return newTier == tier ? this : new BufferEntry(sequence, record, newTier);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BufferEntry)) return false;
        BufferEntry that = (BufferEntry) o;
        return sequence == that.sequence && record.equals(that.record) && tier == that.tier;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, record, tier);
    }

    @Override
    public String toString() {
        return "BufferEntry{sequence=" + sequence + ", tier=" + tier.getValue() + ", record=" + record + "}";
    }
}
