package com.telemetryrelay.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time view of the durable buffer
 */
public final class BufferStats {

    @JsonProperty("memoryCount")
    private final int memoryCount;

    @JsonProperty("diskFileCount")
    private final int diskFileCount;

    @JsonProperty("diskEntryCount")
    private final long diskEntryCount;

    @JsonProperty("totalBytes")
    private final long totalBytes;

    @JsonProperty("capacityBytes")
    private final long capacityBytes;

    @JsonProperty("evictedTotal")
    private final long evictedTotal;

    @JsonProperty("droppedTotal")
    private final long droppedTotal;

    public BufferStats(int memoryCount, int diskFileCount, long diskEntryCount, long totalBytes,
                       long capacityBytes, long evictedTotal, long droppedTotal) {
        this.memoryCount = memoryCount;
        this.diskFileCount = diskFileCount;
        this.diskEntryCount = diskEntryCount;
        this.totalBytes = totalBytes;
        this.capacityBytes = capacityBytes;
        this.evictedTotal = evictedTotal;
        this.droppedTotal = droppedTotal;
    }

    public int getMemoryCount() {
        return memoryCount;
    }

    public int getDiskFileCount() {
        return diskFileCount;
    }

    public long getDiskEntryCount() {
        return diskEntryCount;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public long getCapacityBytes() {
        return capacityBytes;
    }

    public long getEvictedTotal() {
        return evictedTotal;
    }

    public long getDroppedTotal() {
        return droppedTotal;
    }

    public long getTotalCount() {
        return memoryCount + diskEntryCount;
    }

    @Override
    public String toString() {
        return String.format("BufferStats{memory=%d, diskFiles=%d, diskEntries=%d, bytes=%d/%d, evicted=%d, dropped=%d}",
                memoryCount, diskFileCount, diskEntryCount, totalBytes, capacityBytes, evictedTotal, droppedTotal);
    }
}
