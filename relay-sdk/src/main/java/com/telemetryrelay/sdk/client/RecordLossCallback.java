package com.telemetryrelay.sdk.client;

import com.telemetryrelay.sdk.model.TelemetryRecord;

/**
 * Callback invoked when a record is dropped and will not be delivered.
 *
 * <p>Implementations must be thread-safe and should not throw exceptions.
 * The default implementation logs a warning via SLF4J.</p>
 */
@FunctionalInterface
public interface RecordLossCallback {

    /**
     * Called when a record is lost.
     *
     * @param record the record that was dropped
     * @param reason a short identifier describing why the record was lost
     *               (e.g. "evicted", "disk_write_failed", "shutdown_in_progress")
     */
    void onRecordLoss(TelemetryRecord record, String reason);
}
