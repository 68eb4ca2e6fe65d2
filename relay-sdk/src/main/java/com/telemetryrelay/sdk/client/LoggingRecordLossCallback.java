package com.telemetryrelay.sdk.client;

import com.telemetryrelay.sdk.model.TelemetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link RecordLossCallback}: logs each lost record at WARN.
 */
public final class LoggingRecordLossCallback implements RecordLossCallback {

    private static final Logger log = LoggerFactory.getLogger(LoggingRecordLossCallback.class);

    public static final LoggingRecordLossCallback INSTANCE = new LoggingRecordLossCallback();

    private LoggingRecordLossCallback() {
    }

    @Override
    public void onRecordLoss(TelemetryRecord record, String reason) {
        log.warn("Record lost ({}): correlationId={}, bytes={}",
                reason, record.getCorrelationId(), record.sizeBytes());
    }
}
