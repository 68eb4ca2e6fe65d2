package com.telemetryrelay.sdk.client;

import com.telemetryrelay.sdk.model.TelemetryRecord;

/**
 * Downstream destination for telemetry records.
 *
 * <p>{@link #deliver} returns normally only once the sink has accepted the
 * record; any exception counts as a failed delivery and the record stays
 * buffered. Implementations are called from the relay's sink threads and must be
 * thread-safe. Delivery is at-least-once, so sinks should tolerate duplicates.</p>
 *
 * <p>Built-in implementations: {@link SinkClient} (HTTP POST) and
 * {@link GelfTcpSink} (GELF over TCP).</p>
 */
@FunctionalInterface
public interface TelemetrySink {

    /**
     * Deliver one record
     *
     * @throws Exception if the sink did not accept the record
     */
    void deliver(TelemetryRecord record) throws Exception;
}
