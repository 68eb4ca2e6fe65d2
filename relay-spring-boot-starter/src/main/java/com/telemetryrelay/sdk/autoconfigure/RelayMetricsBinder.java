package com.telemetryrelay.sdk.autoconfigure;

import com.telemetryrelay.sdk.client.TelemetryRelay;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

class RelayMetricsBinder {

    RelayMetricsBinder(TelemetryRelay relay, MeterRegistry registry) {
        Gauge.builder("telemetry.relay.records.enqueued", relay,
                        r -> r.getMetrics().recordsEnqueued)
                .description("Total records accepted into the buffer")
                .register(registry);

        Gauge.builder("telemetry.relay.records.sent", relay,
                        r -> r.getMetrics().recordsSent)
                .description("Total records delivered to the sink")
                .register(registry);

        Gauge.builder("telemetry.relay.records.failed", relay,
                        r -> r.getMetrics().recordsFailed)
                .description("Total failed send attempts")
                .register(registry);

        Gauge.builder("telemetry.relay.records.dropped", relay,
                        r -> r.getMetrics().recordsDropped)
                .description("Total records rejected or lost without delivery")
                .register(registry);

        Gauge.builder("telemetry.relay.records.evicted", relay,
                        r -> r.getMetrics().recordsEvicted)
                .description("Total records evicted to stay under the disk ceiling")
                .register(registry);

        Gauge.builder("telemetry.relay.records.replayed", relay,
                        r -> r.getMetrics().recordsReplayed)
                .description("Total records delivered by backlog replay")
                .register(registry);

        Gauge.builder("telemetry.relay.buffer.depth", relay,
                        r -> r.getMetrics().bufferDepth)
                .description("Records currently buffered in memory and on disk")
                .register(registry);

        Gauge.builder("telemetry.relay.buffer.bytes", relay,
                        r -> r.getMetrics().bufferBytes)
                .description("Bytes currently buffered in memory and on disk")
                .register(registry);

        Gauge.builder("telemetry.relay.circuit-breaker.open", relay,
                        r -> r.getMetrics().circuitOpen ? 1 : 0)
                .description("Circuit breaker state (1=open, 0=closed or half-open)")
                .register(registry);
    }
}
