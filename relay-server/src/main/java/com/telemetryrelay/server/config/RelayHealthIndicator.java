package com.telemetryrelay.server.config;

import com.telemetryrelay.sdk.client.TelemetryRelay;
import com.telemetryrelay.sdk.model.RelayStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the relay under {@code /actuator/health}. An open circuit is
 * reported as DEGRADED rather than DOWN: records are still accepted and
 * buffered.
 */
@Component
public class RelayHealthIndicator implements HealthIndicator {

    private final TelemetryRelay relay;

    public RelayHealthIndicator(TelemetryRelay relay) {
        this.relay = relay;
    }

    @Override
    public Health health() {
        RelayStatus status = relay.status();
        Health.Builder builder = RelayStatus.STATUS_OK.equals(status.getStatus())
                ? Health.up()
                : Health.status("DEGRADED");
        return builder
                .withDetail("circuitState", status.getCircuitState())
                .withDetail("failureCount", status.getFailureCount())
                .withDetail("bufferedRecords", status.getBuffer().getTotalCount())
                .withDetail("bufferedBytes", status.getBuffer().getTotalBytes())
                .withDetail("replaying", status.getReplay().isReplaying())
                .withDetail("uptimeSeconds", status.getUptimeSeconds())
                .build();
    }
}
