package com.telemetryrelay.sdk.autoconfigure;

import com.telemetryrelay.sdk.client.TelemetryRelay;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = RelayAutoConfiguration.class)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean({TelemetryRelay.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "telemetry.relay.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
class RelayMetricsAutoConfiguration {

    @Bean
    RelayMetricsBinder relayMetricsBinder(TelemetryRelay relay, MeterRegistry registry) {
        return new RelayMetricsBinder(relay, registry);
    }
}
