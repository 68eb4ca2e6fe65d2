package com.telemetryrelay.sdk.autoconfigure;

import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

@ConfigurationProperties(prefix = "telemetry.relay")
@Validated
public class RelayProperties {

    private static final int DEFAULT_FAILURE_THRESHOLD = 5;
    private static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(60);
    private static final int DEFAULT_MEMORY_CAPACITY = 100;
    private static final DataSize DEFAULT_DISK_CAPACITY = DataSize.ofMegabytes(100);
    private static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final int DEFAULT_BATCH_SIZE = 100;
    private static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(5);
    private static final Duration DEFAULT_REPLAY_BATCH_DELAY = Duration.ofMillis(100);
    private static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final boolean enabled;
    private final String endpoint;
    private final String apiKey;
    private final String projectId;
    private final Path bufferPath;
    private final Path stateFile;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final int memoryCapacity;
    private final DataSize diskCapacity;
    private final Duration sendTimeout;
    private final Duration connectTimeout;
    private final int batchSize;
    private final Duration flushInterval;
    private final Duration replayBatchDelay;
    private final Duration shutdownGrace;
    private final String transport;

    @NestedConfigurationProperty
    private final Gelf gelf;

    @NestedConfigurationProperty
    private final Metrics metrics;

    public RelayProperties(
            Boolean enabled,
            String endpoint,
            String apiKey,
            String projectId,
            Path bufferPath,
            Path stateFile,
            Integer failureThreshold,
            Duration resetTimeout,
            Integer memoryCapacity,
            DataSize diskCapacity,
            Duration sendTimeout,
            Duration connectTimeout,
            Integer batchSize,
            Duration flushInterval,
            Duration replayBatchDelay,
            Duration shutdownGrace,
            String transport,
            Gelf gelf,
            Metrics metrics) {
        this.enabled = enabled != null && enabled;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.projectId = projectId;
        this.bufferPath = bufferPath;
        this.stateFile = stateFile;
        this.failureThreshold = failureThreshold != null ? failureThreshold : DEFAULT_FAILURE_THRESHOLD;
        this.resetTimeout = resetTimeout != null ? resetTimeout : DEFAULT_RESET_TIMEOUT;
        this.memoryCapacity = memoryCapacity != null ? memoryCapacity : DEFAULT_MEMORY_CAPACITY;
        this.diskCapacity = diskCapacity != null ? diskCapacity : DEFAULT_DISK_CAPACITY;
        this.sendTimeout = sendTimeout != null ? sendTimeout : DEFAULT_SEND_TIMEOUT;
        this.connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
        this.batchSize = batchSize != null ? batchSize : DEFAULT_BATCH_SIZE;
        this.flushInterval = flushInterval != null ? flushInterval : DEFAULT_FLUSH_INTERVAL;
        this.replayBatchDelay = replayBatchDelay != null ? replayBatchDelay : DEFAULT_REPLAY_BATCH_DELAY;
        this.shutdownGrace = shutdownGrace != null ? shutdownGrace : DEFAULT_SHUTDOWN_GRACE;
        this.transport = normalizeTransport(transport);
        this.gelf = gelf != null ? gelf : new Gelf(null, null, null, null, null);
        this.metrics = metrics != null ? metrics : new Metrics(null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getProjectId() {
        return projectId;
    }

    public Path getBufferPath() {
        return bufferPath;
    }

    public Path getStateFile() {
        return stateFile;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getResetTimeout() {
        return resetTimeout;
    }

    public int getMemoryCapacity() {
        return memoryCapacity;
    }

    public DataSize getDiskCapacity() {
        return diskCapacity;
    }

    public Duration getSendTimeout() {
        return sendTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public Duration getReplayBatchDelay() {
        return replayBatchDelay;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public String getTransport() {
        return transport;
    }

    public Gelf getGelf() {
        return gelf;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    @AssertTrue(message = "telemetry.relay.endpoint is required when telemetry.relay.enabled=true and GELF is not enabled")
    public boolean isEndpointValid() {
        return !enabled || gelf.isEnabled() || hasText(endpoint);
    }

    @AssertTrue(message = "telemetry.relay.buffer-path is required when telemetry.relay.enabled=true")
    public boolean isBufferPathValid() {
        return !enabled || bufferPath != null;
    }

    @AssertTrue(message = "telemetry.relay.failure-threshold, memory-capacity and batch-size must be positive")
    public boolean isLimitsValid() {
        return failureThreshold > 0 && memoryCapacity > 0 && batchSize > 0;
    }

    @AssertTrue(message = "telemetry.relay.transport must be one of: restclient, jdk")
    public boolean isTransportValid() {
        if (!hasText(transport)) {
            return true;
        }
        return transport.equals("restclient") || transport.equals("jdk");
    }

    /**
     * Forward to a Graylog GELF TCP input instead of the HTTP listener
     */
    public static class Gelf {
        private static final String DEFAULT_HOST = "localhost";
        private static final int DEFAULT_PORT = 12201;
        private static final String DEFAULT_SOURCE = "telemetry-relay";

        private final boolean enabled;
        private final String host;
        private final int port;
        private final String source;
        private final String facility;

        public Gelf(Boolean enabled, String host, Integer port, String source, String facility) {
            this.enabled = enabled != null && enabled;
            this.host = hasText(host) ? host.trim() : DEFAULT_HOST;
            this.port = port != null ? port : DEFAULT_PORT;
            this.source = hasText(source) ? source.trim() : DEFAULT_SOURCE;
            this.facility = facility;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public String getHost() {
            return host;
        }

        public int getPort() {
            return port;
        }

        public String getSource() {
            return source;
        }

        public String getFacility() {
            return facility;
        }
    }

    public static class Metrics {
        private final boolean enabled;

        public Metrics(Boolean enabled) {
            this.enabled = enabled == null || enabled;
        }

        public boolean isEnabled() {
            return enabled;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String normalizeTransport(String transport) {
        if (!hasText(transport)) {
            return null;
        }
        return transport.trim().toLowerCase(Locale.ROOT);
    }
}
