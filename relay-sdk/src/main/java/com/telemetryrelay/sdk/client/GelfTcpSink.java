package com.telemetryrelay.sdk.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetryrelay.sdk.exception.RelayConfigurationException;
import com.telemetryrelay.sdk.exception.SinkException;
import com.telemetryrelay.sdk.model.TelemetryRecord;
import com.telemetryrelay.sdk.util.RelayFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * GELF TCP Sink - forwards records to a Graylog GELF TCP input
 *
 * <p>Each record becomes one GELF 1.1 message, written over a fresh TCP
 * connection and terminated by a null byte. The original payload travels in
 * {@code full_message}; the correlation id, project and source travel as
 * additional ({@code _}-prefixed) fields.</p>
 *
 * <pre>{@code
 * GelfTcpSink sink = GelfTcpSink.builder()
 *     .host("graylog.internal")
 *     .port(12201)
 *     .source("php_agent")
 *     .project("storefront")
 *     .build();
 * }</pre>
 */
public class GelfTcpSink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(GelfTcpSink.class);

    static final String GELF_VERSION = "1.1";
    static final int LEVEL_INFO = 6;

    private static final ScheduledExecutorService WRITE_WATCHDOG = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "gelf-write-watchdog");
        t.setDaemon(true);
        return t;
    });

    private final String host;
    private final int port;
    private final int connectTimeoutMs;
    private final int writeTimeoutMs;
    private final String source;
    private final String project;
    private final String facility;
    private final ObjectMapper objectMapper;

    private GelfTcpSink(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.connectTimeoutMs = (int) builder.connectTimeout.toMillis();
        this.writeTimeoutMs = (int) builder.writeTimeout.toMillis();
        this.source = builder.source;
        this.project = builder.project;
        this.facility = builder.facility;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : RelayFiles.newObjectMapper();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Send one frame. A write that has not finished within the write timeout
     * is aborted by closing the socket.
     */
    @Override
    public void deliver(TelemetryRecord record) {
        byte[] frame = encode(record);
        AtomicBoolean writeTimedOut = new AtomicBoolean(false);
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            ScheduledFuture<?> watchdog = WRITE_WATCHDOG.schedule(() -> {
                writeTimedOut.set(true);
                closeQuietly(socket);
            }, writeTimeoutMs, TimeUnit.MILLISECONDS);
            try {
                OutputStream out = socket.getOutputStream();
                out.write(frame);
                out.flush();
            } finally {
                watchdog.cancel(false);
            }
        } catch (IOException e) {
            if (writeTimedOut.get()) {
                throw new SinkException("GELF write to " + host + ":" + port
                        + " timed out after " + writeTimeoutMs + "ms", e);
            }
            throw new SinkException("Failed to send GELF message to " + host + ":" + port, e);
        }
        log.trace("GELF message sent: correlationId={}", record.getCorrelationId());
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Closing timed-out GELF socket failed: {}", e.getMessage());
        }
    }

    /**
     * Build the null-terminated GELF frame for a record
     */
    byte[] encode(TelemetryRecord record) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("version", GELF_VERSION);
        message.put("host", source);
        message.put("short_message", project != null ? source + " - " + project : source);
        message.put("timestamp", record.getTimestamp().toEpochMilli() / 1000.0);
        message.put("level", LEVEL_INFO);
        message.put("full_message", record.getPayloadAsString());
        if (record.getCorrelationId() != null) {
            message.put("_correlation_id", record.getCorrelationId());
        }
        if (project != null) {
            message.put("_project", project);
        }
        message.put("_source", source);
        if (facility != null) {
            message.put("_facility", facility);
        }
        try {
            byte[] json = objectMapper.writeValueAsBytes(message);
            byte[] frame = new byte[json.length + 1];
            System.arraycopy(json, 0, frame, 0, json.length);
            return frame;
        } catch (IOException e) {
            throw new SinkException("Failed to encode GELF message", e);
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private String host = "127.0.0.1";
        private int port = 12201;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration writeTimeout = Duration.ofSeconds(5);
        private String source = "telemetry-relay";
        private String project;
        private String facility;
        private ObjectMapper objectMapper;

        /**
         * GELF input host (default: 127.0.0.1)
         */
        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /**
         * GELF TCP port (default: 12201)
         */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder writeTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
            return this;
        }

        /**
         * Value of the GELF {@code host} and {@code _source} fields (default: telemetry-relay)
         */
        public Builder source(String source) {
            this.source = source;
            return this;
        }

        /**
         * Project identifier sent as {@code _project}
         */
        public Builder project(String project) {
            this.project = project;
            return this;
        }

        /**
         * Optional {@code _facility} field
         */
        public Builder facility(String facility) {
            this.facility = facility;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public GelfTcpSink build() {
            if (host == null || host.isBlank()) {
                throw new RelayConfigurationException("host is required");
            }
            if (port < 1 || port > 65535) {
                throw new RelayConfigurationException("port must be between 1 and 65535, got: " + port);
            }
            if (source == null || source.isBlank()) {
                throw new RelayConfigurationException("source is required");
            }
            if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
                throw new RelayConfigurationException("connectTimeout must be positive, got: " + connectTimeout);
            }
            if (writeTimeout == null || writeTimeout.isNegative() || writeTimeout.isZero()) {
                throw new RelayConfigurationException("writeTimeout must be positive, got: " + writeTimeout);
            }
            return new GelfTcpSink(this);
        }
    }
}
