package com.telemetryrelay.sdk.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetryrelay.sdk.client.transport.JdkHttpTransport;
import com.telemetryrelay.sdk.client.transport.SinkRequest;
import com.telemetryrelay.sdk.client.transport.SinkResponse;
import com.telemetryrelay.sdk.client.transport.SinkTransport;
import com.telemetryrelay.sdk.exception.RelayConfigurationException;
import com.telemetryrelay.sdk.exception.SinkException;
import com.telemetryrelay.sdk.model.TelemetryRecord;
import com.telemetryrelay.sdk.util.RelayFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * HTTP Sink Client - delivers records to an HTTP ingestion endpoint
 *
 * <p>Each record is POSTed on its own with the payload as the JSON body, exactly
 * as the producer serialized it. Any 2xx response is success; every other
 * status raises a {@link SinkException} carrying the status code.</p>
 *
 * <p>The client does not retry. A failed record stays in the relay's buffer and
 * is retried by the next drain cycle or replay.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * SinkClient sink = SinkClient.builder()
 *     .endpoint("https://listener.internal:8443/ingest/php")
 *     .apiKey("listener-api-key")
 *     .projectId("storefront")
 *     .build();
 * }</pre>
 */
public class SinkClient implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(SinkClient.class);

    static final String CORRELATION_HEADER = "X-Correlation-Id";
    static final String PROJECT_HEADER = "X-Project-Id";

    private final URI endpoint;
    private final SinkTransport transport;
    private final ObjectMapper objectMapper;
    private final Map<String, String> defaultHeaders;
    private final TokenProvider tokenProvider;
    private final Duration requestTimeout;

    private SinkClient(Builder builder) {
        this.endpoint = URI.create(builder.endpoint);

        if (builder.transport != null) {
            this.transport = builder.transport;
        } else {
            HttpClient httpClient = builder.httpClient != null
                    ? builder.httpClient
                    : HttpClient.newBuilder()
                        .connectTimeout(builder.connectTimeout)
                        .build();
            this.transport = new JdkHttpTransport(httpClient);
        }

        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : RelayFiles.newObjectMapper();

        this.defaultHeaders = new HashMap<>();
        this.defaultHeaders.put("Content-Type", "application/json");
        this.defaultHeaders.put("Accept", "application/json");
        if (builder.projectId != null && !builder.projectId.isBlank()) {
            this.defaultHeaders.put(PROJECT_HEADER, builder.projectId);
        }

        this.tokenProvider = builder.tokenProvider;
        this.requestTimeout = builder.requestTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void deliver(TelemetryRecord record) {
        SinkResponse response;
        try {
            response = transport.send(buildRequest(record));
        } catch (SinkException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkException("Interrupted while delivering record", e);
        } catch (Exception e) {
            throw new SinkException("Failed to deliver record to " + endpoint, e);
        }

        int status = response.getStatusCode();
        if (!response.isSuccess()) {
            throw new SinkException(
                    "Sink error: " + status + " - " + response.getBody(),
                    status,
                    extractErrorCode(response.getBody()));
        }
        log.trace("Record delivered: correlationId={}, status={}", record.getCorrelationId(), status);
    }

    public URI getEndpoint() {
        return endpoint;
    }

    private SinkRequest buildRequest(TelemetryRecord record) {
        Map<String, String> headers = new HashMap<>(defaultHeaders);
        if (tokenProvider != null) {
            headers.put("Authorization", "Bearer " + tokenProvider.getToken());
        }
        if (record.getCorrelationId() != null) {
            headers.put(CORRELATION_HEADER, record.getCorrelationId());
        }
        return new SinkRequest(endpoint, record.getPayload(), headers, requestTimeout);
    }

    private String extractErrorCode(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            if (node != null && node.has("error")) {
                return node.get("error").asText();
            }
        } catch (Exception e) {
            log.trace("Sink error body is not JSON: {}", e.getMessage());
        }
        return null;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Builder for SinkClient
     */
    public static class Builder {
        private String endpoint;
        private TokenProvider tokenProvider;
        private String projectId;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(5);
        private ObjectMapper objectMapper;
        private HttpClient httpClient;
        private SinkTransport transport;

        /**
         * Full URL records are POSTed to (required)
         */
        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Set the token provider for bearer authentication
         */
        public Builder tokenProvider(TokenProvider tokenProvider) {
            this.tokenProvider = tokenProvider;
            return this;
        }

        /**
         * Set a static API key (wraps in {@link StaticTokenProvider}); blank keys are ignored
         */
        public Builder apiKey(String apiKey) {
            if (apiKey != null && !apiKey.isBlank()) {
                this.tokenProvider = TokenProvider.of(apiKey);
            }
            return this;
        }

        /**
         * Project identifier sent as {@code X-Project-Id}
         */
        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        /**
         * Set the connection timeout (default: 5 seconds)
         */
        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Set the per-request timeout (default: 5 seconds)
         */
        public Builder requestTimeout(Duration timeout) {
            this.requestTimeout = timeout;
            return this;
        }

        /**
         * Provide a pre-configured ObjectMapper (used to read error bodies)
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Provide a pre-configured HttpClient (connectTimeout will be ignored if set)
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * Provide a custom transport (overrides any HttpClient settings)
         */
        public Builder transport(SinkTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Build the SinkClient
         *
         * @throws RelayConfigurationException if the endpoint is missing or not a valid URI
         */
        public SinkClient build() {
            if (endpoint == null || endpoint.isBlank()) {
                throw new RelayConfigurationException("endpoint is required");
            }
            try {
                URI uri = URI.create(endpoint);
                if (uri.getScheme() == null || uri.getHost() == null) {
                    throw new RelayConfigurationException("endpoint must be an absolute URL, got: " + endpoint);
                }
            } catch (IllegalArgumentException e) {
                throw new RelayConfigurationException("endpoint is not a valid URI: " + endpoint, e);
            }
            if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
                throw new RelayConfigurationException("requestTimeout must be positive, got: " + requestTimeout);
            }
            if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
                throw new RelayConfigurationException("connectTimeout must be positive, got: " + connectTimeout);
            }
            return new SinkClient(this);
        }
    }
}
