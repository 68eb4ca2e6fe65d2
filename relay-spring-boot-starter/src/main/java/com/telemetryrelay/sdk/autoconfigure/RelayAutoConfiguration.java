package com.telemetryrelay.sdk.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetryrelay.sdk.autoconfigure.transport.RestClientTransport;
import com.telemetryrelay.sdk.client.GelfTcpSink;
import com.telemetryrelay.sdk.client.RecordLossCallback;
import com.telemetryrelay.sdk.client.SinkClient;
import com.telemetryrelay.sdk.client.TelemetryRelay;
import com.telemetryrelay.sdk.client.TelemetrySink;
import com.telemetryrelay.sdk.client.TokenProvider;
import com.telemetryrelay.sdk.client.transport.JdkHttpTransport;
import com.telemetryrelay.sdk.client.transport.SinkTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

@AutoConfiguration
@EnableConfigurationProperties(RelayProperties.class)
@ConditionalOnClass(TelemetryRelay.class)
@ConditionalOnProperty(prefix = "telemetry.relay", name = "enabled", havingValue = "true")
public class RelayAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RelayAutoConfiguration.class);
    private static final Set<String> DEV_PROFILES = new HashSet<>(Arrays.asList("dev", "local", "test"));

    private static final Duration DEV_CONNECT_TIMEOUT = Duration.ofSeconds(2);
    private static final Duration DEV_RESET_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEV_FLUSH_INTERVAL = Duration.ofSeconds(1);

    private final Environment environment;

    public RelayAutoConfiguration(Environment environment) {
        this.environment = environment;
    }

    @Bean
    @ConditionalOnClass(RestClient.class)
    @ConditionalOnProperty(prefix = "telemetry.relay", name = "transport", havingValue = "restclient")
    @ConditionalOnMissingBean(SinkTransport.class)
    public SinkTransport relayRestClientTransport(ObjectProvider<RestClient.Builder> restClientBuilderProvider) {
        RestClient.Builder builder = restClientBuilderProvider.getIfUnique();
        RestClient restClient = builder != null ? builder.build() : RestClient.builder().build();
        return new RestClientTransport(restClient);
    }

    @Bean
    @ConditionalOnProperty(prefix = "telemetry.relay", name = "transport", havingValue = "jdk", matchIfMissing = true)
    @ConditionalOnMissingBean(SinkTransport.class)
    public SinkTransport relayJdkTransport(RelayProperties properties, ObjectProvider<HttpClient> httpClientProvider) {
        HttpClient httpClient = httpClientProvider.getIfUnique();
        if (httpClient == null) {
            Duration connectTimeout = resolveDuration(
                    properties.getConnectTimeout(),
                    "telemetry.relay.connect-timeout",
                    DEV_CONNECT_TIMEOUT);
            httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        }
        return new JdkHttpTransport(httpClient);
    }

    @Bean
    @ConditionalOnMissingBean(TokenProvider.class)
    @ConditionalOnProperty(prefix = "telemetry.relay", name = "api-key")
    public TokenProvider relayApiKeyTokenProvider(RelayProperties properties) {
        return TokenProvider.of(properties.getApiKey());
    }

    @Bean
    @ConditionalOnMissingBean(TelemetrySink.class)
    @ConditionalOnProperty(prefix = "telemetry.relay.gelf", name = "enabled", havingValue = "true")
    public TelemetrySink relayGelfSink(RelayProperties properties, ObjectProvider<ObjectMapper> objectMapperProvider) {
        RelayProperties.Gelf gelf = properties.getGelf();
        Duration connectTimeout = resolveDuration(
                properties.getConnectTimeout(),
                "telemetry.relay.connect-timeout",
                DEV_CONNECT_TIMEOUT);

        GelfTcpSink.Builder builder = GelfTcpSink.builder()
                .host(gelf.getHost())
                .port(gelf.getPort())
                .source(gelf.getSource())
                .connectTimeout(connectTimeout)
                .writeTimeout(properties.getSendTimeout());

        if (hasText(properties.getProjectId())) {
            builder.project(properties.getProjectId());
        }
        if (hasText(gelf.getFacility())) {
            builder.facility(gelf.getFacility());
        }

        ObjectMapper objectMapper = objectMapperProvider.getIfUnique();
        if (objectMapper != null) {
            builder.objectMapper(objectMapper);
        }

        log.info("Telemetry relay forwarding to GELF input {}:{}", gelf.getHost(), gelf.getPort());
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean(TelemetrySink.class)
    @ConditionalOnProperty(prefix = "telemetry.relay.gelf", name = "enabled", havingValue = "false", matchIfMissing = true)
    public TelemetrySink relaySinkClient(
            RelayProperties properties,
            ObjectProvider<TokenProvider> tokenProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<SinkTransport> transportProvider) {
        SinkClient.Builder builder = SinkClient.builder()
                .endpoint(properties.getEndpoint())
                .requestTimeout(properties.getSendTimeout());

        if (hasText(properties.getProjectId())) {
            builder.projectId(properties.getProjectId());
        }

        TokenProvider token = tokenProvider.getIfUnique();
        if (token != null) {
            builder.tokenProvider(token);
        }

        ObjectMapper objectMapper = objectMapperProvider.getIfUnique();
        if (objectMapper != null) {
            builder.objectMapper(objectMapper);
        }

        SinkTransport transport = transportProvider.getIfUnique();
        if (transport != null) {
            builder.transport(transport);
        }

        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public TelemetryRelay telemetryRelay(
            TelemetrySink sink,
            RelayProperties properties,
            ObjectProvider<RecordLossCallback> recordLossCallbackProvider) {
        Duration resetTimeout = resolveDuration(
                properties.getResetTimeout(),
                "telemetry.relay.reset-timeout",
                DEV_RESET_TIMEOUT);
        Duration flushInterval = resolveDuration(
                properties.getFlushInterval(),
                "telemetry.relay.flush-interval",
                DEV_FLUSH_INTERVAL);

        TelemetryRelay.Builder builder = TelemetryRelay.builder()
                .sink(sink)
                .bufferPath(properties.getBufferPath())
                .failureThreshold(properties.getFailureThreshold())
                .resetTimeout(resetTimeout)
                .memoryCapacity(properties.getMemoryCapacity())
                .capacityBytes(properties.getDiskCapacity().toBytes())
                .sendTimeout(properties.getSendTimeout())
                .batchSize(properties.getBatchSize())
                .flushInterval(flushInterval)
                .replayBatchDelay(properties.getReplayBatchDelay())
                .shutdownGrace(properties.getShutdownGrace())
                .registerShutdownHook(false);

        if (properties.getStateFile() != null) {
            builder.stateFile(properties.getStateFile());
        }

        RecordLossCallback callback = recordLossCallbackProvider.getIfUnique();
        if (callback != null) {
            builder.onRecordLoss(callback);
        }

        return builder.build();
    }

    @Bean
    @ConditionalOnBean(TelemetryRelay.class)
    public RelayShutdown relayShutdown(TelemetryRelay telemetryRelay) {
        return new RelayShutdown(telemetryRelay);
    }

    private Duration resolveDuration(Duration currentValue, String propertyKey, Duration devDefault) {
        if (environment.containsProperty(propertyKey)) {
            return currentValue;
        }
        return isDevProfile() ? devDefault : currentValue;
    }

    private boolean isDevProfile() {
        String[] activeProfiles = environment.getActiveProfiles();
        if (activeProfiles.length == 0) {
            activeProfiles = environment.getDefaultProfiles();
        }
        for (String profile : activeProfiles) {
            if (DEV_PROFILES.contains(profile.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
