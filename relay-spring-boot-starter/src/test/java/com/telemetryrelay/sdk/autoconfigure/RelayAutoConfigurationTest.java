package com.telemetryrelay.sdk.autoconfigure;

import com.telemetryrelay.sdk.autoconfigure.transport.RestClientTransport;
import com.telemetryrelay.sdk.client.GelfTcpSink;
import com.telemetryrelay.sdk.client.RecordLossCallback;
import com.telemetryrelay.sdk.client.SinkClient;
import com.telemetryrelay.sdk.client.TelemetryRelay;
import com.telemetryrelay.sdk.client.TelemetrySink;
import com.telemetryrelay.sdk.client.TokenProvider;
import com.telemetryrelay.sdk.client.transport.JdkHttpTransport;
import com.telemetryrelay.sdk.client.transport.SinkTransport;
import com.telemetryrelay.sdk.model.CircuitState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class RelayAutoConfigurationTest {

    @TempDir
    Path tempDir;

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RelayAutoConfiguration.class));

    private ApplicationContextRunner enabledRunner() {
        return contextRunner.withPropertyValues(
                "telemetry.relay.enabled=true",
                "telemetry.relay.endpoint=https://listener.test/ingest/php",
                "telemetry.relay.buffer-path=" + tempDir.resolve("buffer"));
    }

    @Test
    void doesNotRegisterBeansWhenDisabled() {
        contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(TelemetryRelay.class);
            assertThat(context).doesNotHaveBean(TelemetrySink.class);
            assertThat(context).doesNotHaveBean(SinkTransport.class);
        });
    }

    @Test
    void registersBeansWhenEnabledAndConfigured() {
        enabledRunner().run(context -> {
            assertThat(context).hasSingleBean(TelemetryRelay.class);
            assertThat(context).hasSingleBean(TelemetrySink.class);
            assertThat(context).hasSingleBean(SinkTransport.class);
            assertThat(context).hasSingleBean(RelayShutdown.class);
            assertThat(context.getBean(TelemetrySink.class)).isInstanceOf(SinkClient.class);
        });
    }

    @Test
    void createsBufferDirectoryOnStartup() {
        enabledRunner().run(context -> {
            assertThat(Files.isDirectory(tempDir.resolve("buffer"))).isTrue();
            assertThat(context.getBean(TelemetryRelay.class).getBufferDepth()).isZero();
        });
    }

    @Test
    void missingEndpointFailsFast() {
        contextRunner
                .withPropertyValues(
                        "telemetry.relay.enabled=true",
                        "telemetry.relay.buffer-path=" + tempDir)
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void missingBufferPathFailsFast() {
        contextRunner
                .withPropertyValues(
                        "telemetry.relay.enabled=true",
                        "telemetry.relay.endpoint=https://listener.test/ingest/php")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void unknownTransportFailsFast() {
        enabledRunner()
                .withPropertyValues("telemetry.relay.transport=carrier-pigeon")
                .run(context -> assertThat(context).hasFailed());
    }

    // --- Transport selection ---

    @Test
    void registersJdkTransportByDefault() {
        enabledRunner().run(context -> {
            assertThat(context).hasSingleBean(SinkTransport.class);
            assertThat(context.getBean(SinkTransport.class)).isInstanceOf(JdkHttpTransport.class);
        });
    }

    @Test
    void registersRestClientTransportWhenConfigured() {
        enabledRunner()
                .withPropertyValues("telemetry.relay.transport=restclient")
                .run(context -> {
                    assertThat(context).hasSingleBean(SinkTransport.class);
                    assertThat(context.getBean(SinkTransport.class)).isInstanceOf(RestClientTransport.class);
                });
    }

    @Test
    void transportNameIsCaseInsensitive() {
        enabledRunner()
                .withPropertyValues("telemetry.relay.transport=RestClient")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBeansOfType(SinkTransport.class)).hasSize(1);
                });
    }

    // --- Auth ---

    @Test
    void registersApiKeyTokenProvider() {
        enabledRunner()
                .withPropertyValues("telemetry.relay.api-key=listener-secret")
                .run(context -> {
                    assertThat(context).hasSingleBean(TokenProvider.class);
                    assertThat(context.getBean(TokenProvider.class).getToken()).isEqualTo("listener-secret");
                });
    }

    @Test
    void doesNotRegisterTokenProviderWithoutApiKey() {
        enabledRunner().run(context -> assertThat(context).doesNotHaveBean(TokenProvider.class));
    }

    // --- Sink selection ---

    @Test
    void gelfSinkReplacesHttpClientWhenEnabled() {
        contextRunner
                .withPropertyValues(
                        "telemetry.relay.enabled=true",
                        "telemetry.relay.buffer-path=" + tempDir,
                        "telemetry.relay.gelf.enabled=true",
                        "telemetry.relay.gelf.host=graylog.test",
                        "telemetry.relay.gelf.port=12201")
                .run(context -> {
                    assertThat(context).hasSingleBean(TelemetrySink.class);
                    assertThat(context.getBean(TelemetrySink.class)).isInstanceOf(GelfTcpSink.class);
                    assertThat(context).hasSingleBean(TelemetryRelay.class);
                });
    }

    @Test
    void userSinkBacksOffDefaultSink() {
        enabledRunner()
                .withUserConfiguration(CustomSinkConfig.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(TelemetrySink.class);
                    assertThat(context.getBean(TelemetrySink.class)).isSameAs(CustomSinkConfig.SINK);
                });
    }

    @Test
    void userRecordLossCallbackIsWiredIntoRelay() {
        enabledRunner()
                .withUserConfiguration(LossCallbackConfig.class)
                .run(context -> {
                    TelemetryRelay relay = context.getBean(TelemetryRelay.class);
                    relay.shutdown();

                    relay.enqueue("{}", "late");

                    assertThat(context.getBean(LossCallbackConfig.class).reasons)
                            .containsExactly("shutdown_in_progress");
                });
    }

    // --- Breaker settings ---

    @Test
    void stateFileRestoresOpenBreaker() throws Exception {
        Path stateFile = tempDir.resolve("state/circuit-breaker.json");
        Files.createDirectories(stateFile.getParent());
        Files.writeString(stateFile,
                "{\"state\":\"OPEN\",\"failureCount\":5,"
                        + "\"lastFailureTime\":4102444800000,\"lastStateChangeTime\":4102444800000}");

        enabledRunner()
                .withPropertyValues("telemetry.relay.state-file=" + stateFile)
                .run(context -> {
                    TelemetryRelay relay = context.getBean(TelemetryRelay.class);
                    assertThat(relay.getCircuitBreaker().currentState()).isEqualTo(CircuitState.OPEN);
                });
    }

    // --- Dev profile defaults ---

    @Test
    void devProfileUsesDevDefaults() {
        enabledRunner()
                .withPropertyValues("spring.profiles.active=dev")
                .run(context -> assertThat(context).hasSingleBean(TelemetryRelay.class));
    }

    @Test
    void explicitPropertyOverridesDevDefault() {
        enabledRunner()
                .withPropertyValues(
                        "spring.profiles.active=local",
                        "telemetry.relay.flush-interval=30s",
                        "telemetry.relay.connect-timeout=15s")
                .run(context -> assertThat(context).hasSingleBean(TelemetryRelay.class));
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomSinkConfig {
        static final TelemetrySink SINK = record -> { };

        @Bean
        TelemetrySink customSink() {
            return SINK;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class LossCallbackConfig {
        final List<String> reasons = new CopyOnWriteArrayList<>();

        @Bean
        RecordLossCallback recordLossCallback() {
            return (record, reason) -> reasons.add(reason);
        }
    }
}
