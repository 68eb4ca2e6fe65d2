package com.telemetryrelay.sdk.client;

import com.telemetryrelay.sdk.client.transport.SinkRequest;
import com.telemetryrelay.sdk.client.transport.SinkResponse;
import com.telemetryrelay.sdk.client.transport.SinkTransport;
import com.telemetryrelay.sdk.exception.RelayConfigurationException;
import com.telemetryrelay.sdk.exception.SinkException;
import com.telemetryrelay.sdk.model.TelemetryRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SinkClientTest {

    private static final String ENDPOINT = "https://listener.test/ingest/php";

    @Test
    void postsPayloadVerbatimWithHeaders() {
        RecordingTransport transport = new RecordingTransport(new SinkResponse(202, ""));
        SinkClient client = SinkClient.builder()
                .endpoint(ENDPOINT)
                .apiKey("secret-key")
                .projectId("storefront")
                .transport(transport)
                .build();

        String payload = "{\"duration_ms\":42,\"route\":\"/checkout\"}";
        client.deliver(TelemetryRecord.of(payload, "corr-1"));

        SinkRequest request = transport.requests.get(0);
        assertEquals(URI.create(ENDPOINT), request.getUri());
        assertEquals("POST", request.getMethod());
        assertEquals(payload, new String(request.getBody(), StandardCharsets.UTF_8));
        assertEquals("Bearer secret-key", request.getHeaders().get("Authorization"));
        assertEquals("corr-1", request.getHeaders().get(SinkClient.CORRELATION_HEADER));
        assertEquals("storefront", request.getHeaders().get(SinkClient.PROJECT_HEADER));
        assertEquals("application/json", request.getHeaders().get("Content-Type"));
    }

    @Test
    void sendsNonUtf8PayloadBytesUnchanged() {
        RecordingTransport transport = new RecordingTransport(new SinkResponse(202, ""));
        SinkClient client = SinkClient.builder().endpoint(ENDPOINT).transport(transport).build();
        byte[] payload = new byte[]{123, -1, -2, 125};

        client.deliver(TelemetryRecord.of(payload, "corr-bin"));

        assertArrayEquals(payload, transport.requests.get(0).getBody());
    }

    @Test
    void omitsOptionalHeadersWhenNotConfigured() {
        RecordingTransport transport = new RecordingTransport(new SinkResponse(200, "{}"));
        SinkClient client = SinkClient.builder()
                .endpoint(ENDPOINT)
                .apiKey("  ")
                .transport(transport)
                .build();

        client.deliver(TelemetryRecord.of("{}", null));

        SinkRequest request = transport.requests.get(0);
        assertFalse(request.getHeaders().containsKey("Authorization"));
        assertFalse(request.getHeaders().containsKey(SinkClient.CORRELATION_HEADER));
        assertFalse(request.getHeaders().containsKey(SinkClient.PROJECT_HEADER));
    }

    @Test
    void anyTwoHundredStatusIsSuccess() {
        for (int status : new int[]{200, 201, 202, 204, 299}) {
            SinkClient client = SinkClient.builder()
                    .endpoint(ENDPOINT)
                    .transport(new RecordingTransport(new SinkResponse(status, "")))
                    .build();
            assertDoesNotThrow(() -> client.deliver(TelemetryRecord.of("{}", "c")), "status " + status);
        }
    }

    @Test
    void nonSuccessStatusThrowsWithStatusAndErrorCode() {
        SinkClient client = SinkClient.builder()
                .endpoint(ENDPOINT)
                .transport(new RecordingTransport(new SinkResponse(503, "{\"error\":\"OVERLOADED\"}")))
                .build();

        SinkException ex = assertThrows(SinkException.class,
                () -> client.deliver(TelemetryRecord.of("{}", "c")));

        assertEquals(503, ex.getStatusCode());
        assertEquals("OVERLOADED", ex.getErrorCode());
        assertTrue(ex.getMessage().startsWith("Sink error: 503"));
    }

    @Test
    void redirectIsNotSuccess() {
        SinkClient client = SinkClient.builder()
                .endpoint(ENDPOINT)
                .transport(new RecordingTransport(new SinkResponse(302, "")))
                .build();

        SinkException ex = assertThrows(SinkException.class,
                () -> client.deliver(TelemetryRecord.of("{}", "c")));
        assertEquals(302, ex.getStatusCode());
        assertNull(ex.getErrorCode());
    }

    @Test
    void transportFailureIsWrapped() {
        SinkTransport failing = request -> {
            throw new IOException("connection refused");
        };
        SinkClient client = SinkClient.builder().endpoint(ENDPOINT).transport(failing).build();

        SinkException ex = assertThrows(SinkException.class,
                () -> client.deliver(TelemetryRecord.of("{}", "c")));
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void tokenProviderIsAskedOnEveryRequest() {
        RecordingTransport transport = new RecordingTransport(
                new SinkResponse(200, ""), new SinkResponse(200, ""));
        Deque<String> tokens = new ArrayDeque<>(List.of("t1", "t2"));
        SinkClient client = SinkClient.builder()
                .endpoint(ENDPOINT)
                .tokenProvider(tokens::poll)
                .transport(transport)
                .build();

        client.deliver(TelemetryRecord.of("{}", "a"));
        client.deliver(TelemetryRecord.of("{}", "b"));

        assertEquals("Bearer t1", transport.requests.get(0).getHeaders().get("Authorization"));
        assertEquals("Bearer t2", transport.requests.get(1).getHeaders().get("Authorization"));
    }

    @Test
    void builderValidatesEndpoint() {
        assertThrows(RelayConfigurationException.class, () -> SinkClient.builder().build());
        assertThrows(RelayConfigurationException.class,
                () -> SinkClient.builder().endpoint("not a url").build());
        assertThrows(RelayConfigurationException.class,
                () -> SinkClient.builder().endpoint("/relative/path").build());
    }

    private static final class RecordingTransport implements SinkTransport {
        private final Deque<SinkResponse> responses;
        private final List<SinkRequest> requests = new ArrayList<>();

        private RecordingTransport(SinkResponse... responses) {
            this.responses = new ArrayDeque<>(List.of(responses));
        }

        @Override
        public SinkResponse send(SinkRequest request) {
            requests.add(request);
            SinkResponse next = responses.poll();
            if (next == null) {
                throw new IllegalStateException("No more responses");
            }
            return next;
        }
    }
}
