package com.telemetryrelay.sdk.client;

/**
 * Fixed API key, as configured for the listener
 *
 * <pre>{@code
 * SinkClient sink = SinkClient.builder()
 *     .endpoint("https://listener.internal:8443/ingest/php")
 *     .tokenProvider(TokenProvider.of(System.getenv("LISTENER_API_KEY")))
 *     .build();
 * }</pre>
 */
public class StaticTokenProvider implements TokenProvider {

    private final String token;

    public StaticTokenProvider(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token cannot be null or blank");
        }
        this.token = token;
    }

    @Override
    public String getToken() {
        return token;
    }
}
