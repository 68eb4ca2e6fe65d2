package com.telemetryrelay.sdk.client.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

public final class SinkRequest {
    private final URI uri;
    private final byte[] body;
    private final Map<String, String> headers;
    private final Duration timeout;

    public SinkRequest(URI uri, byte[] body, Map<String, String> headers, Duration timeout) {
        this.uri = uri;
        this.body = body;
        this.headers = Map.copyOf(headers);
        this.timeout = timeout;
    }

    public URI getUri() {
        return uri;
    }

    /**
     * Always POST; records are only ever pushed
     */
    public String getMethod() {
        return "POST";
    }

    /**
     * Raw payload bytes, sent without re-encoding
     */
    public byte[] getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
