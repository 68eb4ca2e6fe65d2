package com.telemetryrelay.sdk.client.transport;

public final class SinkResponse {
    private final int statusCode;
    private final String body;

    public SinkResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
