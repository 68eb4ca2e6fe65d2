package com.telemetryrelay.sdk.client.transport;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

public final class JdkHttpTransport implements SinkTransport {
    private final HttpClient httpClient;

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public SinkResponse send(SinkRequest request) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.getUri())
                .timeout(request.getTimeout());
        request.getHeaders().forEach(builder::header);
        byte[] body = request.getBody() != null ? request.getBody() : new byte[0];
        builder.POST(HttpRequest.BodyPublishers.ofByteArray(body));

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        return new SinkResponse(response.statusCode(), response.body());
    }
}
