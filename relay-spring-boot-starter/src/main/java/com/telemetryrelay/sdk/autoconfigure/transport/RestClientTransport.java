package com.telemetryrelay.sdk.autoconfigure.transport;

import com.telemetryrelay.sdk.client.transport.SinkRequest;
import com.telemetryrelay.sdk.client.transport.SinkResponse;
import com.telemetryrelay.sdk.client.transport.SinkTransport;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Delivers records through a Spring {@link RestClient}, so the application's
 * customized client (interceptors, TLS, observation) is reused.
 */
public final class RestClientTransport implements SinkTransport {
    private final RestClient restClient;

    public RestClientTransport(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public SinkResponse send(SinkRequest request) {
        try {
            RestClient.RequestBodySpec spec = restClient.method(HttpMethod.valueOf(request.getMethod()))
                    .uri(request.getUri());
            request.getHeaders().forEach(spec::header);
            if (request.getBody() != null) {
                spec.body(request.getBody());
            }
            var response = spec.retrieve().toEntity(String.class);
            return new SinkResponse(response.getStatusCode().value(), response.getBody());
        } catch (RestClientResponseException ex) {
            return new SinkResponse(ex.getStatusCode().value(), ex.getResponseBodyAsString());
        }
    }
}
