package com.telemetryrelay.sdk.client.transport;

/**
 * HTTP plumbing behind {@link com.telemetryrelay.sdk.client.SinkClient}.
 *
 * <p>Implementations return the response for every status code and throw only
 * for network-level failures.</p>
 */
public interface SinkTransport {
    SinkResponse send(SinkRequest request) throws Exception;
}
