package com.telemetryrelay.sdk.client;

/**
 * Supplies the bearer token sent with every HTTP delivery
 *
 * <p>Called once per request, so implementations that fetch tokens remotely
 * should cache them.</p>
 */
@FunctionalInterface
public interface TokenProvider {

    /**
     * @return a bearer token without the "Bearer " prefix
     */
    String getToken();

    /**
     * Token provider for a fixed API key
     */
    static TokenProvider of(String token) {
        return new StaticTokenProvider(token);
    }
}
