package com.telemetryrelay.sdk.breaker;

import com.telemetryrelay.sdk.model.CircuitState;

/**
 * Observer notified after every circuit breaker transition.
 *
 * <p>Called on the thread that caused the transition, outside the breaker's
 * lock. Implementations must be quick and should not throw; exceptions are
 * logged and discarded.</p>
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    /**
     * @param from the state before the transition
     * @param to   the state after the transition
     */
    void onStateChange(CircuitState from, CircuitState to);
}
