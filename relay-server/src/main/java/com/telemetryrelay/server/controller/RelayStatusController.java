package com.telemetryrelay.server.controller;

import com.telemetryrelay.sdk.client.TelemetryRelay;
import com.telemetryrelay.sdk.model.RelayStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class RelayStatusController {

    private static final Logger log = LoggerFactory.getLogger(RelayStatusController.class);

    private final TelemetryRelay relay;

    public RelayStatusController(TelemetryRelay relay) {
        this.relay = relay;
    }

    @GetMapping("/status")
    public RelayStatus status() {
        return relay.status();
    }

    /**
     * Operator override: close the breaker now instead of waiting for the
     * reset timeout. Closing triggers a replay of any disk backlog.
     */
    @PostMapping("/circuit-breaker/reset")
    public RelayStatus resetCircuitBreaker() {
        log.info("Circuit breaker reset requested by operator");
        relay.getCircuitBreaker().reset();
        return relay.status();
    }
}
