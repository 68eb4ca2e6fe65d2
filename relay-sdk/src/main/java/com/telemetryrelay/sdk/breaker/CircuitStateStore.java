package com.telemetryrelay.sdk.breaker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetryrelay.sdk.model.CircuitBreakerState;
import com.telemetryrelay.sdk.util.RelayFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes the circuit breaker state file.
 *
 * <p>Neither operation throws: a missing or unreadable file loads as empty (the
 * breaker then starts CLOSED) and a failed save is logged and ignored so the
 * breaker keeps working without persistence.</p>
 */
public class CircuitStateStore {

    private static final Logger log = LoggerFactory.getLogger(CircuitStateStore.class);

    private final Path stateFile;
    private final ObjectMapper objectMapper;

    public CircuitStateStore(Path stateFile) {
        this(stateFile, RelayFiles.newObjectMapper());
    }

    public CircuitStateStore(Path stateFile, ObjectMapper objectMapper) {
        if (stateFile == null) {
            throw new IllegalArgumentException("stateFile cannot be null");
        }
        this.stateFile = stateFile;
        this.objectMapper = objectMapper;
    }

    public Optional<CircuitBreakerState> load() {
        if (!Files.exists(stateFile)) {
            log.info("No persisted circuit breaker state at {}, starting fresh", stateFile);
            return Optional.empty();
        }
        try {
            CircuitBreakerState state = objectMapper.readValue(stateFile.toFile(), CircuitBreakerState.class);
            if (state == null || state.getState() == null || state.getFailureCount() < 0) {
                log.warn("Invalid circuit breaker state file {}, starting CLOSED", stateFile);
                return Optional.empty();
            }
            log.info("Loaded persisted circuit breaker state: {}, failures: {}",
                    state.getState(), state.getFailureCount());
            return Optional.of(state);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Corrupt circuit breaker state file {}, starting CLOSED: {}", stateFile, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(CircuitBreakerState state) {
        try {
            RelayFiles.writeAtomically(stateFile, objectMapper.writeValueAsBytes(state));
            log.debug("Circuit breaker state persisted: {}", state.getState());
        } catch (IOException e) {
            log.error("Failed to persist circuit breaker state to {}: {}", stateFile, e.getMessage());
        }
    }
}
