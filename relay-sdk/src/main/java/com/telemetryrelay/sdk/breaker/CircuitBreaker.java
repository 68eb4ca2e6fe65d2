package com.telemetryrelay.sdk.breaker;

import com.telemetryrelay.sdk.exception.RelayConfigurationException;
import com.telemetryrelay.sdk.model.CircuitBreakerState;
import com.telemetryrelay.sdk.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Circuit Breaker - gates calls to the sink after repeated failures
 *
 * <h2>States:</h2>
 * <ul>
 *   <li><b>CLOSED</b> - calls flow; consecutive failures are counted and the
 *       breaker opens when the count reaches the failure threshold</li>
 *   <li><b>OPEN</b> - every call is rejected without I/O until the reset timeout
 *       has elapsed since the breaker opened</li>
 *   <li><b>HALF_OPEN</b> - exactly one trial call is admitted. Success closes the
 *       breaker, failure reopens it and restarts the timeout</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * CircuitBreaker breaker = CircuitBreaker.builder()
 *     .failureThreshold(5)
 *     .resetTimeout(Duration.ofSeconds(60))
 *     .stateFile(Path.of("/var/lib/relay/circuit-breaker-state.json"))
 *     .build();
 *
 * if (breaker.isAvailable()) {
 *     try {
 *         sink.deliver(record);
 *         breaker.recordSuccess();
 *     } catch (Exception e) {
 *         breaker.recordFailure();
 *     }
 * }
 * }</pre>
 *
 * <p>Every transition is persisted when a state file is configured, so a restart
 * during an outage does not hammer the sink. No method throws.</p>
 *
 * <h2>Thread Safety:</h2>
 * <p>All state is guarded by the instance monitor. Listeners run after the
 * monitor is released.</p>
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final int failureThreshold;
    private final long resetTimeoutMs;
    private final Clock clock;
    private final CircuitStateStore stateStore;
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    // Guarded by this
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Long lastFailureTime;
    private long lastStateChangeTime;
    private boolean trialInFlight;

    // Statistics
    private final AtomicLong successes = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);
    private final AtomicLong rejected = new AtomicLong(0);

    private CircuitBreaker(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.resetTimeoutMs = builder.resetTimeout.toMillis();
        this.clock = builder.clock;
        this.stateStore = builder.stateStore != null
                ? builder.stateStore
                : (builder.stateFile != null ? new CircuitStateStore(builder.stateFile) : null);
        this.lastStateChangeTime = clock.millis();
        restore();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Ask whether a call may be attempted now.
     *
     * <p>In HALF_OPEN the first caller receives the single trial permit and every
     * other caller is rejected until that trial reports back.</p>
     */
    public boolean isAvailable() {
        Transition transition;
        boolean available;
        synchronized (this) {
            transition = advanceIfCoolDownElapsed();
            switch (state) {
                case CLOSED:
                    available = true;
                    break;
                case HALF_OPEN:
                    available = !trialInFlight;
                    trialInFlight = true;
                    break;
                default:
                    available = false;
                    break;
            }
        }
        if (!available) {
            rejected.incrementAndGet();
        }
        fire(transition);
        return available;
    }

    /**
     * Record a successful sink call
     */
    public void recordSuccess() {
        successes.incrementAndGet();
        Transition transition = null;
        synchronized (this) {
            switch (state) {
                case HALF_OPEN:
                    failureCount = 0;
                    transition = transitionTo(CircuitState.CLOSED);
                    break;
                case CLOSED:
                    failureCount = 0;
                    break;
                default:
                    // Late result of a call admitted before the breaker opened
                    log.debug("Ignoring success reported while OPEN");
                    break;
            }
        }
        fire(transition);
    }

    /**
     * Record a failed (or timed out) sink call
     */
    public void recordFailure() {
        failures.incrementAndGet();
        Transition transition = null;
        synchronized (this) {
            failureCount++;
            lastFailureTime = clock.millis();
            if (state == CircuitState.HALF_OPEN) {
                log.warn("Circuit breaker trial call failed - reopening for {}ms", resetTimeoutMs);
                transition = transitionTo(CircuitState.OPEN);
            } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
                log.warn("Circuit breaker OPENED - sink considered unavailable after {} consecutive failures",
                        failureCount);
                transition = transitionTo(CircuitState.OPEN);
            }
        }
        fire(transition);
    }

    /**
     * Current state, applying the OPEN to HALF_OPEN timeout if it has elapsed
     */
    public CircuitState currentState() {
        Transition transition;
        CircuitState current;
        synchronized (this) {
            transition = advanceIfCoolDownElapsed();
            current = state;
        }
        fire(transition);
        return current;
    }

    /**
     * Convenience for {@code currentState() == OPEN}
     */
    public boolean isOpen() {
        return currentState() == CircuitState.OPEN;
    }

    /**
     * Force the breaker CLOSED and clear the failure count (operator action)
     */
    public void reset() {
        Transition transition;
        synchronized (this) {
            failureCount = 0;
            lastFailureTime = null;
            transition = transitionTo(CircuitState.CLOSED);
            if (transition == null) {
                persist();
            }
        }
        log.info("Circuit breaker manually reset");
        fire(transition);
    }

    /**
     * Snapshot in the persisted document format
     */
    public synchronized CircuitBreakerState snapshot() {
        return new CircuitBreakerState(state, failureCount, lastFailureTime, lastStateChangeTime);
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getResetTimeout() {
        return Duration.ofMillis(resetTimeoutMs);
    }

    public Stats getStats() {
        return new Stats(successes.get(), failures.get(), rejected.get());
    }

    public void addListener(CircuitBreakerListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(CircuitBreakerListener listener) {
        listeners.remove(listener);
    }

    // ========================================================================
    // Internal - Transitions
    // ========================================================================

    private void restore() {
        if (stateStore == null) {
            return;
        }
        Optional<CircuitBreakerState> persisted = stateStore.load();
        if (persisted.isEmpty()) {
            return;
        }
        CircuitBreakerState loaded = persisted.get();
        synchronized (this) {
            state = loaded.getState();
            failureCount = loaded.getFailureCount();
            lastFailureTime = loaded.getLastFailureTime();
            lastStateChangeTime = loaded.getLastStateChangeTime();
            if (advanceIfCoolDownElapsed() != null) {
                log.info("Persisted OPEN state has cooled down, resuming in HALF_OPEN");
            }
        }
    }

    // Caller holds the monitor
    private Transition advanceIfCoolDownElapsed() {
        if (state == CircuitState.OPEN && clock.millis() - lastStateChangeTime >= resetTimeoutMs) {
            log.info("Circuit breaker HALF_OPEN - admitting one trial call");
            return transitionTo(CircuitState.HALF_OPEN);
        }
        return null;
    }

    // Caller holds the monitor
    private Transition transitionTo(CircuitState target) {
        CircuitState previous = state;
        if (previous == target) {
            return null;
        }
        state = target;
        lastStateChangeTime = clock.millis();
        trialInFlight = false;
        if (target == CircuitState.CLOSED) {
            log.info("Circuit breaker CLOSED - resuming normal operation");
        }
        persist();
        return new Transition(previous, target);
    }

    // Caller holds the monitor
    private void persist() {
        if (stateStore != null) {
            stateStore.save(new CircuitBreakerState(state, failureCount, lastFailureTime, lastStateChangeTime));
        }
    }

    private void fire(Transition transition) {
        if (transition == null) {
            return;
        }
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onStateChange(transition.from(), transition.to());
            } catch (Exception e) {
                log.warn("CircuitBreakerListener threw for {} -> {}: {}",
                        transition.from(), transition.to(), e.getMessage());
            }
        }
    }

    // ========================================================================
    // Supporting Classes
    // ========================================================================

    private record Transition(CircuitState from, CircuitState to) {
    }

    /**
     * Call statistics since construction
     */
    public static class Stats {
        public final long successes;
        public final long failures;
        public final long rejected;

        Stats(long successes, long failures, long rejected) {
            this.successes = successes;
            this.failures = failures;
            this.rejected = rejected;
        }

        @Override
        public String toString() {
            return String.format("Stats{successes=%d, failures=%d, rejected=%d}", successes, failures, rejected);
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(60);
        private Clock clock = Clock.systemUTC();
        private Path stateFile;
        private CircuitStateStore stateStore;

        /**
         * Consecutive failures that open the breaker (default: 5)
         */
        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        /**
         * Time spent OPEN before a trial call is admitted (default: 60s)
         */
        public Builder resetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
            return this;
        }

        /**
         * Persist transitions to this JSON file (default: not persisted)
         */
        public Builder stateFile(Path stateFile) {
            this.stateFile = stateFile;
            return this;
        }

        /**
         * Provide a custom state store (overrides stateFile)
         */
        public Builder stateStore(CircuitStateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        /**
         * Time source (default: system UTC clock)
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CircuitBreaker build() {
            if (failureThreshold < 1) {
                throw new RelayConfigurationException("failureThreshold must be >= 1, got: " + failureThreshold);
            }
            if (resetTimeout == null || resetTimeout.isNegative() || resetTimeout.isZero()) {
                throw new RelayConfigurationException("resetTimeout must be positive, got: " + resetTimeout);
            }
            if (clock == null) {
                throw new RelayConfigurationException("clock is required");
            }
            return new CircuitBreaker(this);
        }
    }
}
