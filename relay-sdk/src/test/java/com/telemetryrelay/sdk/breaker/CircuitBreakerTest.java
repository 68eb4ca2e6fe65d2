package com.telemetryrelay.sdk.breaker;

import com.telemetryrelay.sdk.MutableClock;
import com.telemetryrelay.sdk.exception.RelayConfigurationException;
import com.telemetryrelay.sdk.model.CircuitBreakerState;
import com.telemetryrelay.sdk.model.CircuitState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private final MutableClock clock = new MutableClock();

    private CircuitBreaker breaker(int threshold, Duration resetTimeout) {
        return CircuitBreaker.builder()
                .failureThreshold(threshold)
                .resetTimeout(resetTimeout)
                .clock(clock)
                .build();
    }

    @Test
    void startsClosedAndAvailable() {
        CircuitBreaker breaker = breaker(5, Duration.ofSeconds(60));

        assertEquals(CircuitState.CLOSED, breaker.currentState());
        assertTrue(breaker.isAvailable());
        assertEquals(0, breaker.getFailureCount());
    }

    @Test
    void opensAfterExactlyThresholdConsecutiveFailures() {
        CircuitBreaker breaker = breaker(5, Duration.ofSeconds(60));

        for (int i = 0; i < 4; i++) {
            breaker.recordFailure();
        }
        assertEquals(CircuitState.CLOSED, breaker.currentState());
        assertTrue(breaker.isAvailable());

        breaker.recordFailure();
        assertEquals(CircuitState.OPEN, breaker.currentState());
        assertFalse(breaker.isAvailable());
        assertEquals(5, breaker.getFailureCount());
    }

    @Test
    void successInClosedResetsFailureCount() {
        CircuitBreaker breaker = breaker(3, Duration.ofSeconds(60));

        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(CircuitState.CLOSED, breaker.currentState());
        assertEquals(2, breaker.getFailureCount());
    }

    @Test
    void admitsExactlyOneTrialAfterResetTimeout() {
        CircuitBreaker breaker = breaker(1, Duration.ofSeconds(60));
        breaker.recordFailure();

        clock.advance(Duration.ofSeconds(59));
        assertFalse(breaker.isAvailable());
        assertEquals(CircuitState.OPEN, breaker.currentState());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(CircuitState.HALF_OPEN, breaker.currentState());
        assertTrue(breaker.isAvailable(), "first caller gets the trial permit");
        assertFalse(breaker.isAvailable(), "second caller is rejected while the trial is in flight");
    }

    @Test
    void successfulTrialClosesBreaker() {
        CircuitBreaker breaker = breaker(2, Duration.ofSeconds(10));
        breaker.recordFailure();
        breaker.recordFailure();
        clock.advance(Duration.ofSeconds(10));

        assertTrue(breaker.isAvailable());
        breaker.recordSuccess();

        assertEquals(CircuitState.CLOSED, breaker.currentState());
        assertEquals(0, breaker.getFailureCount());
        assertTrue(breaker.isAvailable());
    }

    @Test
    void failedTrialReopensWithFreshTimeout() {
        CircuitBreaker breaker = breaker(1, Duration.ofSeconds(10));
        breaker.recordFailure();
        clock.advance(Duration.ofSeconds(10));

        assertTrue(breaker.isAvailable());
        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.currentState());
        clock.advance(Duration.ofSeconds(9));
        assertEquals(CircuitState.OPEN, breaker.currentState());
        clock.advance(Duration.ofSeconds(1));
        assertEquals(CircuitState.HALF_OPEN, breaker.currentState());
    }

    @Test
    void lateSuccessWhileOpenIsIgnored() {
        CircuitBreaker breaker = breaker(1, Duration.ofSeconds(60));
        breaker.recordFailure();

        breaker.recordSuccess();

        assertEquals(CircuitState.OPEN, breaker.currentState());
    }

    @Test
    void rejectedCallsAreCounted() {
        CircuitBreaker breaker = breaker(1, Duration.ofSeconds(60));
        breaker.recordFailure();

        breaker.isAvailable();
        breaker.isAvailable();

        CircuitBreaker.Stats stats = breaker.getStats();
        assertEquals(2, stats.rejected);
        assertEquals(1, stats.failures);
    }

    @Test
    void listenersSeeEveryTransition() {
        CircuitBreaker breaker = breaker(1, Duration.ofSeconds(5));
        List<String> transitions = new CopyOnWriteArrayList<>();
        breaker.addListener((from, to) -> transitions.add(from + "->" + to));

        breaker.recordFailure();
        clock.advance(Duration.ofSeconds(5));
        breaker.isAvailable();
        breaker.recordSuccess();

        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
    }

    @Test
    void removedListenerIsNoLongerNotified() {
        CircuitBreaker breaker = breaker(1, Duration.ofSeconds(5));
        List<String> transitions = new CopyOnWriteArrayList<>();
        CircuitBreakerListener listener = (from, to) -> transitions.add(from + "->" + to);
        breaker.addListener(listener);

        breaker.recordFailure();
        breaker.removeListener(listener);
        breaker.reset();

        assertEquals(List.of("CLOSED->OPEN"), transitions);
    }

    @Test
    void throwingListenerDoesNotBreakTransition() {
        CircuitBreaker breaker = breaker(1, Duration.ofSeconds(5));
        breaker.addListener((from, to) -> {
            throw new IllegalStateException("boom");
        });

        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.currentState());
    }

    @Test
    void resetForcesClosed() {
        CircuitBreaker breaker = breaker(1, Duration.ofSeconds(60));
        breaker.recordFailure();

        breaker.reset();

        assertEquals(CircuitState.CLOSED, breaker.currentState());
        assertEquals(0, breaker.getFailureCount());
        assertTrue(breaker.isAvailable());
    }

    @Test
    void persistsTransitionsAndRestoresOpenState(@TempDir Path tempDir) {
        Path stateFile = tempDir.resolve("circuit-breaker.json");
        CircuitBreaker first = CircuitBreaker.builder()
                .failureThreshold(2)
                .resetTimeout(Duration.ofSeconds(60))
                .stateFile(stateFile)
                .clock(clock)
                .build();
        first.recordFailure();
        first.recordFailure();
        assertTrue(Files.exists(stateFile));

        clock.advance(Duration.ofSeconds(30));
        CircuitBreaker restarted = CircuitBreaker.builder()
                .failureThreshold(2)
                .resetTimeout(Duration.ofSeconds(60))
                .stateFile(stateFile)
                .clock(clock)
                .build();

        assertEquals(CircuitState.OPEN, restarted.currentState());
        assertEquals(2, restarted.getFailureCount());
        assertFalse(restarted.isAvailable());
    }

    @Test
    void persistedOpenStateThatCooledDownResumesHalfOpen(@TempDir Path tempDir) {
        Path stateFile = tempDir.resolve("circuit-breaker.json");
        long openedAt = clock.millis() - Duration.ofMinutes(5).toMillis();
        new CircuitStateStore(stateFile).save(
                new CircuitBreakerState(CircuitState.OPEN, 5, openedAt, openedAt));

        CircuitBreaker breaker = CircuitBreaker.builder()
                .resetTimeout(Duration.ofSeconds(60))
                .stateFile(stateFile)
                .clock(clock)
                .build();

        assertEquals(CircuitState.HALF_OPEN, breaker.currentState());
        assertTrue(breaker.isAvailable());
    }

    @Test
    void corruptStateFileStartsClosed(@TempDir Path tempDir) throws Exception {
        Path stateFile = tempDir.resolve("circuit-breaker.json");
        Files.writeString(stateFile, "{not json");

        CircuitBreaker breaker = CircuitBreaker.builder()
                .stateFile(stateFile)
                .clock(clock)
                .build();

        assertEquals(CircuitState.CLOSED, breaker.currentState());
        assertTrue(breaker.isAvailable());
    }

    @Test
    void builderRejectsInvalidSettings() {
        assertThrows(RelayConfigurationException.class,
                () -> CircuitBreaker.builder().failureThreshold(0).build());
        assertThrows(RelayConfigurationException.class,
                () -> CircuitBreaker.builder().resetTimeout(Duration.ZERO).build());
        assertThrows(RelayConfigurationException.class,
                () -> CircuitBreaker.builder().clock(null).build());
    }
}
