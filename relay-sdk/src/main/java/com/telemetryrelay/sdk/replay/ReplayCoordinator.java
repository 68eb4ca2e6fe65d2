package com.telemetryrelay.sdk.replay;

import com.telemetryrelay.sdk.breaker.CircuitBreaker;
import com.telemetryrelay.sdk.breaker.CircuitBreakerListener;
import com.telemetryrelay.sdk.buffer.DurableBuffer;
import com.telemetryrelay.sdk.client.Transmitter;
import com.telemetryrelay.sdk.exception.RelayConfigurationException;
import com.telemetryrelay.sdk.model.BufferEntry;
import com.telemetryrelay.sdk.model.CircuitState;
import com.telemetryrelay.sdk.model.ReplayStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Replay Coordinator - drains the buffer after an outage
 *
 * <p>A replay starts when the circuit breaker closes (this class is a
 * {@link CircuitBreakerListener}) or when the relay starts with records already
 * on disk. It walks the buffer oldest-first in batches, sending each record
 * through the {@link Transmitter} and acknowledging what was delivered after
 * every batch.</p>
 *
 * <h2>Rules:</h2>
 * <ul>
 *   <li>At most one replay runs at a time; a trigger during a replay is a no-op</li>
 *   <li>The breaker is checked before every record and the replay stops the
 *       moment it reads OPEN (status {@code interrupted})</li>
 *   <li>The first failed send ends the replay so records are never delivered
 *       out of order; the periodic drain cycle picks up from there</li>
 *   <li>A pause of {@code batchDelay} follows every full batch</li>
 * </ul>
 *
 * <p>Replays run on the executor passed to the builder, which for a relay is its
 * single sender thread.</p>
 */
public class ReplayCoordinator implements CircuitBreakerListener {

    private static final Logger log = LoggerFactory.getLogger(ReplayCoordinator.class);

    private final DurableBuffer buffer;
    private final Transmitter transmitter;
    private final CircuitBreaker circuitBreaker;
    private final Executor executor;
    private final int batchSize;
    private final long batchDelayMs;
    private final Clock clock;

    private final AtomicBoolean replaying = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicLong replayedTotal = new AtomicLong(0);

    // Status of the current or most recent run
    private final AtomicLong processed = new AtomicLong(0);
    private final AtomicLong errors = new AtomicLong(0);
    private volatile boolean interrupted;
    private volatile Instant started;
    private volatile Instant completed;

    private ReplayCoordinator(Builder builder) {
        this.buffer = builder.buffer;
        this.transmitter = builder.transmitter;
        this.circuitBreaker = builder.circuitBreaker != null
                ? builder.circuitBreaker
                : builder.transmitter.getCircuitBreaker();
        this.executor = builder.executor;
        this.batchSize = builder.batchSize;
        this.batchDelayMs = builder.batchDelay.toMillis();
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Public API
    // ========================================================================

    @Override
    public void onStateChange(CircuitState from, CircuitState to) {
        if (to == CircuitState.CLOSED) {
            trigger("circuit closed");
        }
    }

    /**
     * Start a replay on the executor unless one is already running.
     *
     * @param reason free text for the log
     * @return true if a replay was scheduled
     */
    public boolean trigger(String reason) {
        if (cancelled.get()) {
            return false;
        }
        if (!replaying.compareAndSet(false, true)) {
            log.debug("Replay already in progress - ignoring trigger ({})", reason);
            return false;
        }
        try {
            executor.execute(() -> runReplay(reason));
            return true;
        } catch (RejectedExecutionException e) {
            replaying.set(false);
            log.warn("Could not schedule replay ({}): {}", reason, e.getMessage());
            return false;
        }
    }

    /**
     * Stop any running replay at the next record and refuse new triggers
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isReplaying() {
        return replaying.get();
    }

    public ReplayStatus getStatus() {
        return new ReplayStatus(replaying.get(), processed.get(), errors.get(), interrupted, started, completed);
    }

    /**
     * Records delivered by all replays since construction
     */
    public long getReplayedTotal() {
        return replayedTotal.get();
    }

    // ========================================================================
    // Internal - Replay Loop
    // ========================================================================

    private void runReplay(String reason) {
        try {
            if (buffer.isEmpty()) {
                log.debug("Replay ({}) found an empty buffer", reason);
                return;
            }
            processed.set(0);
            errors.set(0);
            interrupted = false;
            started = clock.instant();
            completed = null;
            log.info("Replay started ({}) - {} record(s) buffered", reason, buffer.count());

            replayBatches();

            log.info("Replay finished - processed: {}, errors: {}, interrupted: {}, remaining: {}",
                    processed.get(), errors.get(), interrupted, buffer.count());
        } catch (RuntimeException e) {
            log.error("Unexpected error during replay", e);
        } finally {
            if (started != null && completed == null) {
                completed = clock.instant();
            }
            replaying.set(false);
        }
    }

    private void replayBatches() {
        while (true) {
            if (shouldAbort()) {
                return;
            }
            List<BufferEntry> batch = buffer.drain(batchSize);
            if (batch.isEmpty()) {
                return;
            }

            List<Long> delivered = new ArrayList<>(batch.size());
            boolean stop = false;
            for (BufferEntry entry : batch) {
                if (shouldAbort()) {
                    stop = true;
                    break;
                }
                if (transmitter.trySend(entry.getRecord())) {
                    delivered.add(entry.getSequence());
                    processed.incrementAndGet();
                    replayedTotal.incrementAndGet();
                } else {
                    errors.incrementAndGet();
                    stop = true;
                    break;
                }
            }
            buffer.acknowledge(delivered);

            if (stop) {
                return;
            }
            if (batch.size() == batchSize && !pause()) {
                return;
            }
        }
    }

    private boolean shouldAbort() {
        if (cancelled.get()) {
            log.info("Replay cancelled - relay shutting down");
            interrupted = true;
            return true;
        }
        if (circuitBreaker.currentState() == CircuitState.OPEN) {
            log.warn("Replay interrupted - circuit breaker is OPEN");
            interrupted = true;
            return true;
        }
        return false;
    }

    private boolean pause() {
        if (batchDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(batchDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = true;
            return false;
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private DurableBuffer buffer;
        private Transmitter transmitter;
        private CircuitBreaker circuitBreaker;
        private Executor executor;
        private int batchSize = 100;
        private Duration batchDelay = Duration.ofMillis(100);
        private Clock clock = Clock.systemUTC();

        /**
         * Buffer to replay from (required)
         */
        public Builder buffer(DurableBuffer buffer) {
            this.buffer = buffer;
            return this;
        }

        /**
         * Transmitter used for every send (required)
         */
        public Builder transmitter(Transmitter transmitter) {
            this.transmitter = transmitter;
            return this;
        }

        /**
         * Breaker checked before each record (default: the transmitter's breaker)
         */
        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        /**
         * Executor replays run on (required)
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Records fetched per batch (default: 100)
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Pause after each full batch (default: 100ms)
         */
        public Builder batchDelay(Duration batchDelay) {
            this.batchDelay = batchDelay;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ReplayCoordinator build() {
            if (buffer == null) {
                throw new RelayConfigurationException("buffer is required");
            }
            if (transmitter == null) {
                throw new RelayConfigurationException("transmitter is required");
            }
            if (executor == null) {
                throw new RelayConfigurationException("executor is required");
            }
            if (batchSize < 1) {
                throw new RelayConfigurationException("batchSize must be >= 1, got: " + batchSize);
            }
            if (batchDelay == null || batchDelay.isNegative()) {
                throw new RelayConfigurationException("batchDelay must be >= 0, got: " + batchDelay);
            }
            if (clock == null) {
                throw new RelayConfigurationException("clock is required");
            }
            return new ReplayCoordinator(this);
        }
    }
}
