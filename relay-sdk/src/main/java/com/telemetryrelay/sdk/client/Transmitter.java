package com.telemetryrelay.sdk.client;

import com.telemetryrelay.sdk.breaker.CircuitBreaker;
import com.telemetryrelay.sdk.exception.RelayConfigurationException;
import com.telemetryrelay.sdk.model.BufferEntry;
import com.telemetryrelay.sdk.model.TelemetryRecord;
import com.telemetryrelay.sdk.util.RelayFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Transmitter - breaker-gated, time-bounded delivery of single records
 *
 * <p>{@link #trySend} is the only path to the sink. It asks the circuit breaker
 * first and returns {@code false} without any I/O when the breaker rejects the
 * call. Otherwise the sink call runs on a sink thread and the caller waits at
 * most the send timeout; the outcome is recorded back into the breaker.</p>
 *
 * <p>A timed out call is cancelled (interrupting the sink thread) and counts as
 * a failure even if the sink later completes it, so a record may be delivered
 * twice. Delivery is at-least-once.</p>
 */
public class Transmitter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Transmitter.class);

    private final TelemetrySink sink;
    private final CircuitBreaker circuitBreaker;
    private final long sendTimeoutMs;
    private final ExecutorService sinkExecutor;
    private final boolean ownsExecutor;

    private final AtomicLong recordsSent = new AtomicLong(0);
    private final AtomicLong sendFailures = new AtomicLong(0);
    private final AtomicLong callsRejected = new AtomicLong(0);
    private final AtomicReference<String> lastError = new AtomicReference<>();

    private Transmitter(Builder builder) {
        this.sink = builder.sink;
        this.circuitBreaker = builder.circuitBreaker;
        this.sendTimeoutMs = builder.sendTimeout.toMillis();
        this.ownsExecutor = builder.sinkExecutor == null;
        this.sinkExecutor = builder.sinkExecutor != null
                ? builder.sinkExecutor
                : Executors.newCachedThreadPool(new ThreadFactory() {
                    private final AtomicInteger idx = new AtomicInteger(0);
                    @Override public Thread newThread(Runnable r) {
                        Thread t = new Thread(r, "relay-sink-" + idx.getAndIncrement());
                        t.setDaemon(true);
                        return t;
                    }
                });
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Attempt one delivery.
     *
     * @return true if the sink accepted the record; false if the breaker rejected
     *         the call, the sink failed, or the call timed out
     */
    public boolean trySend(TelemetryRecord record) {
        if (!circuitBreaker.isAvailable()) {
            callsRejected.incrementAndGet();
            log.trace("Circuit open - not sending correlationId={}", record.getCorrelationId());
            return false;
        }

        Future<?> call;
        try {
            call = sinkExecutor.submit(() -> {
                sink.deliver(record);
                return null;
            });
        } catch (RejectedExecutionException e) {
            onFailure(record, "sink executor rejected the call");
            return false;
        }

        try {
            call.get(sendTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            onFailure(record, "timed out after " + sendTimeoutMs + "ms");
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            onFailure(record, cause.getMessage() + " (cause: " + RelayFiles.getRootCauseMessage(cause) + ")");
            return false;
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            onFailure(record, "interrupted while waiting for sink");
            return false;
        }

        circuitBreaker.recordSuccess();
        recordsSent.incrementAndGet();
        log.trace("Record sent: correlationId={}", record.getCorrelationId());
        return true;
    }

    /**
     * Send entries in order, stopping at the first failure.
     *
     * @return sequences of the entries the sink accepted, a prefix of {@code entries}
     */
    public List<Long> sendBatch(List<BufferEntry> entries) {
        List<Long> delivered = new ArrayList<>(entries.size());
        for (BufferEntry entry : entries) {
            if (!trySend(entry.getRecord())) {
                break;
            }
            delivered.add(entry.getSequence());
        }
        return delivered;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Duration getSendTimeout() {
        return Duration.ofMillis(sendTimeoutMs);
    }

    public long getRecordsSent() {
        return recordsSent.get();
    }

    public long getSendFailures() {
        return sendFailures.get();
    }

    public long getCallsRejected() {
        return callsRejected.get();
    }

    /**
     * Description of the most recent failure, or null if none has happened
     */
    public String getLastError() {
        return lastError.get();
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            sinkExecutor.shutdownNow();
        }
    }

    // ========================================================================
    // Internal
    // ========================================================================

    private void onFailure(TelemetryRecord record, String error) {
        circuitBreaker.recordFailure();
        sendFailures.incrementAndGet();
        lastError.set(error);
        log.warn("Failed to send record: correlationId={}, error={}", record.getCorrelationId(), error);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private TelemetrySink sink;
        private CircuitBreaker circuitBreaker;
        private Duration sendTimeout = Duration.ofSeconds(5);
        private ExecutorService sinkExecutor;

        /**
         * Destination for records (required)
         */
        public Builder sink(TelemetrySink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * Breaker consulted before, and informed after, every call (required)
         */
        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        /**
         * Hard bound on a single sink call (default: 5 seconds)
         */
        public Builder sendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
            return this;
        }

        /**
         * Provide the executor sink calls run on (advanced usage/testing)
         */
        public Builder sinkExecutor(ExecutorService sinkExecutor) {
            this.sinkExecutor = sinkExecutor;
            return this;
        }

        public Transmitter build() {
            if (sink == null) {
                throw new RelayConfigurationException("sink is required");
            }
            if (circuitBreaker == null) {
                throw new RelayConfigurationException("circuitBreaker is required");
            }
            if (sendTimeout == null || sendTimeout.isNegative() || sendTimeout.isZero()) {
                throw new RelayConfigurationException("sendTimeout must be positive, got: " + sendTimeout);
            }
            return new Transmitter(this);
        }
    }
}
