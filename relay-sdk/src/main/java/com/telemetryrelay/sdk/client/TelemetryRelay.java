package com.telemetryrelay.sdk.client;

import com.telemetryrelay.sdk.breaker.CircuitBreaker;
import com.telemetryrelay.sdk.buffer.DurableBuffer;
import com.telemetryrelay.sdk.exception.RelayConfigurationException;
import com.telemetryrelay.sdk.model.BufferEntry;
import com.telemetryrelay.sdk.model.BufferStats;
import com.telemetryrelay.sdk.model.CircuitState;
import com.telemetryrelay.sdk.model.RelayStatus;
import com.telemetryrelay.sdk.model.TelemetryRecord;
import com.telemetryrelay.sdk.replay.ReplayCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Telemetry Relay - fire-and-forget forwarding with a durable buffer
 *
 * <p>This is the entry point producers use. Records are appended to a
 * {@link DurableBuffer} and delivered in the background through a
 * {@link Transmitter}; the producer never waits for the sink.</p>
 *
 * <h2>Features:</h2>
 * <ul>
 *   <li><b>Fire-and-forget</b> - {@code enqueue()} returns immediately, even while the sink is down</li>
 *   <li><b>Circuit breaker</b> - stops calling the sink after repeated failures, survives restarts</li>
 *   <li><b>Disk overflow</b> - the memory tier spills to segment files, bounded by a byte ceiling</li>
 *   <li><b>Replay</b> - the backlog is drained oldest-first once the sink recovers</li>
 *   <li><b>Graceful shutdown</b> - the memory tier is written to disk on JVM shutdown</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * TelemetryRelay relay = TelemetryRelay.builder()
 *     .sink(SinkClient.builder().endpoint("https://listener.internal/ingest").build())
 *     .bufferPath(Path.of("/var/lib/relay/buffer"))
 *     .stateFile(Path.of("/var/lib/relay/circuit-breaker.json"))
 *     .build();
 *
 * relay.enqueue(rawJson, correlationId);  // returns immediately
 * }</pre>
 *
 * <h2>Threading:</h2>
 * <p>Every send happens on one sender thread: the periodic drain cycle, the
 * eager drain after an enqueue, and replays. Sends are therefore never
 * concurrent and leave the buffer in FIFO order. Sink calls themselves run on
 * the transmitter's sink threads so they can be abandoned on timeout.</p>
 */
public class TelemetryRelay implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TelemetryRelay.class);

    private final CircuitBreaker circuitBreaker;
    private final DurableBuffer buffer;
    private final Transmitter transmitter;
    private final ReplayCoordinator replayCoordinator;
    private final RecordLossCallback lossCallback;
    private final ScheduledExecutorService senderExecutor;
    private final Clock clock;
    private final Instant startedAt;

    // Configuration
    private final int batchSize;
    private final long flushIntervalMs;
    private final long shutdownGraceMs;
    private final int eagerDrainThreshold;

    // Metrics
    private final AtomicLong recordsEnqueued = new AtomicLong(0);
    private final AtomicLong recordsRejected = new AtomicLong(0);

    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);

    // Shutdown handling
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private ScheduledFuture<?> drainTask;
    private Thread shutdownHook;

    private TelemetryRelay(Builder builder) {
        this(builder, true);
    }

    protected TelemetryRelay(Builder builder, boolean startBackground) {
        this.clock = builder.clock;
        this.startedAt = clock.instant();
        this.lossCallback = builder.lossCallback != null ? builder.lossCallback : LoggingRecordLossCallback.INSTANCE;
        this.batchSize = builder.batchSize;
        this.flushIntervalMs = builder.flushInterval.toMillis();
        this.shutdownGraceMs = builder.shutdownGrace.toMillis();
        this.eagerDrainThreshold = builder.eagerDrainThreshold;

        if (builder.transmitter != null) {
            this.transmitter = builder.transmitter;
            this.circuitBreaker = builder.transmitter.getCircuitBreaker();
        } else {
            this.circuitBreaker = builder.circuitBreaker != null
                    ? builder.circuitBreaker
                    : CircuitBreaker.builder()
                        .failureThreshold(builder.failureThreshold)
                        .resetTimeout(builder.resetTimeout)
                        .stateFile(builder.stateFile)
                        .clock(clock)
                        .build();
            this.transmitter = Transmitter.builder()
                    .sink(builder.sink)
                    .circuitBreaker(circuitBreaker)
                    .sendTimeout(builder.sendTimeout)
                    .build();
        }

        this.buffer = builder.buffer != null
                ? builder.buffer
                : DurableBuffer.builder()
                    .directory(builder.bufferPath)
                    .memoryCapacity(builder.memoryCapacity)
                    .capacityBytes(builder.capacityBytes)
                    .onRecordLoss(lossCallback)
                    .build();

        this.senderExecutor = builder.senderExecutor != null
                ? builder.senderExecutor
                : Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "relay-sender");
                    t.setDaemon(true);
                    return t;
                });

        this.replayCoordinator = ReplayCoordinator.builder()
                .buffer(buffer)
                .transmitter(transmitter)
                .executor(senderExecutor)
                .batchSize(builder.batchSize)
                .batchDelay(builder.replayBatchDelay)
                .clock(clock)
                .build();
        circuitBreaker.addListener(replayCoordinator);

        if (startBackground) {
            this.drainTask = senderExecutor.scheduleWithFixedDelay(this::drainCycle,
                    flushIntervalMs, flushIntervalMs, TimeUnit.MILLISECONDS);
        }

        // Register shutdown hook
        if (startBackground && builder.registerShutdownHook) {
            this.shutdownHook = new Thread(this::shutdownGracefully, "relay-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        }

        if (startBackground) {
            log.info("TelemetryRelay started - buffer: {}, memory capacity: {}, flush interval: {}ms, circuit: {}",
                    buffer.getDirectory(), buffer.getMemoryCapacity(), flushIntervalMs,
                    circuitBreaker.currentState());
            if (buffer.hasDiskBacklog()) {
                replayCoordinator.trigger("startup backlog");
            }
        }
    }

    /**
     * Create a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Buffer a record for delivery (fire-and-forget)
     *
     * <p>This method returns immediately. It never calls the sink and never
     * throws; the only I/O it may perform is a tier flush to disk.</p>
     *
     * @param record The record to buffer
     * @return true if buffered, false if rejected
     */
    public boolean enqueue(TelemetryRecord record) {
        if (record == null) {
            log.warn("Ignoring null record");
            recordsRejected.incrementAndGet();
            return false;
        }
        if (shutdownRequested.get()) {
            notifyRecordLoss(record, "shutdown_in_progress");
            recordsRejected.incrementAndGet();
            return false;
        }

        // The buffer refuses appends once the shutdown flush has run
        if (!buffer.enqueue(record)) {
            notifyRecordLoss(record, "shutdown_in_progress");
            recordsRejected.incrementAndGet();
            return false;
        }
        recordsEnqueued.incrementAndGet();
        maybeDrainEagerly();
        return true;
    }

    /**
     * Buffer a raw payload exactly as the producer serialized it
     */
    public boolean enqueue(byte[] payload, String correlationId) {
        if (payload == null) {
            return enqueue((TelemetryRecord) null);
        }
        return enqueue(TelemetryRecord.of(payload, correlationId));
    }

    /**
     * Buffer a JSON document (stored as UTF-8 bytes)
     */
    public boolean enqueue(String json, String correlationId) {
        if (json == null) {
            return enqueue((TelemetryRecord) null);
        }
        return enqueue(TelemetryRecord.of(json, correlationId));
    }

    /**
     * Get current buffer depth across both tiers
     */
    public long getBufferDepth() {
        return buffer.count();
    }

    /**
     * Check if circuit breaker is open (sink considered unavailable)
     */
    public boolean isCircuitOpen() {
        return circuitBreaker.isOpen();
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public DurableBuffer getBuffer() {
        return buffer;
    }

    public ReplayCoordinator getReplayCoordinator() {
        return replayCoordinator;
    }

    /**
     * Get relay metrics
     */
    public Metrics getMetrics() {
        BufferStats stats = buffer.stats();
        return new Metrics(
                recordsEnqueued.get(),
                transmitter.getRecordsSent(),
                transmitter.getSendFailures(),
                stats.getDroppedTotal() + recordsRejected.get(),
                stats.getEvictedTotal(),
                replayCoordinator.getReplayedTotal(),
                stats.getTotalCount(),
                stats.getTotalBytes(),
                circuitBreaker.isOpen()
        );
    }

    /**
     * Health document for this relay
     */
    public RelayStatus status() {
        Instant now = clock.instant();
        return new RelayStatus(
                now,
                Duration.between(startedAt, now).getSeconds(),
                circuitBreaker.currentState(),
                circuitBreaker.getFailureCount(),
                buffer.stats(),
                replayCoordinator.getStatus(),
                transmitter.getLastError());
    }

    /**
     * Ask the sender to drain now and wait until the buffer is empty
     *
     * @param timeoutMs Maximum time to wait in milliseconds
     * @return true if the buffer emptied, false if timeout
     */
    public boolean flush(long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        scheduleDrain();

        while (!buffer.isEmpty() && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            scheduleDrain();
        }

        return buffer.isEmpty();
    }

    /**
     * Shutdown the relay gracefully, writing the memory tier to disk
     */
    public void shutdown() {
        shutdownGracefully();
    }

    @Override
    public void close() {
        shutdown();
    }

    // ========================================================================
    // Internal - Drain Cycle
    // ========================================================================

    private void maybeDrainEagerly() {
        if (buffer.hasDiskBacklog() || buffer.count() > eagerDrainThreshold) {
            return;
        }
        if (replayCoordinator.isReplaying() || circuitBreaker.isOpen()) {
            return;
        }
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (shutdownRequested.get() || !drainScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            senderExecutor.execute(this::drainCycle);
        } catch (RejectedExecutionException e) {
            drainScheduled.set(false);
            log.debug("Sender rejected drain request: {}", e.getMessage());
        }
    }

    /**
     * Send batches oldest-first until the buffer is empty, a send fails, or a
     * replay takes over. Runs on the sender thread only.
     */
    void drainCycle() {
        drainScheduled.set(false);
        try {
            while (!shutdownRequested.get()) {
                if (replayCoordinator.isReplaying()) {
                    return;
                }
                if (circuitBreaker.currentState() == CircuitState.OPEN) {
                    return;
                }
                List<BufferEntry> batch = buffer.drain(batchSize);
                if (batch.isEmpty()) {
                    return;
                }
                List<Long> delivered = transmitter.sendBatch(batch);
                buffer.acknowledge(delivered);
                if (delivered.size() < batch.size()) {
                    return;
                }
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error in drain cycle", e);
        }
    }

    private void notifyRecordLoss(TelemetryRecord record, String reason) {
        try {
            lossCallback.onRecordLoss(record, reason);
        } catch (Exception e) {
            log.warn("RecordLossCallback threw for reason={}: {}", reason, e.getMessage());
        }
    }

    // ========================================================================
    // Internal - Shutdown
    // ========================================================================

    private void shutdownGracefully() {
        if (!shutdownRequested.compareAndSet(false, true)) {
            return; // Already shutting down
        }

        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // JVM is already shutting down; the hook is the caller
            }
        }

        log.info("TelemetryRelay shutting down - {} record(s) buffered", buffer.count());

        circuitBreaker.removeListener(replayCoordinator);
        replayCoordinator.cancel();
        if (drainTask != null) {
            drainTask.cancel(false);
        }

        // Let the in-flight cycle or replay finish within the grace period
        senderExecutor.shutdown();
        try {
            if (!senderExecutor.awaitTermination(shutdownGraceMs, TimeUnit.MILLISECONDS)) {
                log.warn("Sender did not stop within {}ms - abandoning in-flight sends", shutdownGraceMs);
                senderExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            senderExecutor.shutdownNow();
        }

        int flushed = buffer.flushAndClose();
        transmitter.close();

        log.info("TelemetryRelay shutdown complete - sent: {}, failed: {}, flushed to disk: {}, retained: {}",
                transmitter.getRecordsSent(), transmitter.getSendFailures(), flushed, buffer.count());
    }

    // ========================================================================
    // Supporting Classes
    // ========================================================================

    /**
     * Metrics snapshot
     */
    public static class Metrics {
        public final long recordsEnqueued;
        public final long recordsSent;
        public final long recordsFailed;
        public final long recordsDropped;
        public final long recordsEvicted;
        public final long recordsReplayed;
        public final long bufferDepth;
        public final long bufferBytes;
        public final boolean circuitOpen;

        Metrics(long recordsEnqueued, long recordsSent, long recordsFailed, long recordsDropped,
                long recordsEvicted, long recordsReplayed, long bufferDepth, long bufferBytes,
                boolean circuitOpen) {
            this.recordsEnqueued = recordsEnqueued;
            this.recordsSent = recordsSent;
            this.recordsFailed = recordsFailed;
            this.recordsDropped = recordsDropped;
            this.recordsEvicted = recordsEvicted;
            this.recordsReplayed = recordsReplayed;
            this.bufferDepth = bufferDepth;
            this.bufferBytes = bufferBytes;
            this.circuitOpen = circuitOpen;
        }

        @Override
        public String toString() {
            return String.format("Metrics{enqueued=%d, sent=%d, failed=%d, dropped=%d, evicted=%d, replayed=%d, depth=%d, bytes=%d, circuitOpen=%s}",
                    recordsEnqueued, recordsSent, recordsFailed, recordsDropped, recordsEvicted,
                    recordsReplayed, bufferDepth, bufferBytes, circuitOpen);
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private TelemetrySink sink;
        private Transmitter transmitter;
        private CircuitBreaker circuitBreaker;
        private DurableBuffer buffer;
        private Path bufferPath;
        private Path stateFile;
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(60);
        private int memoryCapacity = 100;
        private long capacityBytes = 100L * 1024 * 1024;
        private Duration sendTimeout = Duration.ofSeconds(5);
        private int batchSize = 100;
        private Duration flushInterval = Duration.ofSeconds(5);
        private Duration replayBatchDelay = Duration.ofMillis(100);
        private Duration shutdownGrace = Duration.ofSeconds(30);
        private int eagerDrainThreshold = 10;
        private boolean registerShutdownHook = true;
        private ScheduledExecutorService senderExecutor;
        private RecordLossCallback lossCallback;
        private Clock clock = Clock.systemUTC();

        /**
         * Set the sink records are delivered to (required unless a transmitter is provided)
         */
        public Builder sink(TelemetrySink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * Provide a pre-built transmitter; its circuit breaker is used and the
         * sink, breaker and sendTimeout settings are ignored
         */
        public Builder transmitter(Transmitter transmitter) {
            this.transmitter = transmitter;
            return this;
        }

        /**
         * Provide a pre-built circuit breaker (overrides failureThreshold, resetTimeout and stateFile)
         */
        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        /**
         * Provide a pre-built buffer (overrides bufferPath, memoryCapacity and capacityBytes)
         */
        public Builder buffer(DurableBuffer buffer) {
            this.buffer = buffer;
            return this;
        }

        /**
         * Directory for buffer segment files (required unless a buffer is provided)
         */
        public Builder bufferPath(Path bufferPath) {
            this.bufferPath = bufferPath;
            return this;
        }

        /**
         * File the circuit breaker state is persisted to (default: not persisted)
         */
        public Builder stateFile(Path stateFile) {
            this.stateFile = stateFile;
            return this;
        }

        /**
         * Set consecutive failures before the circuit opens (default: 5)
         */
        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        /**
         * Set time the circuit stays open before a trial call (default: 60s)
         */
        public Builder resetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
            return this;
        }

        /**
         * Set records held in memory before a flush to disk (default: 100)
         */
        public Builder memoryCapacity(int memoryCapacity) {
            this.memoryCapacity = memoryCapacity;
            return this;
        }

        /**
         * Set the byte ceiling for memory plus disk (default: 100MB)
         */
        public Builder capacityBytes(long capacityBytes) {
            this.capacityBytes = capacityBytes;
            return this;
        }

        /**
         * Set the hard bound on one sink call (default: 5s)
         */
        public Builder sendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
            return this;
        }

        /**
         * Set the number of records per drain or replay batch (default: 100)
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Set the period of the background drain cycle (default: 5s)
         */
        public Builder flushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
            return this;
        }

        /**
         * Set the pause between full replay batches (default: 100ms)
         */
        public Builder replayBatchDelay(Duration replayBatchDelay) {
            this.replayBatchDelay = replayBatchDelay;
            return this;
        }

        /**
         * Set how long shutdown waits for in-flight sends (default: 30s)
         */
        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        /**
         * Drain immediately after an enqueue while at most this many records
         * are buffered and none are on disk (default: 10, 0 disables)
         */
        public Builder eagerDrainThreshold(int eagerDrainThreshold) {
            this.eagerDrainThreshold = eagerDrainThreshold;
            return this;
        }

        /**
         * Enable/disable automatic shutdown hook (default: true)
         */
        public Builder registerShutdownHook(boolean register) {
            this.registerShutdownHook = register;
            return this;
        }

        /**
         * Provide a custom sender executor (advanced usage/testing)
         */
        public Builder senderExecutor(ScheduledExecutorService senderExecutor) {
            this.senderExecutor = senderExecutor;
            return this;
        }

        /**
         * Set a callback invoked whenever a record is dropped.
         * Defaults to a SLF4J WARN logger if not set.
         */
        public Builder onRecordLoss(RecordLossCallback callback) {
            this.lossCallback = callback;
            return this;
        }

        /**
         * Time source (default: system UTC clock)
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        void validate() {
            if (sink == null && transmitter == null) {
                throw new RelayConfigurationException("sink is required");
            }
            if (bufferPath == null && buffer == null) {
                throw new RelayConfigurationException("bufferPath is required");
            }
            if (batchSize < 1) {
                throw new RelayConfigurationException("batchSize must be >= 1, got: " + batchSize);
            }
            if (flushInterval == null || flushInterval.isNegative() || flushInterval.isZero()) {
                throw new RelayConfigurationException("flushInterval must be positive, got: " + flushInterval);
            }
            if (replayBatchDelay == null || replayBatchDelay.isNegative()) {
                throw new RelayConfigurationException("replayBatchDelay must be >= 0, got: " + replayBatchDelay);
            }
            if (shutdownGrace == null || shutdownGrace.isNegative()) {
                throw new RelayConfigurationException("shutdownGrace must be >= 0, got: " + shutdownGrace);
            }
            if (eagerDrainThreshold < 0) {
                throw new RelayConfigurationException("eagerDrainThreshold must be >= 0, got: " + eagerDrainThreshold);
            }
            if (clock == null) {
                throw new RelayConfigurationException("clock is required");
            }
        }

        public TelemetryRelay build() {
            validate();
            return new TelemetryRelay(this);
        }
    }
}
