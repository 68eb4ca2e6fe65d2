package com.telemetryrelay.sdk.client;

import com.telemetryrelay.sdk.buffer.DurableBuffer;
import com.telemetryrelay.sdk.exception.RelayConfigurationException;
import com.telemetryrelay.sdk.exception.SinkException;
import com.telemetryrelay.sdk.model.CircuitState;
import com.telemetryrelay.sdk.model.RelayStatus;
import com.telemetryrelay.sdk.model.TelemetryRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.lang.reflect.Field;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryRelayTest {

    /**
     * Sink that records what it accepted and can be switched off
     */
    private static final class SwitchableSink implements TelemetrySink {
        final AtomicBoolean up = new AtomicBoolean(true);
        final List<String> delivered = new CopyOnWriteArrayList<>();

        @Override
        public void deliver(TelemetryRecord record) {
            if (!up.get()) {
                throw new SinkException("Sink error: 503 - down", 503, null);
            }
            delivered.add(record.getCorrelationId());
        }
    }

    private static TelemetryRelay.Builder relay(TelemetrySink sink, Path bufferPath) {
        return TelemetryRelay.builder()
                .sink(sink)
                .bufferPath(bufferPath)
                .registerShutdownHook(false)
                .shutdownGrace(Duration.ofSeconds(2));
    }

    @Test
    void enqueuedRecordIsDeliveredInBackground(@TempDir Path tempDir) throws Exception {
        SwitchableSink sink = new SwitchableSink();
        TelemetryRelay relay = relay(sink, tempDir).build();

        assertTrue(relay.enqueue("{\"duration_ms\":42}", "corr-1"));

        assertTrue(waitUntil(() -> sink.delivered.size() == 1, Duration.ofSeconds(2)));
        assertEquals("corr-1", sink.delivered.get(0));
        assertTrue(waitUntil(() -> relay.getBufferDepth() == 0, Duration.ofSeconds(2)));
        assertEquals(1, relay.getMetrics().recordsSent);
        relay.shutdown();
    }

    @Test
    void periodicDrainDeliversBacklogWhenEagerDrainIsDisabled(@TempDir Path tempDir) throws Exception {
        SwitchableSink sink = new SwitchableSink();
        TelemetryRelay relay = relay(sink, tempDir)
                .eagerDrainThreshold(0)
                .flushInterval(Duration.ofMillis(100))
                .build();

        for (int i = 0; i < 5; i++) {
            relay.enqueue("{}", "corr-" + i);
        }

        assertTrue(waitUntil(() -> sink.delivered.size() == 5, Duration.ofSeconds(3)));
        assertEquals(List.of("corr-0", "corr-1", "corr-2", "corr-3", "corr-4"), sink.delivered);
        relay.shutdown();
    }

    @Test
    void enqueueNeverWaitsForAHangingSink(@TempDir Path tempDir) {
        CountDownLatch release = new CountDownLatch(1);
        TelemetrySink hanging = record -> release.await(10, TimeUnit.SECONDS);
        TelemetryRelay relay = relay(hanging, tempDir)
                .sendTimeout(Duration.ofSeconds(5))
                .shutdownGrace(Duration.ofMillis(200))
                .build();

        List<Long> latenciesNs = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            long start = System.nanoTime();
            relay.enqueue("{}", "corr-" + i);
            latenciesNs.add(System.nanoTime() - start);
        }

        latenciesNs.sort(Long::compare);
        long medianMs = TimeUnit.NANOSECONDS.toMillis(latenciesNs.get(latenciesNs.size() / 2));
        assertTrue(medianMs < 5, "enqueue should not wait for the sink, median " + medianMs + "ms");
        assertEquals(50, relay.getBufferDepth());
        release.countDown();
        relay.shutdown();
    }

    @Test
    void outageBuffersToDiskAndRecoveryReplaysInOrder(@TempDir Path tempDir) throws Exception {
        SwitchableSink sink = new SwitchableSink();
        sink.up.set(false);
        TelemetryRelay relay = relay(sink, tempDir)
                .failureThreshold(1)
                .resetTimeout(Duration.ofMillis(300))
                .flushInterval(Duration.ofMillis(100))
                .replayBatchDelay(Duration.ZERO)
                .build();

        relay.enqueue("{}", "corr-0");
        assertTrue(waitUntil(relay::isCircuitOpen, Duration.ofSeconds(2)));
        for (int i = 1; i < 150; i++) {
            relay.enqueue("{}", "corr-" + i);
        }

        assertTrue(relay.getBuffer().hasDiskBacklog(), "memory tier overflowed to disk");
        assertEquals(RelayStatus.STATUS_DEGRADED, relay.status().getStatus());

        sink.up.set(true);

        assertTrue(waitUntil(() -> relay.getBufferDepth() == 0, Duration.ofSeconds(5)));
        assertEquals(150, sink.delivered.size());
        for (int i = 0; i < 150; i++) {
            assertEquals("corr-" + i, sink.delivered.get(i));
        }
        assertEquals(CircuitState.CLOSED, relay.getCircuitBreaker().currentState());
        assertEquals(RelayStatus.STATUS_OK, relay.status().getStatus());
        relay.shutdown();
    }

    @Test
    void shutdownFlushesMemoryTierAndNextRelayReplaysIt(@TempDir Path tempDir) throws Exception {
        SwitchableSink down = new SwitchableSink();
        down.up.set(false);
        TelemetryRelay first = relay(down, tempDir)
                .failureThreshold(1)
                .build();
        first.enqueue("{}", "corr-0");
        assertTrue(waitUntil(first::isCircuitOpen, Duration.ofSeconds(2)));
        first.enqueue("{}", "corr-1");
        first.enqueue("{}", "corr-2");

        first.shutdown();

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.count(), "memory tier written as one segment");
        }

        SwitchableSink up = new SwitchableSink();
        TelemetryRelay second = relay(up, tempDir)
                .replayBatchDelay(Duration.ZERO)
                .build();

        assertTrue(waitUntil(() -> up.delivered.size() == 3, Duration.ofSeconds(3)));
        assertEquals(List.of("corr-0", "corr-1", "corr-2"), up.delivered);
        assertTrue(waitUntil(() -> !second.getReplayCoordinator().isReplaying(), Duration.ofSeconds(2)));
        assertEquals(3, second.getMetrics().recordsReplayed);
        second.shutdown();
    }

    @Test
    void openBreakerSurvivesRestartThroughStateFile(@TempDir Path tempDir) throws Exception {
        Path stateFile = tempDir.resolve("circuit-breaker.json");
        SwitchableSink down = new SwitchableSink();
        down.up.set(false);
        TelemetryRelay first = relay(down, tempDir.resolve("buffer"))
                .stateFile(stateFile)
                .failureThreshold(1)
                .build();
        first.enqueue("{}", "corr-0");
        assertTrue(waitUntil(first::isCircuitOpen, Duration.ofSeconds(2)));
        first.shutdown();

        TelemetryRelay second = relay(new SwitchableSink(), tempDir.resolve("buffer"))
                .stateFile(stateFile)
                .build();

        assertTrue(second.isCircuitOpen());
        second.shutdown();
    }

    @Test
    void enqueueAfterShutdownIsRejectedAndReported(@TempDir Path tempDir) {
        List<String> reasons = new CopyOnWriteArrayList<>();
        TelemetryRelay relay = relay(new SwitchableSink(), tempDir)
                .onRecordLoss((record, reason) -> reasons.add(reason))
                .build();
        relay.shutdown();

        assertFalse(relay.enqueue("{}", "late"));

        assertEquals(List.of("shutdown_in_progress"), reasons);
        assertEquals(1, relay.getMetrics().recordsDropped);
    }

    @Test
    void recordsAcceptedWhileShuttingDownAreNotLost(@TempDir Path tempDir) throws Exception {
        for (int round = 0; round < 10; round++) {
            Path dir = tempDir.resolve("round-" + round);
            SwitchableSink down = new SwitchableSink();
            down.up.set(false);
            AtomicInteger rejectedReported = new AtomicInteger();
            TelemetryRelay relay = relay(down, dir)
                    .failureThreshold(1)
                    .memoryCapacity(1_000)
                    .shutdownGrace(Duration.ofMillis(200))
                    .onRecordLoss((record, reason) -> {
                        if ("shutdown_in_progress".equals(reason)) {
                            rejectedReported.incrementAndGet();
                        }
                    })
                    .build();

            AtomicInteger accepted = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            AtomicBoolean stop = new AtomicBoolean();
            CountDownLatch started = new CountDownLatch(4);
            List<Thread> producers = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                int producer = t;
                producers.add(new Thread(() -> {
                    started.countDown();
                    for (int i = 0; !stop.get(); i++) {
                        if (relay.enqueue("{}", "p" + producer + "-" + i)) {
                            accepted.incrementAndGet();
                        } else {
                            rejected.incrementAndGet();
                        }
                    }
                }));
            }
            producers.forEach(Thread::start);
            started.await();

            relay.shutdown();
            stop.set(true);
            for (Thread producer : producers) {
                producer.join();
            }

            DurableBuffer reopened = DurableBuffer.builder().directory(dir).build();
            assertEquals(accepted.get(), reopened.count(), "round " + round);
            assertEquals(rejected.get(), rejectedReported.get(), "round " + round);
        }
    }

    @Test
    void nullRecordIsRejectedWithoutThrowing(@TempDir Path tempDir) {
        TelemetryRelay relay = relay(new SwitchableSink(), tempDir).build();

        assertFalse(relay.enqueue((TelemetryRecord) null));
        assertFalse(relay.enqueue((String) null, "c"));
        assertFalse(relay.enqueue((byte[]) null, "c"));
        assertEquals(0, relay.getBufferDepth());
        relay.shutdown();
    }

    @Test
    void shutdownIsIdempotent(@TempDir Path tempDir) {
        TelemetryRelay relay = relay(new SwitchableSink(), tempDir).build();

        relay.shutdown();

        assertDoesNotThrow(relay::shutdown);
        assertDoesNotThrow(relay::close);
    }

    @Test
    void shutdownHookIsRemovedAfterClose(@TempDir Path tempDir) throws Exception {
        TelemetryRelay relay = TelemetryRelay.builder()
                .sink(new SwitchableSink())
                .bufferPath(tempDir)
                .registerShutdownHook(true)
                .build();

        // Grab the shutdown hook via reflection
        Field hookField = TelemetryRelay.class.getDeclaredField("shutdownHook");
        hookField.setAccessible(true);
        Thread hook = (Thread) hookField.get(relay);
        assertNotNull(hook, "shutdown hook should have been registered");

        relay.close();

        // If the hook was removed, we can re-add it without error
        Runtime.getRuntime().addShutdownHook(hook);
        Runtime.getRuntime().removeShutdownHook(hook);
    }

    @Test
    void flushWaitsUntilBufferIsEmpty(@TempDir Path tempDir) {
        SwitchableSink sink = new SwitchableSink();
        TelemetryRelay relay = relay(sink, tempDir)
                .eagerDrainThreshold(0)
                .flushInterval(Duration.ofMinutes(1))
                .build();
        for (int i = 0; i < 20; i++) {
            relay.enqueue("{}", "corr-" + i);
        }

        assertTrue(relay.flush(3_000));
        assertEquals(20, sink.delivered.size());
        relay.shutdown();
    }

    @Test
    void statusReportsHealthDocument(@TempDir Path tempDir) {
        TelemetryRelay relay = relay(new SwitchableSink(), tempDir).build();

        RelayStatus status = relay.status();

        assertEquals(RelayStatus.STATUS_OK, status.getStatus());
        assertEquals(CircuitState.CLOSED, status.getCircuitState());
        assertEquals(0, status.getFailureCount());
        assertNotNull(status.getBuffer());
        assertNotNull(status.getReplay());
        assertTrue(status.getUptimeSeconds() >= 0);
        relay.shutdown();
    }

    @Test
    void builderValidatesRequiredSettings(@TempDir Path tempDir) {
        assertThrows(RelayConfigurationException.class,
                () -> TelemetryRelay.builder().bufferPath(tempDir).build());
        assertThrows(RelayConfigurationException.class,
                () -> TelemetryRelay.builder().sink(record -> { }).build());
        assertThrows(RelayConfigurationException.class,
                () -> relay(record -> { }, tempDir).batchSize(0).build());
        assertThrows(RelayConfigurationException.class,
                () -> relay(record -> { }, tempDir).flushInterval(Duration.ZERO).build());
        assertThrows(RelayConfigurationException.class,
                () -> relay(record -> { }, tempDir).failureThreshold(0).build());
    }

    private boolean waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
