package com.telemetryrelay.sdk.client;

import com.telemetryrelay.sdk.model.TelemetryRecord;
import com.telemetryrelay.sdk.util.RelayFiles;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * In-memory TelemetryRelay for tests.
 *
 * <p>Records passed to {@code enqueue} are captured instead of buffered; no
 * background sender, timer or shutdown hook is started.</p>
 */
public class MockTelemetryRelay extends TelemetryRelay {

    private static final TelemetrySink NO_OP_SINK = record -> { };

    private final CopyOnWriteArrayList<TelemetryRecord> capturedRecords = new CopyOnWriteArrayList<>();

    public MockTelemetryRelay() {
        this(NO_OP_SINK);
    }

    public MockTelemetryRelay(TelemetrySink sink) {
        super(TelemetryRelay.builder()
                .sink(sink)
                .bufferPath(newTempBufferPath())
                .registerShutdownHook(false),
                false);
    }

    @Override
    public boolean enqueue(TelemetryRecord record) {
        if (record == null) {
            return false;
        }
        capturedRecords.add(record);
        return true;
    }

    /**
     * Shut down and remove the private buffer directory
     */
    @Override
    public void shutdown() {
        super.shutdown();
        Path directory = getBuffer().getDirectory();
        if (Files.notExists(directory)) {
            return;
        }
        try (Stream<Path> files = Files.walk(directory)) {
            files.sorted(Comparator.reverseOrder()).forEach(RelayFiles::deleteIfExists);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not remove MockTelemetryRelay buffer directory " + directory, e);
        }
    }

    public List<TelemetryRecord> getCapturedRecords() {
        return Collections.unmodifiableList(capturedRecords);
    }

    public List<TelemetryRecord> getRecordsForCorrelationId(String correlationId) {
        List<TelemetryRecord> matches = new ArrayList<>();
        for (TelemetryRecord record : capturedRecords) {
            if (correlationId.equals(record.getCorrelationId())) {
                matches.add(record);
            }
        }
        return matches;
    }

    public void reset() {
        capturedRecords.clear();
    }

    public void assertRecordCount(int expected) {
        int actual = capturedRecords.size();
        if (actual != expected) {
            throw new AssertionError("Expected " + expected + " records but found " + actual);
        }
    }

    public void assertPayloadEnqueued(String json) {
        for (TelemetryRecord record : capturedRecords) {
            if (json.equals(record.getPayloadAsString())) {
                return;
            }
        }
        throw new AssertionError("Expected a record with payload " + json);
    }

    private static Path newTempBufferPath() {
        try {
            Path directory = Files.createTempDirectory("mock-relay-");
            directory.toFile().deleteOnExit();
            return directory;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create buffer directory for MockTelemetryRelay", e);
        }
    }
}
