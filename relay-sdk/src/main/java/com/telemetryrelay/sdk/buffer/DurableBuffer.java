package com.telemetryrelay.sdk.buffer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetryrelay.sdk.client.LoggingRecordLossCallback;
import com.telemetryrelay.sdk.client.RecordLossCallback;
import com.telemetryrelay.sdk.exception.RelayConfigurationException;
import com.telemetryrelay.sdk.model.BufferEntry;
import com.telemetryrelay.sdk.model.BufferStats;
import com.telemetryrelay.sdk.model.StorageTier;
import com.telemetryrelay.sdk.model.TelemetryRecord;
import com.telemetryrelay.sdk.util.RelayFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable Buffer - memory-first FIFO with atomic overflow to disk
 *
 * <p>Records are appended to an in-memory tier. When that tier reaches its
 * capacity the whole tier is written to a new segment file (temp file, fsync,
 * rename) and cleared, so disk always holds the oldest records and memory the
 * newest.</p>
 *
 * <h2>Lifecycle of an entry:</h2>
 * <ol>
 *   <li>{@link #enqueue} assigns the next sequence and stores it in memory</li>
 *   <li>{@link #drain} returns the oldest entries without removing them</li>
 *   <li>{@link #acknowledge} removes delivered entries, deleting a segment file
 *       once all of its entries are acknowledged</li>
 * </ol>
 *
 * <p>Entries are also removed when the total size exceeds the byte ceiling
 * (oldest first) or, as a last resort, when a segment cannot be written. A
 * failed delivery never removes anything.</p>
 *
 * <p>Segments found at start-up are indexed oldest-first and served before any
 * new record. Memory bytes are counted from record sizes, disk bytes from the
 * segment file sizes.</p>
 *
 * <h2>Thread Safety:</h2>
 * <p>All mutation is serialized by a single lock. Loss callbacks run after the
 * lock is released.</p>
 */
public class DurableBuffer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DurableBuffer.class);

    private static final TypeReference<List<BufferEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final Path directory;
    private final int memoryCapacity;
    private final long capacityBytes;
    private final ObjectMapper objectMapper;
    private final RecordLossCallback lossCallback;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private final ArrayDeque<BufferEntry> memory = new ArrayDeque<>();
    private final List<Segment> segments = new ArrayList<>();
    private long memoryBytes;
    private long diskBytes;
    private long nextSequence = 1;
    private boolean closed;

    private final AtomicLong evictedTotal = new AtomicLong(0);
    private final AtomicLong droppedTotal = new AtomicLong(0);

    private DurableBuffer(Builder builder) {
        this.directory = builder.directory;
        this.memoryCapacity = builder.memoryCapacity;
        this.capacityBytes = builder.capacityBytes;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : RelayFiles.newObjectMapper();
        this.lossCallback = builder.lossCallback != null ? builder.lossCallback : LoggingRecordLossCallback.INSTANCE;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new RelayConfigurationException("Failed to create buffer directory: " + directory, e);
        }
        indexSegments();
        log.info("DurableBuffer opened at {} - {} segment(s), {} record(s) on disk, next sequence {}",
                directory, segments.size(), diskCount(), nextSequence);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Append a record. Never blocks on I/O other than a tier flush and never throws.
     *
     * @return false if the record is null or the buffer has been closed
     */
    public boolean enqueue(TelemetryRecord record) {
        if (record == null) {
            log.warn("Ignoring null record");
            return false;
        }
        List<Loss> losses = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            memory.addLast(new BufferEntry(nextSequence++, record, StorageTier.MEMORY));
            memoryBytes += record.sizeBytes();
            if (memory.size() >= memoryCapacity) {
                flushMemoryLocked(losses);
            }
            enforceCapacityLocked(losses);
        } catch (RuntimeException e) {
            log.error("Unexpected error buffering record: correlationId={}", record.getCorrelationId(), e);
        } finally {
            lock.unlock();
        }
        notifyLosses(losses);
        return true;
    }

    /**
     * Peek at up to {@code maxBatch} of the oldest entries, disk before memory.
     *
     * <p>Nothing is removed: calling drain twice without an acknowledgement in
     * between returns the same entries.</p>
     */
    public List<BufferEntry> drain(int maxBatch) {
        if (maxBatch < 1) {
            return List.of();
        }
        List<BufferEntry> batch = new ArrayList<>(Math.min(maxBatch, 256));
        lock.lock();
        try {
            Iterator<Segment> it = segments.iterator();
            while (it.hasNext() && batch.size() < maxBatch) {
                Segment segment = it.next();
                List<BufferEntry> entries = loadLocked(segment);
                if (entries == null) {
                    it.remove();
                    diskBytes -= segment.sizeBytes;
                    continue;
                }
                for (BufferEntry entry : entries) {
                    if (batch.size() >= maxBatch) {
                        break;
                    }
                    batch.add(entry);
                }
            }
            for (BufferEntry entry : memory) {
                if (batch.size() >= maxBatch) {
                    break;
                }
                batch.add(entry);
            }
        } finally {
            lock.unlock();
        }
        return batch;
    }

    /**
     * Remove delivered entries by sequence. Unknown sequences are ignored.
     *
     * @return number of entries removed
     */
    public int acknowledge(Collection<Long> sequences) {
        if (sequences == null || sequences.isEmpty()) {
            return 0;
        }
        Set<Long> ids = new HashSet<>(sequences);
        int removed = 0;
        lock.lock();
        try {
            ListIterator<Segment> it = segments.listIterator();
            while (it.hasNext()) {
                Segment segment = it.next();
                if (!containsAny(segment, ids)) {
                    continue;
                }
                List<BufferEntry> entries = loadLocked(segment);
                if (entries == null) {
                    it.remove();
                    diskBytes -= segment.sizeBytes;
                    continue;
                }
                List<BufferEntry> remaining = new ArrayList<>(entries.size());
                for (BufferEntry entry : entries) {
                    if (!ids.contains(entry.getSequence())) {
                        remaining.add(entry);
                    }
                }
                int acknowledged = entries.size() - remaining.size();
                if (acknowledged == 0) {
                    continue;
                }
                removed += acknowledged;
                if (remaining.isEmpty()) {
                    RelayFiles.deleteIfExists(segment.file);
                    it.remove();
                    diskBytes -= segment.sizeBytes;
                    log.debug("Segment {} fully acknowledged and deleted", segment);
                } else {
                    Segment rewritten = rewriteLocked(segment, remaining);
                    it.set(rewritten);
                    diskBytes += rewritten.sizeBytes - segment.sizeBytes;
                }
            }

            Iterator<BufferEntry> memoryIt = memory.iterator();
            while (memoryIt.hasNext()) {
                BufferEntry entry = memoryIt.next();
                if (ids.contains(entry.getSequence())) {
                    memoryIt.remove();
                    memoryBytes -= entry.getRecord().sizeBytes();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    /**
     * Total buffered records across both tiers
     */
    public long count() {
        lock.lock();
        try {
            return memory.size() + diskCount();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Total buffered bytes across both tiers
     */
    public long sizeBytes() {
        lock.lock();
        try {
            return memoryBytes + diskBytes;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return count() == 0;
    }

    /**
     * True when at least one segment file is waiting to be replayed
     */
    public boolean hasDiskBacklog() {
        lock.lock();
        try {
            return !segments.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public BufferStats stats() {
        lock.lock();
        try {
            return new BufferStats(memory.size(), segments.size(), diskCount(),
                    memoryBytes + diskBytes, capacityBytes, evictedTotal.get(), droppedTotal.get());
        } finally {
            lock.unlock();
        }
    }

    public Path getDirectory() {
        return directory;
    }

    public int getMemoryCapacity() {
        return memoryCapacity;
    }

    public long getCapacityBytes() {
        return capacityBytes;
    }

    /**
     * Write the memory tier to disk and refuse further appends, as one step.
     *
     * <p>An {@link #enqueue} racing with this call either lands before the
     * flush and is written with it, or sees the buffer closed and returns
     * false. Draining and acknowledging still work afterwards.</p>
     *
     * @return number of records moved to disk
     */
    public int flushAndClose() {
        List<Loss> losses = new ArrayList<>();
        int flushed;
        lock.lock();
        try {
            flushed = flushMemoryLocked(losses);
            closed = true;
        } finally {
            lock.unlock();
        }
        notifyLosses(losses);
        return flushed;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        int flushed = flushAndClose();
        log.info("DurableBuffer closed - flushed {} record(s) to disk, {} record(s) retained", flushed, count());
    }

    // ========================================================================
    // Internal - Segments
    // ========================================================================

    private void indexSegments() {
        List<Segment> found = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                if (RelayFiles.isTempFile(file)) {
                    log.info("Removing stale temp file from interrupted write: {}", file.getFileName());
                    RelayFiles.deleteIfExists(file);
                    continue;
                }
                Segment segment = Segment.parse(file, Files.size(file));
                if (segment != null) {
                    found.add(segment);
                }
            }
        } catch (IOException e) {
            throw new RelayConfigurationException("Failed to index buffer directory: " + directory, e);
        }

        found.sort(Comparator.comparing(segment -> segment.file.getFileName().toString()));
        long maxSequence = 0;
        for (Segment segment : found) {
            if (!segments.isEmpty()) {
                Segment previous = segments.get(segments.size() - 1);
                if (segment.firstSequence <= previous.lastSequence) {
                    // A rewrite finished but the original was not deleted before a crash
                    log.info("Discarding superseded segment {} (replaced by {})", previous, segment);
                    RelayFiles.deleteIfExists(previous.file);
                    segments.remove(segments.size() - 1);
                    diskBytes -= previous.sizeBytes;
                }
            }
            segments.add(segment);
            diskBytes += segment.sizeBytes;
            maxSequence = Math.max(maxSequence, segment.lastSequence);
        }
        nextSequence = maxSequence + 1;
    }

    // Caller holds lock. Returns null (after deleting the file) when the segment is unreadable.
    private List<BufferEntry> loadLocked(Segment segment) {
        if (segment.entries != null) {
            return segment.entries;
        }
        try {
            List<BufferEntry> entries = objectMapper.readValue(segment.file.toFile(), ENTRY_LIST);
            List<BufferEntry> onDisk = new ArrayList<>(entries.size());
            for (BufferEntry entry : entries) {
                onDisk.add(entry.withTier(StorageTier.DISK));
            }
            segment.entries = onDisk;
            return onDisk;
        } catch (IOException | RuntimeException e) {
            log.error("Corrupt buffer segment {} - discarding {} record(s): {}",
                    segment, segment.count, e.getMessage());
            RelayFiles.deleteIfExists(segment.file);
            droppedTotal.addAndGet(segment.count);
            return null;
        }
    }

    // Caller holds lock
    private int flushMemoryLocked(List<Loss> losses) {
        if (memory.isEmpty()) {
            return 0;
        }
        List<BufferEntry> batch = new ArrayList<>(memory.size());
        for (BufferEntry entry : memory) {
            batch.add(entry.withTier(StorageTier.DISK));
        }
        long first = batch.get(0).getSequence();
        long last = batch.get(batch.size() - 1).getSequence();
        Path file = directory.resolve(Segment.fileName(first, last, batch.size()));
        int flushed = 0;
        try {
            byte[] content = objectMapper.writeValueAsBytes(batch);
            RelayFiles.writeAtomically(file, content);
            segments.add(new Segment(file, first, last, batch.size(), content.length));
            diskBytes += content.length;
            flushed = batch.size();
            log.debug("Flushed {} record(s) from memory to {}", flushed, file.getFileName());
        } catch (IOException e) {
            log.error("Failed to write buffer segment {} - dropping {} record(s): {}",
                    file.getFileName(), batch.size(), RelayFiles.getRootCauseMessage(e));
            droppedTotal.addAndGet(batch.size());
            for (BufferEntry entry : batch) {
                losses.add(new Loss(entry.getRecord(), "disk_write_failed"));
            }
        }
        memory.clear();
        memoryBytes = 0;
        return flushed;
    }

    // Caller holds lock. On failure the original file is kept so nothing unacknowledged is lost.
    private Segment rewriteLocked(Segment segment, List<BufferEntry> remaining) {
        long first = remaining.get(0).getSequence();
        long last = remaining.get(remaining.size() - 1).getSequence();
        Path target = directory.resolve(Segment.fileName(first, last, remaining.size()));
        try {
            byte[] content = objectMapper.writeValueAsBytes(remaining);
            RelayFiles.writeAtomically(target, content);
            if (!target.equals(segment.file)) {
                RelayFiles.deleteIfExists(segment.file);
            }
            Segment rewritten = new Segment(target, first, last, remaining.size(), content.length);
            rewritten.entries = remaining;
            return rewritten;
        } catch (IOException e) {
            log.warn("Failed to rewrite partially acknowledged segment {}, acknowledged records may be redelivered after restart: {}",
                    segment, e.getMessage());
            segment.entries = remaining;
            return segment;
        }
    }

    // Caller holds lock
    private void enforceCapacityLocked(List<Loss> losses) {
        if (memoryBytes + diskBytes <= capacityBytes) {
            return;
        }
        long evicted = 0;
        while (memoryBytes + diskBytes > capacityBytes && !segments.isEmpty()) {
            Segment oldest = segments.remove(0);
            diskBytes -= oldest.sizeBytes;
            List<BufferEntry> entries = loadLocked(oldest);
            if (entries == null) {
                continue;
            }
            RelayFiles.deleteIfExists(oldest.file);
            for (BufferEntry entry : entries) {
                losses.add(new Loss(entry.getRecord(), "evicted"));
            }
            evicted += entries.size();
        }
        while (memoryBytes + diskBytes > capacityBytes && !memory.isEmpty()) {
            BufferEntry entry = memory.pollFirst();
            memoryBytes -= entry.getRecord().sizeBytes();
            losses.add(new Loss(entry.getRecord(), "evicted"));
            evicted++;
        }
        if (evicted > 0) {
            evictedTotal.addAndGet(evicted);
            log.warn("Buffer exceeded {} bytes - evicted {} oldest record(s)", capacityBytes, evicted);
        }
    }

    // Caller holds lock
    private long diskCount() {
        long total = 0;
        for (Segment segment : segments) {
            total += segment.size();
        }
        return total;
    }

    private static boolean containsAny(Segment segment, Set<Long> ids) {
        for (Long id : ids) {
            if (id != null && segment.overlaps(id)) {
                return true;
            }
        }
        return false;
    }

    private void notifyLosses(List<Loss> losses) {
        for (Loss loss : losses) {
            try {
                lossCallback.onRecordLoss(loss.record(), loss.reason());
            } catch (Exception e) {
                log.warn("RecordLossCallback threw for reason={}: {}", loss.reason(), e.getMessage());
            }
        }
    }

    private record Loss(TelemetryRecord record, String reason) {
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private Path directory;
        private int memoryCapacity = 100;
        private long capacityBytes = 100L * 1024 * 1024;
        private ObjectMapper objectMapper;
        private RecordLossCallback lossCallback;

        /**
         * Directory owned by this buffer for its segment files (required)
         */
        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        /**
         * Records held in memory before the tier is flushed to disk (default: 100)
         */
        public Builder memoryCapacity(int memoryCapacity) {
            this.memoryCapacity = memoryCapacity;
            return this;
        }

        /**
         * Ceiling on memory plus disk bytes; oldest records are evicted beyond it (default: 100MB)
         */
        public Builder capacityBytes(long capacityBytes) {
            this.capacityBytes = capacityBytes;
            return this;
        }

        /**
         * Provide a pre-configured ObjectMapper for segment files
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Callback for evicted or dropped records. Defaults to a SLF4J WARN logger.
         */
        public Builder onRecordLoss(RecordLossCallback callback) {
            this.lossCallback = callback;
            return this;
        }

        public DurableBuffer build() {
            if (directory == null) {
                throw new RelayConfigurationException("directory is required");
            }
            if (memoryCapacity < 1) {
                throw new RelayConfigurationException("memoryCapacity must be >= 1, got: " + memoryCapacity);
            }
            if (capacityBytes < 1) {
                throw new RelayConfigurationException("capacityBytes must be >= 1, got: " + capacityBytes);
            }
            return new DurableBuffer(this);
        }
    }
}
