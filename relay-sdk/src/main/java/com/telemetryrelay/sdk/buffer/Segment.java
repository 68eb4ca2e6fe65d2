package com.telemetryrelay.sdk.buffer;

import com.telemetryrelay.sdk.model.BufferEntry;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One overflow file on disk.
 *
 * <p>The name encodes the first and last sequence and the entry count, zero
 * padded so that lexical order is insertion order:
 * {@code segment-00000000000000000001-00000000000000000100-100.json}.</p>
 */
final class Segment {

    static final String PREFIX = "segment-";
    static final String SUFFIX = ".json";

    private static final Pattern NAME = Pattern.compile("segment-(\\d{20})-(\\d{20})-(\\d+)\\.json");

    final Path file;
    final long firstSequence;
    final long lastSequence;
    final int count;
    final long sizeBytes;

    // Lazily loaded, guarded by the owning buffer's lock
    List<BufferEntry> entries;

    Segment(Path file, long firstSequence, long lastSequence, int count, long sizeBytes) {
        this.file = file;
        this.firstSequence = firstSequence;
        this.lastSequence = lastSequence;
        this.count = count;
        this.sizeBytes = sizeBytes;
    }

    static String fileName(long firstSequence, long lastSequence, int count) {
        return String.format(Locale.ROOT, "%s%020d-%020d-%d%s", PREFIX, firstSequence, lastSequence, count, SUFFIX);
    }

    /**
     * Parse a segment file name
     *
     * @return the segment, or null if the name is not a segment name
     */
    static Segment parse(Path file, long sizeBytes) {
        Matcher matcher = NAME.matcher(file.getFileName().toString());
        if (!matcher.matches()) {
            return null;
        }
        return new Segment(file,
                Long.parseLong(matcher.group(1)),
                Long.parseLong(matcher.group(2)),
                Integer.parseInt(matcher.group(3)),
                sizeBytes);
    }

    /**
     * Entry count, preferring the loaded contents over the name
     */
    int size() {
        return entries != null ? entries.size() : count;
    }

    boolean overlaps(long sequence) {
        return sequence >= firstSequence && sequence <= lastSequence;
    }

    @Override
    public String toString() {
        return file.getFileName().toString();
    }
}
