package com.telemetryrelay.sdk.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * File helpers shared by the breaker state store and the durable buffer
 *
 * <p>Every on-disk artifact the relay owns is written through
 * {@link #writeAtomically(Path, byte[])}: content goes to a temp file in the
 * target directory, is forced to the device, then renamed over the target.
 * Readers therefore see either the previous file or the complete new one.</p>
 */
public final class RelayFiles {

    private static final Logger log = LoggerFactory.getLogger(RelayFiles.class);

    /**
     * Suffix of in-flight temp files. Leftovers are removed at start-up.
     */
    public static final String TEMP_SUFFIX = ".tmp";

    private RelayFiles() {
        // Prevent instantiation
    }

    /**
     * Jackson mapper used for every file the relay writes
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Write {@code content} to {@code target} via temp file, fsync and rename
     *
     * @throws IOException if any step fails; the temp file is removed and the
     *                     previous target (if any) is left untouched
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path tempFile = Files.createTempFile(directory, target.getFileName().toString() + ".", TEMP_SUFFIX);
        try {
            try (FileChannel channel = FileChannel.open(tempFile,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveAtomically(tempFile, target);
        } catch (IOException e) {
            deleteIfExists(tempFile);
            throw e;
        }
    }

    /**
     * Rename {@code source} to {@code target}, falling back to a plain replace
     * on file systems without atomic move support
     */
    public static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Best-effort delete; failures are logged, never thrown
     *
     * @return true if the file existed and was removed
     */
    public static boolean deleteIfExists(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", file, e.getMessage());
            return false;
        }
    }

    public static boolean isTempFile(Path file) {
        return file.getFileName().toString().endsWith(TEMP_SUFFIX);
    }

    public static String getRootCauseMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null) root = root.getCause();
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
