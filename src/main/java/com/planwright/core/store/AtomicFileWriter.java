package com.planwright.core.store;

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
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Replaces files so that readers see either the old or the new content, never a
 * partial write: the data goes to a temp file in the same directory, is forced to
 * disk, and is then renamed over the target.
 */
public final class AtomicFileWriter {

    private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

    static final String TEMP_MARKER = ".tmp-";

    private AtomicFileWriter() {}

    /**
     * Writes {@code data} to {@code target}. When {@code backup} is non-null and the
     * target exists, the previous content is copied there first.
     */
    public static void write(Path target, byte[] data, Path backup) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        cleanStaleTemps(target);
        Path temp = dir.resolve(target.getFileName() + TEMP_MARKER + UUID.randomUUID());
        try {
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                var buffer = ByteBuffer.wrap(data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            if (backup != null && Files.exists(target)) {
                Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING);
            }
            move(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Removes temp files left behind by a writer that died before its rename.
     */
    static void cleanStaleTemps(Path target) {
        Path dir = target.toAbsolutePath().getParent();
        String prefix = target.getFileName() + TEMP_MARKER;
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().startsWith(prefix)).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                    log.debug("Removed stale temp file {}", p.getFileName());
                } catch (IOException e) {
                    log.warn("Could not remove stale temp file {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not scan {} for stale temp files: {}", dir, e.getMessage());
        }
    }
}
