package com.botstate.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Crash-consistent file writes used by every store in the working copy and by the
 * snapshot backend.
 *
 * <p>Whole-file writes go to a sibling temp file that is forced to disk and then moved
 * over the target, so readers see either the old or the new content. Appends are forced
 * to disk before returning.
 */
public final class AtomicFiles {

    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    private AtomicFiles() {}

    public static void write(Path target, byte[] content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = parent.resolve(target.getFileName() + ".tmp-" + UUID.randomUUID());
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                writeFully(channel, content);
                channel.force(true);
            }
            move(tmp, target);
            syncDirectory(parent);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Creates a file that must not exist yet and forces it to disk. For files inside a
     * directory that is published by a later rename, so no temp file is needed.
     */
    public static void writeNew(Path target, byte[] content) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            writeFully(channel, content);
            channel.force(true);
        }
    }

    /**
     * Forces a directory's entries (creations, renames) to disk. Platforms that cannot
     * open a directory for sync skip it.
     */
    public static void syncDirectory(Path dir) {
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            log.debug("Directory sync not supported for {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Appends one line (a terminating newline is added) and forces it to disk. A torn
     * fragment left by a crashed writer is terminated first so the new line stays intact.
     * Returns the file size after the append.
     */
    public static long appendLine(Path target, String line) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        byte[] bytes = (line + "\n").getBytes(StandardCharsets.UTF_8);
        try (FileChannel channel = FileChannel.open(
                target, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            channel.position(size);
            if (size > 0 && !endsWithNewline(channel, size)) {
                log.warn("Terminating torn trailing line in {} before append", target);
                writeFully(channel, new byte[] {'\n'});
            }
            writeFully(channel, bytes);
            channel.force(true);
            return channel.size();
        }
    }

    /** File content, or an empty array when the file does not exist. */
    public static byte[] readOrEmpty(Path path) throws IOException {
        return Files.exists(path) ? Files.readAllBytes(path) : new byte[0];
    }

    private static void writeFully(FileChannel channel, byte[] content) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(content);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private static boolean endsWithNewline(FileChannel channel, long size) throws IOException {
        ByteBuffer last = ByteBuffer.allocate(1);
        channel.read(last, size - 1);
        return last.get(0) == '\n';
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
