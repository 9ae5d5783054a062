package com.botstate.io;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy reader for newline-delimited JSON files that keeps track of byte offsets.
 *
 * <p>Only newline-terminated lines are yielded. A trailing line without its newline is
 * a torn append from a crashed writer and is left for the next read. Blank lines are
 * skipped but still advance the offset.
 *
 * <p>The returned stream holds the file open: close it (try-with-resources).
 */
public final class JsonLinesReader {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesReader.class);

    private JsonLinesReader() {}

    /** A complete line and the byte range it occupies, terminator included. */
    public record Line(String text, long startOffset, long endOffset) {}

    public static Stream<Line> lines(Path path, long startOffset) {
        if (!Files.exists(path)) {
            return Stream.empty();
        }
        InputStream input;
        try {
            SeekableByteChannel channel = Files.newByteChannel(path, StandardOpenOption.READ);
            channel.position(startOffset);
            input = new BufferedInputStream(Channels.newInputStream(channel));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open " + path, e);
        }
        InputStream opened = input;
        return StreamSupport.stream(new LineSpliterator(path, opened, startOffset), false)
                .onClose(() -> {
                    try {
                        opened.close();
                    } catch (IOException e) {
                        log.warn("Failed to close {}", path, e);
                    }
                });
    }

    private static final class LineSpliterator extends Spliterators.AbstractSpliterator<Line> {

        private final Path path;
        private final InputStream input;
        private long offset;

        LineSpliterator(Path path, InputStream input, long startOffset) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.path = path;
            this.input = input;
            this.offset = startOffset;
        }

        @Override
        public boolean tryAdvance(Consumer<? super Line> action) {
            try {
                while (true) {
                    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                    int b;
                    while ((b = input.read()) != -1 && b != '\n') {
                        buffer.write(b);
                    }
                    if (b == -1) {
                        if (buffer.size() > 0) {
                            log.warn("[JSONL] ignoring torn trailing line in {} at offset {}", path, offset);
                        }
                        return false;
                    }
                    long start = offset;
                    offset += buffer.size() + 1L;
                    String text = buffer.toString(StandardCharsets.UTF_8).strip();
                    if (text.isEmpty()) {
                        continue;
                    }
                    action.accept(new Line(text, start, offset));
                    return true;
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + path, e);
            }
        }
    }
}
