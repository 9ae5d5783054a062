package com.botstate.intent;

import com.botstate.config.StorageConfig;
import com.botstate.domain.model.IntentCursor;
import com.botstate.domain.model.IntentRecord;
import com.botstate.domain.model.PendingIntent;
import com.botstate.exception.StateCorruptionException;
import com.botstate.exception.StateStorageException;
import com.botstate.exception.ValidationException;
import com.botstate.io.AtomicFiles;
import com.botstate.io.JsonLinesReader;
import com.botstate.mapper.StateJson;
import com.botstate.validation.RecordValidator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Append-only log of order intents emitted by strategies, with a single consumer cursor.
 *
 * <p>Intents are written before anything reaches the broker, so after a crash the
 * executor can see what was proposed but not yet handled: everything after the cursor.
 * The cursor is a byte offset into the log and only moves through {@link #advance}.
 */
@Component
public class IntentLog {

    private static final Logger log = LoggerFactory.getLogger(IntentLog.class);

    private final StorageConfig storageConfig;
    private final RecordValidator recordValidator;

    public IntentLog(StorageConfig storageConfig, RecordValidator recordValidator) {
        this.storageConfig = storageConfig;
        this.recordValidator = recordValidator;
    }

    public Path path() {
        return storageConfig.intentsFile();
    }

    public Path cursorPath() {
        return storageConfig.intentCursorFile();
    }

    /**
     * Appends an intent; the line is on disk when this returns.
     *
     * @return the log size after the append, i.e. the end offset of this record
     * @throws ValidationException if the record is incomplete; nothing is written
     */
    public long append(IntentRecord record) {
        recordValidator.validate(record, "intent record");
        try {
            long end = AtomicFiles.appendLine(path(), StateJson.toLine(record));
            log.info("[INTENT] Appended {} {} {} from {}", record.getIntentId(), record.getSide(), record.getCode(), record.getStrategyId());
            return end;
        } catch (IOException e) {
            throw new StateStorageException("Failed to append to intent log " + path(), e);
        }
    }

    /**
     * Intents recorded after the cursor, in append order. Lazy and restartable. Close
     * the stream.
     *
     * @throws StateCorruptionException if the cursor points past the end of the log
     */
    public Stream<PendingIntent> readSince(IntentCursor cursor) {
        Path logPath = path();
        long offset = cursor != null ? cursor.getOffset() : 0L;
        long size = sizeOf(logPath);
        if (offset < 0 || offset > size) {
            throw new StateCorruptionException(
                    cursorPath().toString(), "Cursor offset " + offset + " is outside the intent log (size " + size + ")");
        }
        return JsonLinesReader.lines(logPath, offset)
                .map(line -> parse(logPath, line))
                .filter(Objects::nonNull);
    }

    /**
     * Moves the cursor past {@code processed} and writes it atomically.
     *
     * @throws ValidationException if {@code processed} does not lie after the cursor
     */
    public IntentCursor advance(IntentCursor cursor, PendingIntent processed) {
        IntentCursor current = cursor != null ? cursor : IntentCursor.initial();
        if (processed == null || processed.getStartOffset() < current.getOffset()) {
            throw new ValidationException("Processed intent does not lie after cursor offset " + current.getOffset());
        }
        IntentCursor next = IntentCursor.builder()
                .offset(processed.getEndOffset())
                .lastIntentId(processed.getRecord().getIntentId())
                .lastTs(processed.getRecord().getTs())
                .build();
        try {
            AtomicFiles.write(cursorPath(), StateJson.toDocument(next));
        } catch (IOException e) {
            throw new StateStorageException("Failed to write intent cursor " + cursorPath(), e);
        }
        log.debug("[INTENT] Cursor advanced to offset {} ({})", next.getOffset(), next.getLastIntentId());
        return next;
    }

    /**
     * The persisted cursor, or the initial one when the file does not exist yet.
     *
     * @throws StateCorruptionException if the file is unreadable or holds a negative offset
     */
    public IntentCursor loadCursor() {
        Path path = cursorPath();
        if (!Files.exists(path)) {
            return IntentCursor.initial();
        }
        try {
            return parseCursor(path.toString(), Files.readAllBytes(path));
        } catch (IOException e) {
            throw new StateStorageException("Failed to read intent cursor " + path, e);
        }
    }

    /** Parses cursor file content. Shared with the snapshot restore. */
    public static IntentCursor parseCursor(String source, byte[] content) {
        IntentCursor cursor;
        try {
            cursor = StateJson.fromDocument(content, IntentCursor.class);
        } catch (IOException e) {
            throw new StateCorruptionException(source, "Intent cursor is not valid JSON", e);
        }
        if (cursor == null || cursor.getOffset() < 0) {
            throw new StateCorruptionException(source, "Intent cursor has no valid offset");
        }
        return cursor;
    }

    /** Drops repeated intent ids; the first occurrence wins and order is kept. */
    public static List<IntentRecord> dedupe(List<IntentRecord> records) {
        Set<String> seen = new HashSet<>();
        List<IntentRecord> unique = new ArrayList<>();
        for (IntentRecord record : records) {
            if (seen.add(record.getIntentId())) {
                unique.add(record);
            }
        }
        return unique;
    }

    private static long sizeOf(Path path) {
        try {
            return Files.exists(path) ? Files.size(path) : 0L;
        } catch (IOException e) {
            throw new StateStorageException("Failed to stat intent log " + path, e);
        }
    }

    private PendingIntent parse(Path logPath, JsonLinesReader.Line line) {
        IntentRecord record;
        try {
            record = StateJson.fromLine(line.text(), IntentRecord.class);
            recordValidator.validate(record, "intent record");
        } catch (IOException | ValidationException e) {
            log.warn("[INTENT] Skipping malformed line at offset {} of {}: {}", line.startOffset(), logPath, e.getMessage());
            return null;
        }
        return new PendingIntent(record, line.startOffset(), line.endOffset());
    }
}
