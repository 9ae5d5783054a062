package com.botstate.unit.intent;

import static com.botstate.unit.StateFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.botstate.domain.enums.Side;
import com.botstate.domain.model.IntentCursor;
import com.botstate.domain.model.IntentRecord;
import com.botstate.domain.model.PendingIntent;
import com.botstate.exception.StateCorruptionException;
import com.botstate.exception.ValidationException;
import com.botstate.intent.IntentLog;
import com.botstate.unit.StateFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("IntentLog")
class IntentLogTest {

    @TempDir
    Path tempDir;

    private IntentLog intentLog;

    @BeforeEach
    void setUp() {
        intentLog = new IntentLog(StateFixtures.storageConfig(tempDir), StateFixtures.recordValidator());
    }

    private static IntentRecord intent(String id, String code) {
        return IntentRecord.builder()
                .intentId(id)
                .ts(NOW)
                .strategyId("momentum")
                .code(code)
                .side(Side.BUY)
                .qtyHint(10)
                .rationale("breakout")
                .build();
    }

    private List<PendingIntent> pending(IntentCursor cursor) {
        try (Stream<PendingIntent> intents = intentLog.readSince(cursor)) {
            return intents.toList();
        }
    }

    @Nested
    @DisplayName("Append and read")
    class AppendAndRead {

        @Test
        @DisplayName("reads every intent from the initial cursor in append order")
        void readsFromStart() {
            intentLog.append(intent("i-1", "005930"));
            intentLog.append(intent("i-2", "000660"));

            List<PendingIntent> pending = pending(IntentCursor.initial());

            assertThat(pending).extracting(p -> p.getRecord().getIntentId()).containsExactly("i-1", "i-2");
            assertThat(pending.get(0).getStartOffset()).isZero();
            assertThat(pending.get(1).getStartOffset()).isEqualTo(pending.get(0).getEndOffset());
        }

        @Test
        @DisplayName("returns the end offset of the appended record")
        void appendReturnsEndOffset() throws IOException {
            long end = intentLog.append(intent("i-1", "005930"));

            assertThat(end).isEqualTo(Files.size(intentLog.path()));
        }

        @Test
        @DisplayName("rejects an intent without id or with a bad code")
        void rejectsInvalid() {
            assertThatThrownBy(() -> intentLog.append(intent(" ", "005930"))).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> intentLog.append(intent("i-1", "ABCDEF"))).isInstanceOf(ValidationException.class);
            assertThat(pending(IntentCursor.initial())).isEmpty();
        }

        @Test
        @DisplayName("does not yield a torn trailing line")
        void tornTrailingLine() throws IOException {
            intentLog.append(intent("i-1", "005930"));
            Files.writeString(intentLog.path(), "{\"intent_id\":\"i-2\"", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

            assertThat(pending(IntentCursor.initial())).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Cursor")
    class Cursor {

        @Test
        @DisplayName("defaults to offset 0 when no cursor file exists")
        void defaultCursor() {
            assertThat(intentLog.loadCursor()).isEqualTo(IntentCursor.initial());
        }

        @Test
        @DisplayName("advance moves past the processed intent and persists the cursor")
        void advance() {
            intentLog.append(intent("i-1", "005930"));
            intentLog.append(intent("i-2", "000660"));
            PendingIntent first = pending(IntentCursor.initial()).get(0);

            IntentCursor cursor = intentLog.advance(IntentCursor.initial(), first);

            assertThat(cursor.getOffset()).isEqualTo(first.getEndOffset());
            assertThat(cursor.getLastIntentId()).isEqualTo("i-1");
            assertThat(intentLog.loadCursor()).isEqualTo(cursor);
            assertThat(pending(cursor)).extracting(p -> p.getRecord().getIntentId()).containsExactly("i-2");
        }

        @Test
        @DisplayName("refuses to move the cursor backwards")
        void refusesBackwards() {
            intentLog.append(intent("i-1", "005930"));
            intentLog.append(intent("i-2", "000660"));
            List<PendingIntent> all = pending(IntentCursor.initial());
            IntentCursor cursor = intentLog.advance(IntentCursor.initial(), all.get(1));

            assertThatThrownBy(() -> intentLog.advance(cursor, all.get(0))).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("reports a corrupt cursor file instead of resetting it")
        void corruptCursor() throws IOException {
            Files.createDirectories(intentLog.cursorPath().getParent());
            Files.writeString(intentLog.cursorPath(), "{\"offset\":");

            assertThatThrownBy(() -> intentLog.loadCursor()).isInstanceOf(StateCorruptionException.class);
        }

        @Test
        @DisplayName("reports a cursor pointing past the end of the log")
        void cursorPastEnd() {
            intentLog.append(intent("i-1", "005930"));
            IntentCursor beyond = IntentCursor.builder().offset(10_000).build();

            assertThatThrownBy(() -> intentLog.readSince(beyond)).isInstanceOf(StateCorruptionException.class);
        }
    }

    @Test
    @DisplayName("dedupe keeps the first occurrence of each intent id")
    void dedupe() {
        IntentRecord first = intent("i-1", "005930");
        IntentRecord repeat = intent("i-1", "000660");
        IntentRecord other = intent("i-2", "035720");

        assertThat(IntentLog.dedupe(List.of(first, repeat, other))).containsExactly(first, other);
    }
}
