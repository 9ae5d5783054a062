package com.botstate.unit.snapshot;

import static com.botstate.unit.StateFixtures.NOW;
import static com.botstate.unit.StateFixtures.lot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.botstate.config.SnapshotConfig;
import com.botstate.config.StorageConfig;
import com.botstate.domain.enums.PersistStatus;
import com.botstate.domain.model.DiagnosticDump;
import com.botstate.domain.model.IntentCursor;
import com.botstate.domain.model.PositionState;
import com.botstate.domain.model.SnapshotManifest;
import com.botstate.exception.ConflictException;
import com.botstate.exception.NotFoundException;
import com.botstate.exception.StateCorruptionException;
import com.botstate.exception.ValidationException;
import com.botstate.mapper.StateJson;
import com.botstate.snapshot.FileSystemSnapshotBackend;
import com.botstate.snapshot.PersistResult;
import com.botstate.snapshot.RestoredSnapshot;
import com.botstate.snapshot.SnapshotBundle;
import com.botstate.snapshot.SnapshotLayout;
import com.botstate.snapshot.SnapshotTransport;
import com.botstate.unit.StateFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;

@DisplayName("SnapshotTransport")
class SnapshotTransportTest {

    private static final byte[] LEDGER =
            "{\"code\":\"005930\",\"price\":70000,\"qty\":10,\"side\":\"BUY\",\"strategy_id\":\"momentum\",\"timestamp\":\"2024-05-01T09:00:00+09:00\"}\n"
                    .getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    private SnapshotConfig snapshotConfig;
    private StorageConfig storageConfig;
    private FileSystemSnapshotBackend backend;
    private SnapshotTransport transport;

    @BeforeEach
    void setUp() {
        snapshotConfig = StateFixtures.snapshotConfig(tempDir);
        storageConfig = StateFixtures.storageConfig(tempDir);
        backend = new FileSystemSnapshotBackend(snapshotConfig, StateFixtures.CLOCK);
        transport = new SnapshotTransport(
                backend, snapshotConfig, storageConfig, mock(ApplicationEventPublisher.class), StateFixtures.CLOCK);
    }

    private static PositionState oneLot() {
        PositionState state = PositionState.empty();
        state.putLot(lot("005930", "momentum", 10, "70000", NOW));
        state.putLot(lot("000660", "MANUAL", 5, "180000", NOW));
        state.setUpdatedAt(NOW);
        return state;
    }

    private SnapshotBundle bundle(String base, PositionState positions, byte[] ledger) {
        return SnapshotBundle.builder()
                .baseRevision(base)
                .positions(positions)
                .ledger(ledger)
                .intentCursor(IntentCursor.initial())
                .recoveryStats(Map.of("ledger", 1, "manual", 1))
                .build();
    }

    private String seed() {
        return transport.persist(bundle(null, oneLot(), LEDGER)).getRevision();
    }

    @Nested
    @DisplayName("Restore")
    class Restore {

        @Test
        @DisplayName("an empty namespace restores documented defaults into the working copy")
        void emptyNamespace() throws IOException {
            RestoredSnapshot restored = transport.restore();

            assertThat(restored.getRevision()).isNull();
            assertThat(restored.getLedger()).isEmpty();
            assertThat(restored.getIntents()).isEmpty();
            assertThat(restored.getIntentCursor()).isEqualTo(IntentCursor.initial());
            assertThat(restored.getPositions().getPositions()).isEmpty();
            assertThat(Files.size(storageConfig.ledgerFile())).isZero();
            assertThat(Files.exists(storageConfig.positionsFile())).isTrue();
        }

        @Test
        @DisplayName("restores HEAD's files and manifest")
        void restoresHead() throws IOException {
            String revision = seed();

            RestoredSnapshot restored = transport.restore();

            assertThat(restored.getRevision()).isEqualTo(revision);
            assertThat(restored.getLedger()).isEqualTo(LEDGER);
            assertThat(restored.getPositions()).isEqualTo(oneLot());
            assertThat(restored.getManifest().getCounts().getLots()).isEqualTo(2);
            assertThat(Files.readAllBytes(storageConfig.ledgerFile())).isEqualTo(LEDGER);
        }

        @Test
        @DisplayName("absent files fall back to their defaults")
        void absentFiles() {
            backend.commit(null, Map.of(SnapshotLayout.LEDGER, LEDGER), "partial");

            RestoredSnapshot restored = transport.restore();

            assertThat(restored.getLedger()).isEqualTo(LEDGER);
            assertThat(restored.getPositions()).isEqualTo(PositionState.empty());
            assertThat(restored.getIntentCursor().getOffset()).isZero();
            assertThat(restored.getManifest()).isNull();
        }

        @Test
        @DisplayName("a corrupt Position Store is reported and the working copy left alone")
        void corruptPositions() {
            backend.commit(null, Map.of(SnapshotLayout.POSITIONS, "{\"positions\":{}}".getBytes(StandardCharsets.UTF_8)), "corrupt");

            assertThatThrownBy(() -> transport.restore()).isInstanceOf(StateCorruptionException.class);
            assertThat(Files.exists(storageConfig.positionsFile())).isFalse();
        }

        @Test
        @DisplayName("a cursor beyond the intent log is reported")
        void cursorBeyondLog() {
            byte[] cursor = StateJson.toDocument(IntentCursor.builder().offset(50).build());
            backend.commit(null, Map.of(SnapshotLayout.INTENT_CURSOR, cursor), "cursor");

            assertThatThrownBy(() -> transport.restore()).isInstanceOf(StateCorruptionException.class);
        }
    }

    @Nested
    @DisplayName("Persist")
    class Persist {

        @Test
        @DisplayName("restore then persist with no mutation reports no changes")
        void roundTripIsNoop() {
            String revision = seed();

            PersistResult result = transport.persist(transport.restore().toBundle());

            assertThat(result.getStatus()).isEqualTo(PersistStatus.NO_CHANGES);
            assertThat(result.getRevision()).isEqualTo(revision);
            assertThat(backend.headRevision()).contains(revision);
        }

        @Test
        @DisplayName("default state on an empty namespace commits nothing")
        void defaultsOnEmptyNamespace() {
            PersistResult result = transport.persist(transport.restore().toBundle());

            assertThat(result.getStatus()).isEqualTo(PersistStatus.NO_CHANGES);
            assertThat(backend.headRevision()).isEmpty();
        }

        @Test
        @DisplayName("commits changed state with a regenerated manifest")
        void commitsWithManifest() throws IOException {
            PersistResult result = transport.persist(bundle(null, oneLot(), LEDGER));

            assertThat(result.isCommitted()).isTrue();
            assertThat(result.getChangedPaths()).containsExactly(SnapshotLayout.LEDGER, SnapshotLayout.POSITIONS);
            Map<String, byte[]> tree = backend.readTree(result.getRevision());
            assertThat(tree).containsKeys(SnapshotLayout.MANIFEST, SnapshotLayout.POSITIONS, SnapshotLayout.LEDGER,
                    SnapshotLayout.INTENTS, SnapshotLayout.INTENT_CURSOR);

            SnapshotManifest manifest = StateJson.fromDocument(tree.get(SnapshotLayout.MANIFEST), SnapshotManifest.class);
            assertThat(manifest.getRunId()).isEqualTo("test-run");
            assertThat(manifest.getCommitSha()).isEqualTo("abc1234");
            assertThat(manifest.getCounts().getLots()).isEqualTo(2);
            assertThat(manifest.getCounts().getManual()).isEqualTo(1);
            assertThat(manifest.getCounts().getUnknown()).isZero();
            assertThat(manifest.getRecoveryStats()).containsEntry("ledger", 1);
            assertThat(manifest.getFiles()).extracting(SnapshotManifest.FileEntry::getPath).contains(SnapshotLayout.LEDGER);
            assertThat(new String(tree.get(SnapshotLayout.MANIFEST), StandardCharsets.UTF_8)).contains("\"n_lots\" : 2");
        }

        @Test
        @DisplayName("the second of two persists from the same restore conflicts and the first stays visible")
        void conflict() {
            String base = seed();
            RestoredSnapshot restored = transport.restore();

            PositionState first = restored.getPositions().copy();
            first.putLot(lot("035720", "swing", 3, "52000", NOW));
            PositionState second = restored.getPositions().copy();
            second.putLot(lot("068270", "swing", 2, "190000", NOW));

            PersistResult winner = transport.persist(bundle(base, first, restored.getLedger()));
            assertThatThrownBy(() -> transport.persist(bundle(base, second, restored.getLedger())))
                    .isInstanceOf(ConflictException.class);

            assertThat(backend.headRevision()).contains(winner.getRevision());
            RestoredSnapshot after = transport.restore();
            assertThat(after.getPositions().lotsFor("035720")).hasSize(1);
            assertThat(after.getPositions().lotsFor("068270")).isEmpty();
        }

        @Test
        @DisplayName("an unchanged bundle on a moved HEAD conflicts rather than reporting no changes")
        void unchangedOnMovedHead() {
            String base = seed();
            RestoredSnapshot restored = transport.restore();
            PositionState moved = restored.getPositions().copy();
            moved.putLot(lot("035720", "swing", 3, "52000", NOW));
            String head = transport.persist(bundle(base, moved, restored.getLedger())).getRevision();

            assertThatThrownBy(() -> transport.persist(restored.toBundle())).isInstanceOf(ConflictException.class);

            assertThat(backend.headRevision()).contains(head);
        }

        @Test
        @DisplayName("a base revision pruned by later commits is reported as a conflict")
        void prunedBaseConflicts() {
            snapshotConfig.setRevisionHistory(1);
            String stale = seed();
            String head = stale;
            for (int i = 1; i <= 3; i++) {
                PositionState next = oneLot();
                next.putLot(lot("03572" + i, "swing", i, "52000", NOW));
                head = transport.persist(bundle(head, next, LEDGER)).getRevision();
            }
            assertThatThrownBy(() -> backend.readTree(stale)).isInstanceOf(NotFoundException.class);

            PositionState late = oneLot();
            late.putLot(lot("068270", "swing", 2, "190000", NOW));
            assertThatThrownBy(() -> transport.persist(bundle(stale, late, LEDGER)))
                    .isInstanceOf(ConflictException.class);

            assertThat(backend.headRevision()).contains(head);
        }

        @Test
        @DisplayName("keeps only the newest diagnostics within retention")
        void diagnosticsRetention() {
            snapshotConfig.setDiagnosticsRetention(3);
            List<DiagnosticDump> dumps = new ArrayList<>();
            for (int minute = 0; minute < 5; minute++) {
                dumps.add(new DiagnosticDump(
                        SnapshotLayout.diagnosticName(NOW.plusMinutes(minute)), "{}\n".getBytes(StandardCharsets.UTF_8)));
            }
            SnapshotBundle withDumps = SnapshotBundle.builder()
                    .positions(oneLot())
                    .diagnostics(dumps)
                    .recoveryStats(new TreeMap<>())
                    .build();

            PersistResult result = transport.persist(withDumps);

            assertThat(backend.readTree(result.getRevision()).keySet())
                    .filteredOn(SnapshotLayout::isDiagnostic)
                    .containsExactly(
                            "diagnostics/diag_20240502_100200.json",
                            "diagnostics/diag_20240502_100300.json",
                            "diagnostics/diag_20240502_100400.json");
        }

        @Test
        @DisplayName("refuses to stage files outside the layout")
        void forbiddenPath() {
            SnapshotBundle bundle = SnapshotBundle.builder()
                    .positions(oneLot())
                    .diagnostics(List.of(new DiagnosticDump(".env", new byte[0])))
                    .build();

            assertThatThrownBy(() -> transport.persist(bundle)).isInstanceOf(ValidationException.class);
            assertThat(backend.headRevision()).isEmpty();
        }
    }
}
