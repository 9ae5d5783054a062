package com.botstate.snapshot;

import com.botstate.config.SnapshotConfig;
import com.botstate.config.StorageConfig;
import com.botstate.domain.enums.PersistStatus;
import com.botstate.domain.model.Attribution;
import com.botstate.domain.model.DiagnosticDump;
import com.botstate.domain.model.IntentCursor;
import com.botstate.domain.model.PositionLot;
import com.botstate.domain.model.PositionState;
import com.botstate.domain.model.SnapshotManifest;
import com.botstate.event.SnapshotPersistedEvent;
import com.botstate.exception.ConflictException;
import com.botstate.exception.NotFoundException;
import com.botstate.exception.StateCorruptionException;
import com.botstate.exception.StateStorageException;
import com.botstate.exception.ValidationException;
import com.botstate.intent.IntentLog;
import com.botstate.io.AtomicFiles;
import com.botstate.mapper.StateJson;
import com.botstate.position.PositionStore;
import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Moves the bot's state between the working copy and the versioned snapshot namespace.
 *
 * <p>{@link #restore()} reads HEAD and rebuilds the working copy from it, substituting
 * documented defaults for absent files. {@link #persist} stages the current state,
 * prunes diagnostics, and commits only when something changed relative to the revision
 * the run restored from. Concurrent runs are resolved by compare-and-set on HEAD: the
 * loser gets a {@link ConflictException} and its state is not written.
 */
@Service
public class SnapshotTransport {

    private static final Logger log = LoggerFactory.getLogger(SnapshotTransport.class);

    private final SnapshotBackend snapshotBackend;
    private final SnapshotConfig snapshotConfig;
    private final StorageConfig storageConfig;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public SnapshotTransport(
            SnapshotBackend snapshotBackend,
            SnapshotConfig snapshotConfig,
            StorageConfig storageConfig,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.snapshotBackend = snapshotBackend;
        this.snapshotConfig = snapshotConfig;
        this.storageConfig = storageConfig;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    /**
     * Reads HEAD and writes its state files into the working copy.
     *
     * @throws StateCorruptionException if the Position Store or cursor at HEAD is corrupt;
     *     the working copy is left as it was
     */
    public RestoredSnapshot restore() {
        String revision = snapshotBackend.headRevision().orElse(null);
        Map<String, byte[]> tree = revision != null ? snapshotBackend.readTree(revision) : Map.of();
        if (revision == null) {
            log.warn("[SNAPSHOT] Namespace is empty, restoring defaults");
        }

        byte[] ledger = fileOrDefault(tree, SnapshotLayout.LEDGER);
        byte[] intents = fileOrDefault(tree, SnapshotLayout.INTENTS);
        PositionState positions = tree.containsKey(SnapshotLayout.POSITIONS)
                ? PositionStore.parse(SnapshotLayout.POSITIONS, tree.get(SnapshotLayout.POSITIONS))
                : PositionState.empty();
        IntentCursor cursor = tree.containsKey(SnapshotLayout.INTENT_CURSOR)
                ? IntentLog.parseCursor(SnapshotLayout.INTENT_CURSOR, tree.get(SnapshotLayout.INTENT_CURSOR))
                : IntentCursor.initial();
        if (cursor.getOffset() > intents.length) {
            throw new StateCorruptionException(
                    SnapshotLayout.INTENT_CURSOR,
                    "offset " + cursor.getOffset() + " is past the end of the intent log (" + intents.length + " bytes)");
        }
        logMissing(tree, revision);

        List<DiagnosticDump> diagnostics = new ArrayList<>();
        tree.forEach((path, content) -> {
            if (SnapshotLayout.isDiagnostic(path)) {
                diagnostics.add(new DiagnosticDump(path.substring(SnapshotLayout.DIAGNOSTICS_DIR.length()), content));
            }
        });
        diagnostics.sort(Comparator.comparing(DiagnosticDump::getName));

        try {
            AtomicFiles.write(storageConfig.ledgerFile(), ledger);
            AtomicFiles.write(storageConfig.intentsFile(), intents);
            AtomicFiles.write(storageConfig.intentCursorFile(), StateJson.toDocument(cursor));
            AtomicFiles.write(storageConfig.positionsFile(), PositionStore.serialize(positions));
        } catch (IOException e) {
            throw new StateStorageException("Failed to write restored state into " + storageConfig.getWorkingDirectory(), e);
        }

        log.info(
                "[SNAPSHOT] Restored revision {}: {} lots, ledger {} bytes, intents {} bytes, cursor offset {}, {} diagnostics",
                revision,
                positions.getPositions().size(),
                ledger.length,
                intents.length,
                cursor.getOffset(),
                diagnostics.size());

        return RestoredSnapshot.builder()
                .revision(revision)
                .ledger(ledger)
                .positions(positions)
                .intents(intents)
                .intentCursor(cursor)
                .diagnostics(diagnostics)
                .manifest(readManifest(tree))
                .build();
    }

    /**
     * Commits the bundle on top of its base revision.
     *
     * @return NO_CHANGES when every state file equals the base revision, else COMMITTED
     * @throws ConflictException if HEAD is no longer the bundle's base revision, checked
     *     before the diff and again at the HEAD swap
     */
    public PersistResult persist(SnapshotBundle bundle) {
        Map<String, byte[]> staged = stage(bundle);
        String base = bundle.getBaseRevision();
        String head = snapshotBackend.headRevision().orElse(null);
        if (!Objects.equals(head, base)) {
            throw rejected(base, new ConflictException(base, head));
        }
        Map<String, byte[]> baseTree;
        try {
            baseTree = base != null ? snapshotBackend.readTree(base) : Map.of();
        } catch (NotFoundException e) {
            // pruned by a writer that got in after the HEAD check
            throw rejected(base, new ConflictException(base, snapshotBackend.headRevision().orElse(null)));
        }

        List<String> changed = changedPaths(staged, baseTree);
        if (changed.isEmpty()) {
            log.info("[SNAPSHOT] No changes relative to {}, nothing committed", base);
            applicationEventPublisher.publishEvent(new SnapshotPersistedEvent(this, PersistStatus.NO_CHANGES, base, false));
            return PersistResult.builder()
                    .status(PersistStatus.NO_CHANGES)
                    .revision(base)
                    .changedPaths(changed)
                    .build();
        }

        SnapshotManifest manifest = buildManifest(bundle, staged);
        staged.put(SnapshotLayout.MANIFEST, StateJson.toDocument(manifest));

        String revision;
        try {
            revision = snapshotBackend.commit(base, staged, "bot-state update run=" + snapshotConfig.getRunId() + " at " + manifest.getUpdatedAt());
        } catch (ConflictException e) {
            throw rejected(base, e);
        }

        log.info("[SNAPSHOT] Committed revision {} (base {}), changed={}", revision, base, changed);
        applicationEventPublisher.publishEvent(new SnapshotPersistedEvent(this, PersistStatus.COMMITTED, revision, false));
        return PersistResult.builder()
                .status(PersistStatus.COMMITTED)
                .revision(revision)
                .changedPaths(changed)
                .manifest(manifest)
                .build();
    }

    private ConflictException rejected(String base, ConflictException e) {
        log.warn("[SNAPSHOT] Persist rejected, HEAD moved since {}: {}", base, e.getMessage());
        applicationEventPublisher.publishEvent(new SnapshotPersistedEvent(this, null, base, true));
        return e;
    }

    private Map<String, byte[]> stage(SnapshotBundle bundle) {
        PositionState positions = bundle.getPositions() != null ? bundle.getPositions() : PositionState.empty();
        IntentCursor cursor = bundle.getIntentCursor() != null ? bundle.getIntentCursor() : IntentCursor.initial();

        Map<String, byte[]> staged = new TreeMap<>();
        staged.put(SnapshotLayout.POSITIONS, PositionStore.serialize(positions));
        staged.put(SnapshotLayout.LEDGER, bundle.getLedger() != null ? bundle.getLedger() : new byte[0]);
        staged.put(SnapshotLayout.INTENTS, bundle.getIntents() != null ? bundle.getIntents() : new byte[0]);
        staged.put(SnapshotLayout.INTENT_CURSOR, StateJson.toDocument(cursor));

        List<DiagnosticDump> kept = retainDiagnostics(bundle.getDiagnostics());
        for (DiagnosticDump dump : kept) {
            staged.put(SnapshotLayout.DIAGNOSTICS_DIR + dump.getName(), dump.getContent());
        }

        for (String path : staged.keySet()) {
            if (!SnapshotLayout.isAllowed(path)) {
                throw new ValidationException("Refusing to stage path outside the snapshot layout: " + path);
            }
        }
        return staged;
    }

    /** Newest dumps by name, up to the configured retention. */
    private List<DiagnosticDump> retainDiagnostics(List<DiagnosticDump> diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            return List.of();
        }
        Map<String, DiagnosticDump> byName = new TreeMap<>(Comparator.reverseOrder());
        for (DiagnosticDump dump : diagnostics) {
            byName.putIfAbsent(dump.getName(), dump);
        }
        List<DiagnosticDump> kept = byName.values().stream()
                .limit(Math.max(0, snapshotConfig.getDiagnosticsRetention()))
                .toList();
        if (kept.size() < byName.size()) {
            log.info("[SNAPSHOT] Pruned {} diagnostics beyond retention {}", byName.size() - kept.size(), snapshotConfig.getDiagnosticsRetention());
        }
        return kept;
    }

    /**
     * Paths whose staged content differs from the base. The manifest is ignored; a state
     * file absent from the base counts as unchanged while it still holds its default.
     */
    private static List<String> changedPaths(Map<String, byte[]> staged, Map<String, byte[]> baseTree) {
        TreeSet<String> paths = new TreeSet<>(staged.keySet());
        paths.addAll(baseTree.keySet());
        paths.remove(SnapshotLayout.MANIFEST);

        List<String> changed = new ArrayList<>();
        for (String path : paths) {
            byte[] before = baseTree.get(path);
            byte[] after = staged.get(path);
            if (before == null && after != null && SnapshotLayout.STATE_FILES.contains(path)) {
                before = defaultContent(path);
            }
            if (before == null || after == null || !Arrays.equals(before, after)) {
                changed.add(path);
            }
        }
        return changed;
    }

    private static byte[] defaultContent(String path) {
        return switch (path) {
            case SnapshotLayout.POSITIONS -> PositionStore.serialize(PositionState.empty());
            case SnapshotLayout.INTENT_CURSOR -> StateJson.toDocument(IntentCursor.initial());
            default -> new byte[0];
        };
    }

    private SnapshotManifest buildManifest(SnapshotBundle bundle, Map<String, byte[]> staged) {
        int lots = 0;
        int unknown = 0;
        int manual = 0;
        if (bundle.getPositions() != null) {
            for (PositionLot lot : bundle.getPositions().getPositions().values()) {
                lots++;
                if (lot.attribution().isEmpty()) {
                    unknown++;
                } else if (Attribution.MANUAL_SID.equals(lot.getSid())) {
                    manual++;
                }
            }
        }
        List<SnapshotManifest.FileEntry> files = new ArrayList<>();
        staged.forEach((path, content) -> files.add(new SnapshotManifest.FileEntry(path, content.length)));
        return SnapshotManifest.builder()
                .schemaVersion(SnapshotManifest.SCHEMA_VERSION)
                .updatedAt(OffsetDateTime.now(clock))
                .runId(snapshotConfig.getRunId())
                .commitSha(snapshotConfig.getCommitSha())
                .counts(new SnapshotManifest.Counts(lots, unknown, manual))
                .files(files)
                .recoveryStats(bundle.getRecoveryStats() != null ? new TreeMap<>(bundle.getRecoveryStats()) : new TreeMap<>())
                .build();
    }

    private static byte[] fileOrDefault(Map<String, byte[]> tree, String path) {
        byte[] content = tree.get(path);
        return content != null ? content : new byte[0];
    }

    private static void logMissing(Map<String, byte[]> tree, String revision) {
        if (revision == null) {
            return;
        }
        for (String path : SnapshotLayout.STATE_FILES) {
            if (!tree.containsKey(path)) {
                log.warn("[SNAPSHOT] {} missing at revision {}, using its default", path, revision);
            }
        }
    }

    private static SnapshotManifest readManifest(Map<String, byte[]> tree) {
        byte[] content = tree.get(SnapshotLayout.MANIFEST);
        if (content == null) {
            return null;
        }
        try {
            return StateJson.fromDocument(content, SnapshotManifest.class);
        } catch (IOException e) {
            log.warn("[SNAPSHOT] Ignoring unreadable manifest: {}", e.getMessage());
            return null;
        }
    }
}
