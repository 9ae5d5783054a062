package com.botstate.session;

import com.botstate.domain.model.DiagnosticDump;
import com.botstate.domain.model.PositionMismatch;
import com.botstate.domain.model.ReconciliationResult;
import com.botstate.exception.StateStorageException;
import com.botstate.intent.IntentLog;
import com.botstate.io.AtomicFiles;
import com.botstate.ledger.Ledger;
import com.botstate.mapper.StateJson;
import com.botstate.position.PositionStore;
import com.botstate.reconciliation.PositionReconciliationService;
import com.botstate.snapshot.PersistResult;
import com.botstate.snapshot.RestoredSnapshot;
import com.botstate.snapshot.SnapshotBundle;
import com.botstate.snapshot.SnapshotLayout;
import com.botstate.snapshot.SnapshotTransport;
import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives one run of the bot against its persisted state.
 *
 * <p>A run is:
 * <ol>
 *   <li>{@link #open()}: restore HEAD into the working copy and load the Position Store</li>
 *   <li>{@link #reconcile}: bring the store in line with the broker balance</li>
 *   <li>strategies read and write through the Position Store and Intent Log</li>
 *   <li>{@link #close()}: persist the working copy on top of the restored revision</li>
 * </ol>
 * Only one session is open at a time; the scheduler guarantees a single run per account.
 */
@Service
public class StateSessionService {

    private static final Logger log = LoggerFactory.getLogger(StateSessionService.class);

    private final SnapshotTransport snapshotTransport;
    private final PositionStore positionStore;
    private final Ledger ledger;
    private final IntentLog intentLog;
    private final PositionReconciliationService positionReconciliationService;
    private final Clock clock;

    private RestoredSnapshot base;
    private List<DiagnosticDump> diagnostics = new ArrayList<>();
    private ReconciliationResult lastReconciliation;

    public StateSessionService(
            SnapshotTransport snapshotTransport,
            PositionStore positionStore,
            Ledger ledger,
            IntentLog intentLog,
            PositionReconciliationService positionReconciliationService,
            Clock clock) {
        this.snapshotTransport = snapshotTransport;
        this.positionStore = positionStore;
        this.ledger = ledger;
        this.intentLog = intentLog;
        this.positionReconciliationService = positionReconciliationService;
        this.clock = clock;
    }

    /** Restores the latest snapshot into the working copy. */
    public RestoredSnapshot open() {
        if (base != null) {
            throw new IllegalStateException("Session already open on revision " + base.getRevision());
        }
        RestoredSnapshot restored = snapshotTransport.restore();
        positionStore.load();
        base = restored;
        diagnostics = new ArrayList<>(restored.getDiagnostics());
        lastReconciliation = null;
        log.info("[SESSION] Opened on revision {}", restored.getRevision());
        return restored;
    }

    public ReconciliationResult reconcile(Set<String> rebalanceTargets) {
        requireOpen();
        lastReconciliation = positionReconciliationService.reconcile("SESSION", rebalanceTargets);
        return lastReconciliation;
    }

    /** Adds a diagnostics dump of the reconciliation to the snapshot. */
    public DiagnosticDump recordDiagnostics(ReconciliationResult result) {
        requireOpen();
        OffsetDateTime now = OffsetDateTime.now(clock);
        DiagnosticDump dump = new DiagnosticDump(SnapshotLayout.diagnosticName(now), StateJson.toDocument(report(result, now)));
        diagnostics.removeIf(existing -> existing.getName().equals(dump.getName()));
        diagnostics.add(dump);
        return dump;
    }

    /** Persists the working copy and ends the session, whatever the outcome. */
    public PersistResult close() {
        requireOpen();
        try {
            SnapshotBundle bundle = SnapshotBundle.builder()
                    .baseRevision(base.getRevision())
                    .ledger(AtomicFiles.readOrEmpty(ledger.path()))
                    .positions(positionStore.current())
                    .intents(AtomicFiles.readOrEmpty(intentLog.path()))
                    .intentCursor(intentLog.loadCursor())
                    .diagnostics(new ArrayList<>(diagnostics))
                    .recoveryStats(lastReconciliation != null
                            ? lastReconciliation.recoveryStatsForManifest()
                            : new TreeMap<>())
                    .build();
            PersistResult result = snapshotTransport.persist(bundle);
            log.info("[SESSION] Closed: {} at revision {}", result.getStatus(), result.getRevision());
            return result;
        } catch (IOException e) {
            throw new StateStorageException("Failed to read the working copy for persist", e);
        } finally {
            reset();
        }
    }

    /** Drops the session without persisting. */
    public void abort() {
        if (base != null) {
            log.warn("[SESSION] Aborted session on revision {}", base.getRevision());
        }
        reset();
    }

    public boolean isOpen() {
        return base != null;
    }

    /**
     * Full cycle: open, reconcile, record diagnostics, close. A failure before the persist
     * aborts the session and propagates; nothing is committed.
     */
    public SessionCycleResult runCycle(Set<String> rebalanceTargets) {
        long startTime = clock.millis();
        RestoredSnapshot restored = open();
        ReconciliationResult reconciliation;
        try {
            reconciliation = reconcile(rebalanceTargets);
            recordDiagnostics(reconciliation);
        } catch (RuntimeException e) {
            abort();
            throw e;
        }
        PersistResult persist = close();
        return SessionCycleResult.builder()
                .baseRevision(restored.getRevision())
                .reconciliation(reconciliation)
                .persist(persist)
                .durationMs(clock.millis() - startTime)
                .build();
    }

    private static Map<String, Object> report(ReconciliationResult result, OffsetDateTime now) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("generated_at", now);
        report.put("trigger", result.getTrigger());
        report.put("reconciled_at", result.getTimestamp());
        report.put("broker_positions", result.getBrokerPositionCount());
        report.put("local_positions", result.getLocalPositionCount());
        report.put("lots_created", result.getLotsCreated());
        report.put("lots_removed", result.getLotsRemoved());
        report.put("lots_synced", result.getLotsSynced());
        report.put("warnings", result.getWarnings());
        report.put("recovery_stats", result.recoveryStatsForManifest());
        List<Map<String, Object>> mismatches = new ArrayList<>();
        for (PositionMismatch mismatch : result.getMismatches()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("code", mismatch.getCode());
            row.put("sid", mismatch.getSid());
            row.put("type", mismatch.getType());
            row.put("broker_qty", mismatch.getBrokerQuantity());
            row.put("local_qty", mismatch.getLocalQuantity());
            row.put("recovery_source", mismatch.getRecoverySource());
            row.put("resolved", mismatch.isResolved());
            row.put("detail", mismatch.getResolutionDetail());
            mismatches.add(row);
        }
        report.put("mismatches", mismatches);
        return report;
    }

    private void requireOpen() {
        if (base == null) {
            throw new IllegalStateException("No open session; call open() first");
        }
    }

    private void reset() {
        base = null;
        diagnostics = new ArrayList<>();
        lastReconciliation = null;
    }
}
