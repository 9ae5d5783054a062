package com.botstate.snapshot;

import com.botstate.domain.model.DiagnosticDump;
import com.botstate.domain.model.IntentCursor;
import com.botstate.domain.model.PositionState;
import com.botstate.domain.model.SnapshotManifest;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import lombok.Builder;
import lombok.Value;

/**
 * State as found at HEAD, with documented defaults filled in for absent files.
 */
@Value
@Builder
public class RestoredSnapshot {

    /** HEAD at restore time; null when the namespace was empty. */
    String revision;

    byte[] ledger;
    PositionState positions;
    byte[] intents;
    IntentCursor intentCursor;

    @Builder.Default
    List<DiagnosticDump> diagnostics = new ArrayList<>();

    /** Manifest of the revision; null when absent or unreadable. */
    SnapshotManifest manifest;

    /** Bundle that persists exactly this state again. */
    public SnapshotBundle toBundle() {
        return SnapshotBundle.builder()
                .baseRevision(revision)
                .ledger(ledger)
                .positions(positions.copy())
                .intents(intents)
                .intentCursor(intentCursor)
                .diagnostics(new ArrayList<>(diagnostics))
                .recoveryStats(manifest != null && manifest.getRecoveryStats() != null
                        ? new TreeMap<>(manifest.getRecoveryStats())
                        : new TreeMap<>())
                .build();
    }
}
