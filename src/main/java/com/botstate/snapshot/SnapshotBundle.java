package com.botstate.snapshot;

import com.botstate.domain.model.DiagnosticDump;
import com.botstate.domain.model.IntentCursor;
import com.botstate.domain.model.PositionState;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a persist writes: the four state files, the diagnostics to keep, and the
 * revision the run started from.
 */
@Value
@Builder
public class SnapshotBundle {

    /** Revision returned by the restore this run is based on; null if none existed. */
    String baseRevision;

    @Builder.Default
    byte[] ledger = new byte[0];

    PositionState positions;

    @Builder.Default
    byte[] intents = new byte[0];

    IntentCursor intentCursor;

    @Builder.Default
    List<DiagnosticDump> diagnostics = new ArrayList<>();

    /** Lots attributed per recovery source in this run, lower-case keys. */
    @Builder.Default
    Map<String, Integer> recoveryStats = new TreeMap<>();
}
