package com.botstate.session;

import com.botstate.domain.model.ReconciliationResult;
import com.botstate.snapshot.PersistResult;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one restore, reconcile and persist cycle.
 */
@Data
@Builder
public class SessionCycleResult {

    private String baseRevision;
    private ReconciliationResult reconciliation;
    private PersistResult persist;
    private long durationMs;
}
