package com.botstate.domain.model;

import com.botstate.domain.enums.MismatchType;
import com.botstate.domain.enums.RecoverySource;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.Builder;
import lombok.Data;

/**
 * Result of one reconciliation pass of the Position Store against the broker balance.
 *
 * <p>Each run records the trigger, position counts on both sides, every mismatch and how
 * it was resolved, how many untracked holdings were attributed from each recovery
 * source, and timing. The reconciled state itself travels with the result so the caller
 * can install it only when the whole pass succeeded.
 */
@Data
@Builder
public class ReconciliationResult {

    private OffsetDateTime timestamp;
    private String trigger;

    private int brokerPositionCount;
    private int localPositionCount;

    @Builder.Default
    private List<PositionMismatch> mismatches = new ArrayList<>();

    private int lotsCreated;
    private int lotsRemoved;
    private int lotsSynced;
    private int warnings;

    @Builder.Default
    private Map<RecoverySource, Integer> recoveryStats = new EnumMap<>(RecoverySource.class);

    private long durationMs;

    /** Reconciled Position Store; null when the pass was aborted. */
    private PositionState reconciledState;

    public boolean hasMismatches() {
        return mismatches != null && !mismatches.isEmpty();
    }

    public int getTotalMismatches() {
        return mismatches != null ? mismatches.size() : 0;
    }

    public long countOf(MismatchType type) {
        return mismatches.stream().filter(m -> m.getType() == type).count();
    }

    public void recordRecovery(RecoverySource source) {
        recoveryStats.merge(source, 1, Integer::sum);
    }

    /** Recovery statistics keyed by lower-case source name, as written to the manifest. */
    public Map<String, Integer> recoveryStatsForManifest() {
        Map<String, Integer> stats = new TreeMap<>();
        recoveryStats.forEach((source, count) -> stats.put(source.name().toLowerCase(), count));
        return stats;
    }
}
