package com.botstate.observability;

import com.botstate.domain.model.PositionMismatch;
import com.botstate.domain.model.ReconciliationResult;
import com.botstate.event.ReconciliationEvent;
import com.botstate.event.SnapshotPersistedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the state layer, driven by application events:
 * <ul>
 *   <li><b>reconciliation.runs</b> (counter): completed reconciliation passes</li>
 *   <li><b>reconciliation.mismatches</b> (counter, tag type): mismatches found</li>
 *   <li><b>reconciliation.recovered</b> (counter, tag source): lots attributed per recovery source</li>
 *   <li><b>snapshot.commits</b> / <b>snapshot.noops</b> / <b>snapshot.conflicts</b> (counters)</li>
 * </ul>
 */
@Service
public class StateMetricsService {

    private static final Logger log = LoggerFactory.getLogger(StateMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter reconciliationRunsCounter;
    private final Counter snapshotCommitsCounter;
    private final Counter snapshotNoopsCounter;
    private final Counter snapshotConflictsCounter;

    public StateMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.reconciliationRunsCounter = Counter.builder("reconciliation.runs")
                .description("Completed reconciliation passes against the broker balance")
                .register(meterRegistry);

        this.snapshotCommitsCounter = Counter.builder("snapshot.commits")
                .description("Snapshot revisions committed")
                .register(meterRegistry);

        this.snapshotNoopsCounter = Counter.builder("snapshot.noops")
                .description("Persists that found nothing to commit")
                .register(meterRegistry);

        this.snapshotConflictsCounter = Counter.builder("snapshot.conflicts")
                .description("Persists rejected because HEAD moved")
                .register(meterRegistry);

        log.info("State metrics registered");
    }

    @EventListener
    public void onReconciliation(ReconciliationEvent event) {
        ReconciliationResult result = event.getResult();
        reconciliationRunsCounter.increment();
        for (PositionMismatch mismatch : result.getMismatches()) {
            meterRegistry.counter("reconciliation.mismatches", "type", mismatch.getType().name()).increment();
        }
        result.getRecoveryStats().forEach((source, count) -> meterRegistry
                .counter("reconciliation.recovered", "source", source.name())
                .increment(count));
    }

    @EventListener
    public void onSnapshotPersisted(SnapshotPersistedEvent event) {
        if (event.isConflict()) {
            snapshotConflictsCounter.increment();
        } else if (event.getStatus() != null) {
            switch (event.getStatus()) {
                case COMMITTED -> snapshotCommitsCounter.increment();
                case NO_CHANGES -> snapshotNoopsCounter.increment();
            }
        }
    }
}
