package com.botstate.event;

import com.botstate.domain.model.ReconciliationResult;
import java.time.OffsetDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every reconciliation run that completed and was installed into the
 * Position Store.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>StateMetricsService: counts mismatches and recovered lots</li>
 *   <li>StateSessionService: keeps the result for the diagnostics dump</li>
 * </ul>
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationResult result;
    private final OffsetDateTime reconciledAt;

    /**
     * @param source the component publishing this event
     * @param result the reconciliation result with mismatches and recovery statistics
     */
    public ReconciliationEvent(Object source, ReconciliationResult result) {
        super(source);
        this.result = result;
        this.reconciledAt = result.getTimestamp();
    }

    public ReconciliationResult getResult() {
        return result;
    }

    public OffsetDateTime getReconciledAt() {
        return reconciledAt;
    }
}
