package com.botstate.reconciliation;

import com.botstate.config.ReconcileConfig;
import com.botstate.domain.enums.AttributionKind;
import com.botstate.domain.enums.RecoverySource;
import com.botstate.domain.model.Attribution;
import com.botstate.domain.model.LedgerEntry;
import com.botstate.domain.model.PositionMemory;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides who owns a holding the Position Store does not track.
 *
 * <p>Sources are tried in a fixed order and the first usable one wins:
 * <ol>
 *   <li>the latest ledger BUY of the code (strategy id and meta.engine)</li>
 *   <li>membership in today's rebalance target set (bucket {@code REB_yyyyMMdd})</li>
 *   <li>memory.last_strategy_id, when enabled and parseable</li>
 *   <li>MANUAL</li>
 * </ol>
 * A placeholder strategy id, or one outside the configured known strategies, never
 * counts as a match. Never returns a blank or placeholder sid.
 */
@Component
public class AttributionResolver {

    private static final Logger log = LoggerFactory.getLogger(AttributionResolver.class);

    private final ReconcileConfig reconcileConfig;

    public AttributionResolver(ReconcileConfig reconcileConfig) {
        this.reconcileConfig = reconcileConfig;
    }

    public RecoveredAttribution resolve(
            String code,
            Optional<LedgerEntry> latestBuy,
            Set<String> rebalanceTargets,
            PositionMemory memory,
            LocalDate today) {
        if (latestBuy.isPresent()) {
            LedgerEntry entry = latestBuy.get();
            Optional<Attribution> owner = acceptable(entry.getStrategyId());
            if (owner.isPresent()) {
                String engine = entry.engineOrNull();
                return new RecoveredAttribution(owner.get(), engineFor(owner.get(), engine), RecoverySource.LEDGER);
            }
            log.warn("[RECONCILE] Ignoring ledger BUY of {} with unusable strategy id '{}'", code, entry.getStrategyId());
        }

        if (rebalanceTargets != null && rebalanceTargets.contains(code)) {
            Attribution bucket = Attribution.rebalance(today);
            return new RecoveredAttribution(bucket, bucket.bucketEngine(), RecoverySource.REBALANCE);
        }

        if (reconcileConfig.isMemoryHintEnabled() && memory != null && memory.getLastStrategyId() != null) {
            Optional<Attribution> hinted = acceptable(memory.getLastStrategyId().get(code));
            if (hinted.isPresent()) {
                return new RecoveredAttribution(hinted.get(), engineFor(hinted.get(), null), RecoverySource.MEMORY);
            }
        }

        Attribution manual = Attribution.manual();
        return new RecoveredAttribution(manual, manual.bucketEngine(), RecoverySource.MANUAL);
    }

    private Optional<Attribution> acceptable(String sid) {
        Optional<Attribution> parsed = Attribution.tryParse(sid);
        if (parsed.isPresent()
                && parsed.get().getKind() == AttributionKind.STRATEGY
                && !reconcileConfig.getKnownStrategies().isEmpty()
                && !reconcileConfig.getKnownStrategies().contains(parsed.get().getStrategyId())) {
            return Optional.empty();
        }
        return parsed;
    }

    private String engineFor(Attribution owner, String recordedEngine) {
        if (recordedEngine != null) {
            return recordedEngine;
        }
        String bucketEngine = owner.bucketEngine();
        return bucketEngine != null ? bucketEngine : reconcileConfig.getDefaultEngine();
    }

    /** Outcome of a lookup: the owner, the engine to record on the lot, and where it came from. */
    @Value
    public static class RecoveredAttribution {

        Attribution attribution;
        String engine;
        RecoverySource source;
    }
}
