package com.botstate.reconciliation;

import com.botstate.config.ReconcileConfig;
import com.botstate.domain.enums.MismatchType;
import com.botstate.domain.model.BrokerHolding;
import com.botstate.domain.model.LedgerEntry;
import com.botstate.domain.model.PositionLot;
import com.botstate.domain.model.PositionMemory;
import com.botstate.domain.model.PositionMismatch;
import com.botstate.domain.model.PositionState;
import com.botstate.domain.model.ReconciliationResult;
import com.botstate.exception.SourceUnavailableException;
import com.botstate.reconciliation.AttributionResolver.RecoveredAttribution;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Merges the broker's balance into a Position Store snapshot.
 *
 * <p>The broker is authoritative for which codes are held, their quantities and their
 * average prices. The store keeps what the broker cannot know: owner, engine, entry time,
 * high watermark and flags. Per code:
 * <ul>
 *   <li>held at the broker, untracked locally -> new lot, owner recovered (MISSING_LOCAL)</li>
 *   <li>tracked locally, absent or zero at the broker -> lots deleted (MISSING_BROKER)</li>
 *   <li>in both with a different total -> quantity synced (QUANTITY_MISMATCH)</li>
 *   <li>in both, avg price moved more than the threshold -> synced and reported (PRICE_DRIFT)</li>
 * </ul>
 *
 * <p>Works on a copy and touches no I/O, so the outcome depends only on its inputs and
 * the clock. Reconciling the result again with the same balance changes only
 * {@code updated_at}.
 */
@Component
public class PositionReconciler {

    private static final Pattern CODE = Pattern.compile("\\d{6}");
    private static final int PRICE_SCALE = 4;

    private final AttributionResolver attributionResolver;
    private final ReconcileConfig reconcileConfig;
    private final Clock clock;

    public PositionReconciler(AttributionResolver attributionResolver, ReconcileConfig reconcileConfig, Clock clock) {
        this.attributionResolver = attributionResolver;
        this.reconcileConfig = reconcileConfig;
        this.clock = clock;
    }

    /**
     * @param current          snapshot to reconcile; never modified
     * @param balance          broker rows keyed by code; an empty map means nothing is held
     * @param rebalanceTargets codes of today's rebalance bucket
     * @param latestBuy        ledger lookup of the latest BUY per code
     * @param trigger          label recorded on the result
     * @throws SourceUnavailableException if {@code balance} is null
     */
    public ReconciliationResult reconcile(
            PositionState current,
            Map<String, BrokerHolding> balance,
            Set<String> rebalanceTargets,
            Function<String, Optional<LedgerEntry>> latestBuy,
            String trigger) {
        if (balance == null) {
            throw new SourceUnavailableException("No broker balance to reconcile against");
        }
        long startTime = clock.millis();
        OffsetDateTime now = OffsetDateTime.now(clock);
        Set<String> targets = rebalanceTargets != null ? rebalanceTargets : Collections.emptySet();

        PositionState state = current.copy();
        if (state.getMemory() == null) {
            state.setMemory(PositionMemory.empty());
        }
        ReconciliationResult result = ReconciliationResult.builder()
                .timestamp(now)
                .trigger(trigger)
                .localPositionCount(state.getPositions().size())
                .build();

        SortedSet<String> malformedCodes = new TreeSet<>();
        SortedMap<String, BrokerHolding> held = screenBalance(balance, malformedCodes, result);
        result.setBrokerPositionCount(held.size());

        for (BrokerHolding holding : held.values()) {
            List<PositionLot> lots = state.lotsFor(holding.getCode());
            boolean changed = lots.isEmpty()
                    ? createLot(state, holding, targets, latestBuy, now, result)
                    : syncLots(state, lots, holding, latestBuy, now, result);
            remember(state, holding, changed, now);
        }

        for (String code : state.codes()) {
            if (held.containsKey(code) || malformedCodes.contains(code)) {
                continue;
            }
            for (PositionLot lot : state.lotsFor(code)) {
                state.removeLot(lot);
                result.setLotsRemoved(result.getLotsRemoved() + 1);
                result.getMismatches().add(PositionMismatch.builder()
                        .code(code)
                        .sid(lot.getSid())
                        .type(MismatchType.MISSING_BROKER)
                        .brokerQuantity(0L)
                        .localQuantity(lot.getQty())
                        .localAveragePrice(lot.getAvgPrice())
                        .resolved(true)
                        .resolutionDetail("Removed lot no longer held at broker")
                        .build());
            }
        }

        state.setUpdatedAt(now);
        result.setReconciledState(state);
        result.setDurationMs(clock.millis() - startTime);
        return result;
    }

    /** Valid rows with qty > 0 by code. Malformed rows are reported and their codes left alone. */
    private SortedMap<String, BrokerHolding> screenBalance(
            Map<String, BrokerHolding> balance, Set<String> malformedCodes, ReconciliationResult result) {
        SortedMap<String, BrokerHolding> held = new TreeMap<>();
        for (Map.Entry<String, BrokerHolding> entry : balance.entrySet()) {
            BrokerHolding holding = entry.getValue();
            String code = holding != null && holding.getCode() != null ? holding.getCode() : entry.getKey();
            String problem = problemWith(code, holding);
            if (problem != null) {
                if (code != null) {
                    malformedCodes.add(code);
                }
                result.setWarnings(result.getWarnings() + 1);
                result.getMismatches().add(PositionMismatch.builder()
                        .code(code)
                        .type(MismatchType.MALFORMED_BROKER_ROW)
                        .brokerQuantity(holding != null ? holding.getQty() : null)
                        .brokerAveragePrice(holding != null ? holding.getAvgPrice() : null)
                        .resolved(false)
                        .resolutionDetail("Skipped: " + problem)
                        .build());
                continue;
            }
            if (holding.getQty() > 0) {
                held.put(code, BrokerHolding.builder()
                        .code(code)
                        .qty(holding.getQty())
                        .avgPrice(holding.getAvgPrice())
                        .build());
            }
        }
        return held;
    }

    private static String problemWith(String code, BrokerHolding holding) {
        if (holding == null) {
            return "empty row";
        }
        if (code == null || !CODE.matcher(code).matches()) {
            return "code is not 6 digits";
        }
        if (holding.getQty() < 0) {
            return "negative quantity " + holding.getQty();
        }
        if (holding.getQty() > Integer.MAX_VALUE) {
            return "quantity out of range " + holding.getQty();
        }
        if (holding.getQty() > 0 && (holding.getAvgPrice() == null || holding.getAvgPrice().signum() <= 0)) {
            return "non-positive average price";
        }
        return null;
    }

    private boolean createLot(
            PositionState state,
            BrokerHolding holding,
            Set<String> targets,
            Function<String, Optional<LedgerEntry>> latestBuy,
            OffsetDateTime now,
            ReconciliationResult result) {
        RecoveredAttribution recovered = attributionResolver.resolve(
                holding.getCode(), latestBuy.apply(holding.getCode()), targets, state.getMemory(), now.toLocalDate());
        PositionLot lot = PositionLot.builder()
                .code(holding.getCode())
                .sid(recovered.getAttribution().sid())
                .engine(recovered.getEngine())
                .qty((int) holding.getQty())
                .avgPrice(holding.getAvgPrice())
                .entryTs(now)
                .highWatermark(holding.getAvgPrice())
                .flags(new TreeMap<>())
                .lastUpdateTs(now)
                .build();
        state.putLot(lot);
        result.setLotsCreated(result.getLotsCreated() + 1);
        result.recordRecovery(recovered.getSource());
        result.getMismatches().add(PositionMismatch.builder()
                .code(holding.getCode())
                .sid(lot.getSid())
                .type(MismatchType.MISSING_LOCAL)
                .brokerQuantity(holding.getQty())
                .brokerAveragePrice(holding.getAvgPrice())
                .localQuantity(0)
                .recoverySource(recovered.getSource())
                .resolved(true)
                .resolutionDetail("Created lot attributed to " + lot.getSid() + " from " + recovered.getSource())
                .build());
        return true;
    }

    /**
     * Brings the lots of a held code to the broker's quantity and average price. A lower
     * broker quantity is taken from the most recently entered lot backwards; a higher one
     * goes to the lot of the ledger's latest buyer, else the most recent lot.
     */
    private boolean syncLots(
            PositionState state,
            List<PositionLot> lots,
            BrokerHolding holding,
            Function<String, Optional<LedgerEntry>> latestBuy,
            OffsetDateTime now,
            ReconciliationResult result) {
        String code = holding.getCode();
        int brokerQty = (int) holding.getQty();
        int localQty = lots.stream().mapToInt(PositionLot::getQty).sum();
        BigDecimal localAvg = weightedAverage(lots, localQty);
        List<PositionLot> touched = new ArrayList<>();

        if (brokerQty != localQty) {
            if (brokerQty < localQty) {
                int excess = localQty - brokerQty;
                for (int i = lots.size() - 1; i >= 0 && excess > 0; i--) {
                    PositionLot lot = lots.get(i);
                    int take = Math.min(excess, lot.getQty());
                    excess -= take;
                    lot.setQty(lot.getQty() - take);
                    touched.add(lot);
                    if (lot.getQty() == 0) {
                        state.removeLot(lot);
                        result.setLotsRemoved(result.getLotsRemoved() + 1);
                    }
                }
            } else {
                PositionLot target = increaseTarget(lots, latestBuy.apply(code));
                target.setQty(target.getQty() + (brokerQty - localQty));
                touched.add(target);
            }
            result.getMismatches().add(PositionMismatch.builder()
                    .code(code)
                    .sid(lots.size() == 1 ? lots.get(0).getSid() : null)
                    .type(MismatchType.QUANTITY_MISMATCH)
                    .brokerQuantity(holding.getQty())
                    .brokerAveragePrice(holding.getAvgPrice())
                    .localQuantity(localQty)
                    .localAveragePrice(localAvg)
                    .resolved(true)
                    .resolutionDetail("Quantity synced from broker")
                    .build());
        } else if (exceedsDrift(localAvg, holding.getAvgPrice())) {
            result.getMismatches().add(PositionMismatch.builder()
                    .code(code)
                    .sid(lots.size() == 1 ? lots.get(0).getSid() : null)
                    .type(MismatchType.PRICE_DRIFT)
                    .brokerQuantity(holding.getQty())
                    .brokerAveragePrice(holding.getAvgPrice())
                    .localQuantity(localQty)
                    .localAveragePrice(localAvg)
                    .resolved(true)
                    .resolutionDetail("Average price synced from broker")
                    .build());
        }

        for (PositionLot lot : lots) {
            if (lot.getQty() > 0 && lot.getAvgPrice().compareTo(holding.getAvgPrice()) != 0) {
                lot.setAvgPrice(holding.getAvgPrice());
                if (!touched.contains(lot)) {
                    touched.add(lot);
                }
            }
        }
        for (PositionLot lot : touched) {
            lot.setLastUpdateTs(now);
        }
        result.setLotsSynced(result.getLotsSynced() + touched.size());
        return !touched.isEmpty();
    }

    private static PositionLot increaseTarget(List<PositionLot> lots, Optional<LedgerEntry> latestBuy) {
        if (latestBuy.isPresent()) {
            for (PositionLot lot : lots) {
                if (lot.getSid().equals(latestBuy.get().getStrategyId())) {
                    return lot;
                }
            }
        }
        return lots.get(lots.size() - 1);
    }

    private boolean exceedsDrift(BigDecimal localAvg, BigDecimal brokerAvg) {
        if (localAvg == null || localAvg.signum() == 0) {
            return false;
        }
        BigDecimal drift = brokerAvg.subtract(localAvg).abs().divide(localAvg, PRICE_SCALE, RoundingMode.HALF_UP);
        return drift.compareTo(reconcileConfig.getPriceDriftThreshold()) > 0;
    }

    private static BigDecimal weightedAverage(List<PositionLot> lots, int totalQty) {
        if (totalQty == 0) {
            return null;
        }
        BigDecimal cost = BigDecimal.ZERO;
        for (PositionLot lot : lots) {
            cost = cost.add(lot.getAvgPrice().multiply(BigDecimal.valueOf(lot.getQty())));
        }
        return cost.divide(BigDecimal.valueOf(totalQty), PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Price and owner are refreshed for every held code; last_seen only when the code's
     * lots changed or it has none yet, so a repeated run leaves memory as it was.
     */
    private static void remember(PositionState state, BrokerHolding holding, boolean changed, OffsetDateTime now) {
        PositionMemory memory = state.getMemory();
        String code = holding.getCode();
        memory.getLastPrice().put(code, holding.getAvgPrice());
        List<PositionLot> lots = state.lotsFor(code);
        if (!lots.isEmpty()) {
            memory.getLastStrategyId().put(code, lots.get(lots.size() - 1).getSid());
        }
        if (changed || !memory.getLastSeen().containsKey(code)) {
            memory.getLastSeen().put(code, now);
        }
    }
}
