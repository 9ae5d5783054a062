package com.botstate.reconciliation;

import com.botstate.broker.BrokerBalanceClient;
import com.botstate.domain.model.BrokerHolding;
import com.botstate.domain.model.PositionMismatch;
import com.botstate.domain.model.ReconciliationResult;
import com.botstate.event.ReconciliationEvent;
import com.botstate.exception.SourceUnavailableException;
import com.botstate.ledger.Ledger;
import com.botstate.position.PositionStore;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Keeps the Position Store in sync with the broker account.
 *
 * <p>Fetches the balance, runs {@link PositionReconciler} against a copy of the store
 * and installs the result only when the whole pass succeeded. A broker failure aborts
 * before anything is touched. Every completed run publishes a {@link ReconciliationEvent}.
 */
@Service
public class PositionReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PositionReconciliationService.class);

    private final BrokerBalanceClient brokerBalanceClient;
    private final PositionStore positionStore;
    private final Ledger ledger;
    private final PositionReconciler positionReconciler;
    private final ApplicationEventPublisher applicationEventPublisher;

    public PositionReconciliationService(
            BrokerBalanceClient brokerBalanceClient,
            PositionStore positionStore,
            Ledger ledger,
            PositionReconciler positionReconciler,
            ApplicationEventPublisher applicationEventPublisher) {
        this.brokerBalanceClient = brokerBalanceClient;
        this.positionStore = positionStore;
        this.ledger = ledger;
        this.positionReconciler = positionReconciler;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Reconciles the store against the broker balance.
     *
     * @param trigger          label for logs and the result (STARTUP, SCHEDULED, MANUAL...)
     * @param rebalanceTargets codes in today's rebalance bucket
     * @throws SourceUnavailableException if the broker balance cannot be read; the store is untouched
     */
    public ReconciliationResult reconcile(String trigger, Set<String> rebalanceTargets) {
        log.info("[RECONCILE] Started: trigger={}, rebalanceTargets={}", trigger, rebalanceTargets);

        Map<String, BrokerHolding> balance;
        try {
            balance = brokerBalanceClient.getBalance();
        } catch (SourceUnavailableException e) {
            log.error("[RECONCILE] Broker balance unavailable, store left untouched: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[RECONCILE] Broker balance call failed, store left untouched", e);
            throw new SourceUnavailableException("Broker balance call failed: " + e.getMessage(), e);
        }
        if (balance == null) {
            log.error("[RECONCILE] Broker returned no balance, store left untouched");
            throw new SourceUnavailableException("Broker balance call returned no balance");
        }

        ReconciliationResult result =
                positionReconciler.reconcile(positionStore.current(), balance, rebalanceTargets, ledger::findLatestBuy, trigger);
        positionStore.install(result.getReconciledState());

        for (PositionMismatch mismatch : result.getMismatches()) {
            log.info(
                    "[RECONCILE] {} {} sid={} broker={} local={}: {}",
                    mismatch.getType(),
                    mismatch.getCode(),
                    mismatch.getSid(),
                    mismatch.getBrokerQuantity(),
                    mismatch.getLocalQuantity(),
                    mismatch.getResolutionDetail());
        }

        applicationEventPublisher.publishEvent(new ReconciliationEvent(this, result));

        if (result.hasMismatches()) {
            log.warn(
                    "[RECONCILE] Complete: {} mismatches, created={}, removed={}, synced={}, warnings={}, recovery={}",
                    result.getTotalMismatches(),
                    result.getLotsCreated(),
                    result.getLotsRemoved(),
                    result.getLotsSynced(),
                    result.getWarnings(),
                    result.recoveryStatsForManifest());
        } else {
            log.info("[RECONCILE] Complete: no mismatches, duration={}ms", result.getDurationMs());
        }
        return result;
    }
}
