package com.botstate.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for broker reconciliation and attribution recovery.
 */
@Configuration
@ConfigurationProperties(prefix = "botstate.reconcile")
@Getter
@Setter
public class ReconcileConfig {

    /** Engine recorded on a lot recovered from a ledger entry that carries no meta.engine. */
    private String defaultEngine = "strategy";

    /**
     * Strategy ids a ledger entry may be attributed to. Empty accepts any id that is not
     * a legacy placeholder.
     */
    private List<String> knownStrategies = new ArrayList<>();

    /** Whether memory.last_strategy_id may attribute a holding after ledger and rebalance lookups fail. */
    private boolean memoryHintEnabled = true;

    /** Relative avg-price change reported as PRICE_DRIFT rather than a silent sync. */
    private BigDecimal priceDriftThreshold = new BigDecimal("0.02");

    /** Market time zone; drives entry timestamps and the REB_yyyyMMdd bucket date. */
    private String zone = "Asia/Seoul";
}
