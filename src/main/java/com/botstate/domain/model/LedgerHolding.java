package com.botstate.domain.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Average-cost holding of one (code, strategy) pair rebuilt by replaying the ledger.
 * An approximation of the Position Store that depends on nothing but history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerHolding {

    private String code;
    private String strategyId;
    private int qty;

    /** Null once the holding is fully sold. */
    private BigDecimal avgPrice;

    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    private OffsetDateTime firstBuyTs;
}
