package com.botstate.domain.model;

import com.botstate.domain.enums.MismatchType;
import com.botstate.domain.enums.RecoverySource;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * A single discrepancy found while reconciling the Position Store against the broker
 * balance, with what the reconciler did about it.
 *
 * <p>Every mismatch except MALFORMED_BROKER_ROW is resolved in the same pass because the
 * broker is authoritative for quantity and cost basis.
 */
@Data
@Builder
public class PositionMismatch {

    private String code;
    private String sid;
    private MismatchType type;

    // Broker state
    private Long brokerQuantity;
    private BigDecimal brokerAveragePrice;

    // Local state
    private Integer localQuantity;
    private BigDecimal localAveragePrice;

    /** Set for MISSING_LOCAL: which source the new lot's attribution came from. */
    private RecoverySource recoverySource;

    // Resolution outcome
    private boolean resolved;
    private String resolutionDetail;
}
