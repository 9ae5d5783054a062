package com.botstate.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the broker's account balance. The broker is authoritative for quantity
 * and cost basis but knows nothing about which strategy owns the holding.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrokerHolding {

    private String code;
    private long qty;
    private BigDecimal avgPrice;
}
