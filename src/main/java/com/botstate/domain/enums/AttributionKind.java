package com.botstate.domain.enums;

/**
 * The closed set of owners a lot can be attributed to.
 *
 * <p>STRATEGY = a named strategy opened it. REBALANCE = it belongs to the day's
 * rebalance bucket. MANUAL = nobody in the bot claims it.
 */
public enum AttributionKind {
    STRATEGY,
    REBALANCE,
    MANUAL
}
