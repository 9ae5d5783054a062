package com.botstate.domain.enums;

/**
 * Classification of discrepancies found while reconciling the Position Store against
 * the broker balance.
 *
 * <p>MISSING_LOCAL = broker holds a code the store does not track (lot recovered).
 * MISSING_BROKER = store tracks a code the broker no longer reports (lot removed).
 * QUANTITY_MISMATCH = both hold it with different quantities (synced to broker).
 * PRICE_DRIFT = quantities match but avg price moved beyond the threshold (synced to broker).
 * MALFORMED_BROKER_ROW = broker row rejected (negative qty, non-positive price, bad code).
 */
public enum MismatchType {
    MISSING_LOCAL,
    MISSING_BROKER,
    QUANTITY_MISMATCH,
    PRICE_DRIFT,
    MALFORMED_BROKER_ROW
}
