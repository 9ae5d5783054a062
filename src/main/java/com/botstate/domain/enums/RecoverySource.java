package com.botstate.domain.enums;

/**
 * Where the attribution of a previously untracked holding came from, in the order the
 * sources are consulted. The order encodes decreasing confidence and is never changed.
 */
public enum RecoverySource {
    LEDGER,
    REBALANCE,
    MEMORY,
    MANUAL
}
