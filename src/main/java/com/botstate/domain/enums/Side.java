package com.botstate.domain.enums;

/** Buy or sell side of a fill or an intent. */
public enum Side {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. */
    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }
}
