package com.daychart.engine;

/**
 * Resolution of a simulated trade.
 */
public enum TradeOutcome {
    WIN,
    LOSS,
    /** Not decisive: see {@link SkipReason}. */
    SKIP;

    public boolean isDecisive() {
        return this != SKIP;
    }
}
