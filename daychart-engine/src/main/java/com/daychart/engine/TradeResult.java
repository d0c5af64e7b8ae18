package com.daychart.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one simulated trade on one chart view.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TradeResult(
    String key,           // chart view key
    TradeOutcome outcome,
    double pnl,           // price units; 0 unless decisive
    Double entry,         // null when the trigger bar does not exist
    Double target,        // null until offsets are computed
    Double stop,
    SkipReason reason     // null unless SKIP
) {
    public static TradeResult win(String key, double pnl, double entry, double target, double stop) {
        return new TradeResult(key, TradeOutcome.WIN, pnl, entry, target, stop, null);
    }

    public static TradeResult loss(String key, double pnl, double entry, double target, double stop) {
        return new TradeResult(key, TradeOutcome.LOSS, pnl, entry, target, stop, null);
    }

    public static TradeResult skip(String key, SkipReason reason, Double entry, Double target, Double stop) {
        return new TradeResult(key, TradeOutcome.SKIP, 0, entry, target, stop, reason);
    }

    @JsonIgnore
    public boolean isWin() {
        return outcome == TradeOutcome.WIN;
    }

    @JsonIgnore
    public boolean isLoss() {
        return outcome == TradeOutcome.LOSS;
    }

    @JsonIgnore
    public boolean isSkip() {
        return outcome == TradeOutcome.SKIP;
    }
}
