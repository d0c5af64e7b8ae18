package com.daychart.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of the single-trade strategy.
 *
 * Entry at the close of {@code triggerBar} (1-based). Target and stop are placed at
 * {@code targetPct} / {@code stopPct} percent of the trigger bar's range away from the entry.
 * Construction does not validate; see {@link #validate()}.
 */
public record TradeParams(
    int triggerBar,
    TradeDirection direction,
    double targetPct,
    double stopPct
) {
    /**
     * List the rules these parameters break. Empty when the parameters are usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (triggerBar < 1) {
            errors.add("triggerBar must be at least 1, got " + triggerBar);
        }
        if (direction == null) {
            errors.add("direction must be Long or Short");
        }
        if (!(targetPct > 0) || Double.isInfinite(targetPct)) {
            errors.add("targetPct must be a positive number, got " + targetPct);
        }
        if (!(stopPct > 0) || Double.isInfinite(stopPct)) {
            errors.add("stopPct must be a positive number, got " + stopPct);
        }
        return errors;
    }

    public boolean isValid() {
        return validate().isEmpty();
    }
}
