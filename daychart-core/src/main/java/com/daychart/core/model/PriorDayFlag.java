package com.daychart.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Opt-in comparisons of a day against the prior day's range.
 */
public enum PriorDayFlag {
    OPEN_ABOVE_PREV_HIGH("open_above_prev_high"),
    CLOSE_BELOW_PREV_LOW("close_below_prev_low");

    private final String value;

    PriorDayFlag(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PriorDayFlag fromValue(String value) {
        if (value != null) {
            for (PriorDayFlag flag : values()) {
                if (flag.value.equalsIgnoreCase(value.trim())) {
                    return flag;
                }
            }
        }
        throw new IllegalArgumentException("Unknown prior-day flag: " + value);
    }

    /**
     * Whether the entry satisfies this flag. Unknown (null) comparisons never do.
     */
    public boolean isSetOn(TradingDayEntry entry) {
        Boolean flag = switch (this) {
            case OPEN_ABOVE_PREV_HIGH -> entry.openAbovePrevHigh();
            case CLOSE_BELOW_PREV_LOW -> entry.closeBelowPrevLow();
        };
        return Boolean.TRUE.equals(flag);
    }
}
