package com.daychart.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a simulated trade was not resolved as a win or a loss.
 */
public enum SkipReason {
    /** The view ends before the trigger bar. */
    NOT_ENOUGH_BARS("not enough bars"),
    /** Trigger bar has high == low, so offsets would be zero. */
    ZERO_RANGE("zero range"),
    /** Target and stop both inside one bar; OHLC cannot tell which came first. */
    BOTH_HIT("both hit"),
    /** Neither level reached before the last bar. */
    END_OF_DAY("end of day");

    private final String label;

    SkipReason(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
