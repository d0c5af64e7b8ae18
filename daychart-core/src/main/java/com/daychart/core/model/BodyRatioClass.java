package com.daychart.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Body-to-range ratio bucket of a bar (|close - open| / (high - low)).
 */
public enum BodyRatioClass {
    /** Small body, doji-like. Also used for zero-range bars. */
    BELOW_25("<25%"),
    FROM_25_TO_50("25-50%"),
    FROM_50_TO_75("50-75%"),
    /** Large body, marubozu-like. */
    ABOVE_75(">75%");

    private final String label;

    BodyRatioClass(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static BodyRatioClass fromLabel(String label) {
        if (label != null) {
            for (BodyRatioClass ratioClass : values()) {
                if (ratioClass.label.equals(label.trim())) {
                    return ratioClass;
                }
            }
        }
        throw new IllegalArgumentException("Unknown body ratio class: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
