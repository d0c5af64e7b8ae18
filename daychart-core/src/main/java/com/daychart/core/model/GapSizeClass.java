package com.daychart.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Absolute gap size bucket, as a percentage of the prior close.
 */
public enum GapSizeClass {
    UNDER_0_1("0-0.1%"),
    FROM_0_1_TO_0_25("0.1%-0.25%"),
    FROM_0_25_TO_0_5("0.25%-0.5%"),
    FROM_0_5_TO_1_0("0.5%-1.0%"),
    OVER_1_0("1.0%+"),
    NOT_AVAILABLE("N/A");

    private final String label;

    GapSizeClass(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Resolve a dataset label. A missing label means N/A.
     */
    @JsonCreator
    public static GapSizeClass fromLabel(String label) {
        if (label == null) return NOT_AVAILABLE;
        for (GapSizeClass sizeClass : values()) {
            if (sizeClass.label.equals(label.trim())) {
                return sizeClass;
            }
        }
        throw new IllegalArgumentException("Unknown gap size class: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
