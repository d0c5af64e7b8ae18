package com.daychart.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a day's open relative to the prior day's close.
 */
public enum GapDirection {
    GAP_UP("GAP UP"),
    GAP_DOWN("GAP DOWN"),
    FLAT("FLAT"),
    /** No comparable prior day (first day of a source, or a long break). */
    NOT_AVAILABLE("N/A");

    private final String label;

    GapDirection(String label) {
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
    public static GapDirection fromLabel(String label) {
        if (label == null) return NOT_AVAILABLE;
        for (GapDirection direction : values()) {
            if (direction.label.equalsIgnoreCase(label.trim())) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown gap direction: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
