package com.daychart.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a single bar, close relative to open.
 */
public enum BarDirection {
    UP("UP"),
    DOWN("DOWN"),
    FLAT("FLAT");

    private final String label;

    BarDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static BarDirection fromLabel(String label) {
        if (label != null) {
            for (BarDirection direction : values()) {
                if (direction.label.equalsIgnoreCase(label.trim())) {
                    return direction;
                }
            }
        }
        throw new IllegalArgumentException("Unknown bar direction: " + label);
    }
}
