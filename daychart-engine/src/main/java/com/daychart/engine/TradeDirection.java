package com.daychart.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Side of a simulated trade.
 */
public enum TradeDirection {
    LONG("Long"),
    SHORT("Short");

    private final String value;

    TradeDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TradeDirection fromValue(String value) {
        if (value != null) {
            for (TradeDirection direction : values()) {
                if (direction.value.equalsIgnoreCase(value.trim())) {
                    return direction;
                }
            }
        }
        throw new IllegalArgumentException("Unknown trade direction: " + value + " (expected Long or Short)");
    }

    public boolean isLong() {
        return this == LONG;
    }

    @Override
    public String toString() {
        return value;
    }
}
