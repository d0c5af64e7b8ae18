package com.daychart.core.model;

import java.util.Objects;

/**
 * Per-bar constraint: bar number {@code bar} (1-based) must have the given direction
 * and, when {@code bodyRatio} is set, the given body ratio class.
 */
public record BarFilter(
    int bar,
    BarDirection direction,
    BodyRatioClass bodyRatio   // null = any
) {
    public BarFilter {
        if (bar < 1) {
            throw new IllegalArgumentException("Bar number must be at least 1, got " + bar);
        }
        Objects.requireNonNull(direction, "direction");
    }

    public BarFilter(int bar, BarDirection direction) {
        this(bar, direction, null);
    }

    public boolean hasBodyRatio() {
        return bodyRatio != null;
    }

    /**
     * Whether the view satisfies this constraint. A bar number past the end of the view never does.
     */
    public boolean matches(ChartView view) {
        int index = bar - 1;
        if (index >= view.directions().size()) {
            return false;
        }
        if (view.directions().get(index) != direction) {
            return false;
        }
        if (hasBodyRatio()) {
            return index < view.bodyRatios().size() && view.bodyRatios().get(index) == bodyRatio;
        }
        return true;
    }
}
