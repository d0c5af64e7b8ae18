package com.daychart.core.bars;

import com.daychart.core.model.Bar;
import com.daychart.core.model.BarDirection;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies bars as UP, DOWN or FLAT.
 */
public final class DirectionClassifier {

    private DirectionClassifier() {} // Utility class

    public static BarDirection classify(Bar bar) {
        if (bar.close() > bar.open()) return BarDirection.UP;
        if (bar.close() < bar.open()) return BarDirection.DOWN;
        return BarDirection.FLAT;
    }

    public static List<BarDirection> classifyAll(List<Bar> bars) {
        List<BarDirection> directions = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            directions.add(classify(bar));
        }
        return directions;
    }
}
