package com.daychart.core.bars;

import com.daychart.core.model.Bar;
import com.daychart.core.model.BodyRatioClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Buckets bars by body size as a percentage of their range.
 *
 * Buckets are half-open except the top one: [0,25), [25,50), [50,75), [75,100].
 * Zero-range bars fall into the smallest bucket.
 */
public final class BodyRatioClassifier {

    private BodyRatioClassifier() {} // Utility class

    public static BodyRatioClass classify(Bar bar) {
        double range = bar.range();
        if (range <= 0) return BodyRatioClass.BELOW_25;

        double ratio = bar.body() / range * 100;
        if (ratio < 25) return BodyRatioClass.BELOW_25;
        if (ratio < 50) return BodyRatioClass.FROM_25_TO_50;
        if (ratio < 75) return BodyRatioClass.FROM_50_TO_75;
        return BodyRatioClass.ABOVE_75;
    }

    public static List<BodyRatioClass> classifyAll(List<Bar> bars) {
        List<BodyRatioClass> ratios = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            ratios.add(classify(bar));
        }
        return ratios;
    }
}
