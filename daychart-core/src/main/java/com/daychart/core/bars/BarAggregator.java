package com.daychart.core.bars;

import com.daychart.core.model.Bar;
import com.daychart.core.model.Frequency;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolls base-granularity bars up into coarser bars.
 */
public final class BarAggregator {

    private BarAggregator() {} // Utility class

    /**
     * Aggregate consecutive chunks of {@code factor} bars into one bar each.
     *
     * Per chunk: timestamp and open of the first bar, highest high, lowest low,
     * close of the last bar. A trailing partial chunk is kept, so N bars yield
     * ceil(N / factor) results. The returned list never shares storage with the input.
     *
     * @param bars   base bars in time order
     * @param factor target duration / base duration, at least 1
     */
    public static List<Bar> aggregate(List<Bar> bars, int factor) {
        if (factor < 1) {
            throw new IllegalArgumentException("Aggregation factor must be at least 1, got " + factor);
        }
        int n = bars.size();
        if (factor == 1) {
            return new ArrayList<>(bars);
        }

        List<Bar> result = new ArrayList<>((n + factor - 1) / factor);
        for (int start = 0; start < n; start += factor) {
            int end = Math.min(start + factor, n);
            Bar first = bars.get(start);
            double high = first.high();
            double low = first.low();
            for (int i = start + 1; i < end; i++) {
                Bar bar = bars.get(i);
                high = Math.max(high, bar.high());
                low = Math.min(low, bar.low());
            }
            result.add(new Bar(first.timestamp(), first.open(), high, low, bars.get(end - 1).close()));
        }
        return result;
    }

    /**
     * Aggregate base bars to a target frequency.
     */
    public static List<Bar> aggregate(List<Bar> bars, Frequency base, Frequency target) {
        return aggregate(bars, target.factorOver(base));
    }
}
