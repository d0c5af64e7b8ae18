package com.daychart.core.model;

import com.daychart.core.bars.BodyRatioClassifier;
import com.daychart.core.bars.DirectionClassifier;

import java.util.List;

/**
 * A trading day re-expressed at a requested frequency and bar count.
 *
 * Views are recomputed per request and never cached or modified.
 * Directions and body ratios always describe {@link #bars()} as aggregated and truncated.
 */
public record ChartView(
    TradingDayEntry entry,
    Frequency frequency,
    BarsOption barsOption,
    List<Bar> bars,
    List<BarDirection> directions,
    List<BodyRatioClass> bodyRatios
) {
    public ChartView {
        bars = List.copyOf(bars);
        directions = List.copyOf(directions);
        bodyRatios = List.copyOf(bodyRatios);
        if (directions.size() != bars.size() || bodyRatios.size() != bars.size()) {
            throw new IllegalArgumentException("Classifications must match bar count " + bars.size());
        }
    }

    /**
     * Build a view over already aggregated and truncated bars, classifying each bar.
     */
    public static ChartView of(TradingDayEntry entry, Frequency frequency, BarsOption barsOption, List<Bar> bars) {
        return new ChartView(entry, frequency, barsOption, bars,
            DirectionClassifier.classifyAll(bars),
            BodyRatioClassifier.classifyAll(bars));
    }

    /**
     * Composite identity: source-date-frequency-barsOption.
     */
    public String key() {
        return entry.source() + "-" + entry.date() + "-" + frequency.label() + "-" + barsOption.label();
    }

    public String source() {
        return entry.source();
    }

    public String date() {
        return entry.date();
    }

    public String timezone() {
        return entry.timezone();
    }

    public GapDirection gapDirection() {
        return entry.gapDirection();
    }

    public GapSizeClass gapSizeClass() {
        return entry.gapSizeClass();
    }

    public int size() {
        return bars.size();
    }

    @Override
    public String toString() {
        return "ChartView[" + key() + ", " + bars.size() + " bars]";
    }
}
