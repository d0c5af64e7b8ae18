package com.daychart.core.model;

import java.util.List;

/**
 * How many leading bars of a day a chart view keeps.
 */
public sealed interface BarsOption permits BarsOption.AllBars, BarsOption.Limited {

    /** Keep the full day. */
    BarsOption ALL = new AllBars();

    /**
     * Apply the option to an (already aggregated) bar sequence.
     */
    List<Bar> apply(List<Bar> bars);

    /**
     * Label used in view keys and scan files: "all" or the bar count.
     */
    String label();

    static BarsOption limited(int count) {
        return new Limited(count);
    }

    /**
     * Parse "all" (also "full") or a positive bar count.
     */
    static BarsOption parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Bars option is null");
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("all") || trimmed.equalsIgnoreCase("full")) {
            return ALL;
        }
        try {
            return new Limited(Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid bars option: " + value, e);
        }
    }

    record AllBars() implements BarsOption {
        @Override
        public List<Bar> apply(List<Bar> bars) {
            return bars;
        }

        @Override
        public String label() {
            return "all";
        }

        @Override
        public String toString() {
            return label();
        }
    }

    /**
     * Keep at most {@code count} bars. A count at or above the day's length keeps everything.
     */
    record Limited(int count) implements BarsOption {
        public Limited {
            if (count < 1) {
                throw new IllegalArgumentException("Bar limit must be at least 1, got " + count);
            }
        }

        @Override
        public List<Bar> apply(List<Bar> bars) {
            return bars.size() > count ? bars.subList(0, count) : bars;
        }

        @Override
        public String label() {
            return String.valueOf(count);
        }

        @Override
        public String toString() {
            return label();
        }
    }
}
