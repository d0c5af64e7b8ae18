package com.daychart.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One OHLC sample of a trading day.
 *
 * Datasets carry bars as compact arrays: [timestampMs, open, high, low, close].
 */
public record Bar(
    long timestamp,
    double open,
    double high,
    double low,
    double close
) {
    /**
     * Build a bar from its compact array form.
     * Values past the fifth (e.g. volume) are ignored.
     */
    public static Bar fromArray(double[] values) {
        if (values == null || values.length < 5) {
            throw new IllegalArgumentException("Bar needs 5 values [timestamp, open, high, low, close], got "
                + (values == null ? "null" : values.length));
        }
        return new Bar((long) values[0], values[1], values[2], values[3], values[4]);
    }

    /**
     * Get the range (high - low)
     */
    @JsonIgnore
    public double range() {
        return high - low;
    }

    /**
     * Get the body size (absolute difference between open and close)
     */
    @JsonIgnore
    public double body() {
        return Math.abs(close - open);
    }
}
