package com.daychart.core.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A bar interval in whole minutes, written as "5min", "15min", "1h".
 */
public record Frequency(int minutes) {

    public static final Frequency FIVE_MINUTES = new Frequency(5);
    public static final Frequency TEN_MINUTES = new Frequency(10);
    public static final Frequency FIFTEEN_MINUTES = new Frequency(15);

    private static final Pattern LABEL = Pattern.compile("(\\d+)\\s*(min|m|h)");

    public Frequency {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Frequency must be positive, got " + minutes + " minutes");
        }
    }

    /**
     * Parse a frequency label ("5min", "10min", "30m", "1h").
     */
    public static Frequency parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Frequency label is null");
        }
        Matcher m = LABEL.matcher(label.trim().toLowerCase());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid frequency: " + label);
        }
        int amount = Integer.parseInt(m.group(1));
        return new Frequency("h".equals(m.group(2)) ? amount * 60 : amount);
    }

    /**
     * Number of bars of the given base frequency that make up one bar of this frequency.
     *
     * @throws IllegalArgumentException if this frequency is not a whole multiple of the base
     */
    public int factorOver(Frequency base) {
        if (minutes < base.minutes || minutes % base.minutes != 0) {
            throw new IllegalArgumentException(
                label() + " is not a whole multiple of the base frequency " + base.label());
        }
        return minutes / base.minutes;
    }

    public String label() {
        if (minutes >= 60 && minutes % 60 == 0) {
            return (minutes / 60) + "h";
        }
        return minutes + "min";
    }

    @Override
    public String toString() {
        return label();
    }
}
