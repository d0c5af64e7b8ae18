package com.daychart.core.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * One trading day of one source at base granularity.
 * Created when the dataset is loaded and never modified afterwards.
 */
public record TradingDayEntry(
    String source,
    String timezone,
    String tradingHours,
    String date,                 // YYYYMMDD
    GapDirection gapDirection,
    GapSizeClass gapSizeClass,
    Boolean openAbovePrevHigh,   // null when there is no prior day
    Boolean closeBelowPrevLow,   // null when there is no prior day
    Double prevClose,
    Double prevHigh,
    Double prevLow,
    List<Bar> bars
) {
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    public TradingDayEntry {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(date, "date");
        if (gapDirection == null) gapDirection = GapDirection.NOT_AVAILABLE;
        if (gapSizeClass == null) gapSizeClass = GapSizeClass.NOT_AVAILABLE;
        bars = bars == null ? List.of() : List.copyOf(bars);
    }

    public LocalDate localDate() {
        return LocalDate.parse(date, DateTimeFormatter.BASIC_ISO_DATE);
    }

    /**
     * Date as yyyy-MM-dd.
     */
    public String formattedDate() {
        return localDate().format(DISPLAY_FORMAT);
    }

    public SourceInfo sourceInfo() {
        return new SourceInfo(source, timezone, tradingHours);
    }

    public int barCount() {
        return bars.size();
    }
}
