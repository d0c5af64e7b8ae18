package com.daychart.core.catalog;

import com.daychart.core.model.DatasetMetadata;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Dataset file as written by the data preparation job, before normalization.
 *
 * Layout: { metadata, sources: [ { name, timezone, tradingHours, tradingDays: [ ... ] } ] }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawDataset(
    DatasetMetadata metadata,
    List<Source> sources
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Source(
        String name,
        String timezone,
        String tradingHours,
        List<Day> tradingDays
    ) {}

    /**
     * One trading day. The file also carries precomputed barDirections/bodyRatios
     * for the base frequency; those are ignored and recomputed per view.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Day(
        String date,
        String gapDirection,
        String gapSizeClass,
        Boolean openAbovePrevHigh,
        Boolean closeBelowPrevLow,
        Double prevClose,
        Double prevHigh,
        Double prevLow,
        List<double[]> bars   // [timestampMs, open, high, low, close]
    ) {}
}
