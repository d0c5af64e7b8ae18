package com.daychart.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDateTime;
import java.util.List;

/**
 * The "metadata" block written alongside a dataset.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DatasetMetadata(
    LocalDateTime generated,
    String baseFrequency,
    List<String> sources,
    Integer totalSources,
    Integer totalTradingDays
) {
    /**
     * Metadata for a dataset that ships without a block: 5-minute base bars.
     */
    public static DatasetMetadata defaults() {
        return new DatasetMetadata(null, Frequency.FIVE_MINUTES.label(), List.of(), null, null);
    }

    public Frequency baseFrequencyOrDefault() {
        return baseFrequency != null ? Frequency.parse(baseFrequency) : Frequency.FIVE_MINUTES;
    }
}
