package com.daychart.core.model;

import java.time.ZoneId;

/**
 * Metadata of one instrument source.
 */
public record SourceInfo(
    String name,
    String timezone,      // IANA id, e.g. "Europe/London"
    String tradingHours   // e.g. "08:00-16:30"
) {
    /**
     * Resolve the source timezone; UTC when none was recorded.
     */
    public ZoneId zoneId() {
        return timezone == null || timezone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(timezone);
    }
}
