package com.daychart.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TradingDayEntryTest {

    private TradingDayEntry entry(GapDirection gap, Boolean openAbove) {
        return new TradingDayEntry("DAX", "Europe/Berlin", "09:00-17:30", "20240305",
            gap, null, openAbove, null, null, null, null,
            List.of(new Bar(0, 100, 101, 99, 100.5)));
    }

    @Test
    @DisplayName("Missing gap classifications default to N/A")
    void defaultsGaps() {
        TradingDayEntry entry = entry(null, null);

        assertEquals(GapDirection.NOT_AVAILABLE, entry.gapDirection());
        assertEquals(GapSizeClass.NOT_AVAILABLE, entry.gapSizeClass());
    }

    @Test
    @DisplayName("Formats the compact date")
    void formatsDate() {
        TradingDayEntry entry = entry(GapDirection.FLAT, null);

        assertEquals(LocalDate.of(2024, 3, 5), entry.localDate());
        assertEquals("2024-03-05", entry.formattedDate());
        assertEquals(ZoneId.of("Europe/Berlin"), entry.sourceInfo().zoneId());
    }

    @Test
    @DisplayName("Prior-day flags require an explicit true")
    void priorDayFlags() {
        assertTrue(PriorDayFlag.OPEN_ABOVE_PREV_HIGH.isSetOn(entry(GapDirection.GAP_UP, true)));
        assertFalse(PriorDayFlag.OPEN_ABOVE_PREV_HIGH.isSetOn(entry(GapDirection.GAP_UP, false)));
        assertFalse(PriorDayFlag.OPEN_ABOVE_PREV_HIGH.isSetOn(entry(GapDirection.GAP_UP, null)));
        assertFalse(PriorDayFlag.CLOSE_BELOW_PREV_LOW.isSetOn(entry(GapDirection.GAP_UP, true)));
    }

    @Test
    @DisplayName("Gap labels resolve case-insensitively and reject unknown values")
    void gapLabels() {
        assertEquals(GapDirection.GAP_DOWN, GapDirection.fromLabel("gap down"));
        assertEquals(GapSizeClass.OVER_1_0, GapSizeClass.fromLabel("1.0%+"));
        assertEquals(GapSizeClass.NOT_AVAILABLE, GapSizeClass.fromLabel(null));
        assertThrows(IllegalArgumentException.class, () -> GapDirection.fromLabel("SIDEWAYS"));
    }
}
