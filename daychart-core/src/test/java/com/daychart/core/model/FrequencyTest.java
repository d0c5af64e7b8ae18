package com.daychart.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyTest {

    @Test
    @DisplayName("Parses minute and hour labels")
    void parsesLabels() {
        assertEquals(Frequency.FIVE_MINUTES, Frequency.parse("5min"));
        assertEquals(Frequency.TEN_MINUTES, Frequency.parse(" 10MIN "));
        assertEquals(new Frequency(30), Frequency.parse("30m"));
        assertEquals(new Frequency(60), Frequency.parse("1h"));
    }

    @Test
    @DisplayName("Rejects malformed labels")
    void rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("five"));
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("5s"));
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("0min"));
    }

    @Test
    @DisplayName("Factor over base is the number of base bars per bar")
    void factorOverBase() {
        assertEquals(1, Frequency.FIVE_MINUTES.factorOver(Frequency.FIVE_MINUTES));
        assertEquals(2, Frequency.TEN_MINUTES.factorOver(Frequency.FIVE_MINUTES));
        assertEquals(3, Frequency.FIFTEEN_MINUTES.factorOver(Frequency.FIVE_MINUTES));
        assertEquals(12, new Frequency(60).factorOver(Frequency.FIVE_MINUTES));
    }

    @Test
    @DisplayName("Non-multiples and finer frequencies have no factor")
    void rejectsNonMultiples() {
        assertThrows(IllegalArgumentException.class, () -> new Frequency(7).factorOver(Frequency.FIVE_MINUTES));
        assertThrows(IllegalArgumentException.class, () -> new Frequency(1).factorOver(Frequency.FIVE_MINUTES));
    }

    @Test
    @DisplayName("Labels whole hours in hours")
    void labels() {
        assertEquals("5min", Frequency.FIVE_MINUTES.label());
        assertEquals("90min", new Frequency(90).label());
        assertEquals("2h", new Frequency(120).toString());
    }
}
