package com.daychart.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TradeParamsTest {

    @Test
    @DisplayName("Valid parameters have no errors")
    void valid() {
        TradeParams params = new TradeParams(1, TradeDirection.SHORT, 50, 25);

        assertTrue(params.isValid());
        assertEquals(List.of(), params.validate());
    }

    @Test
    @DisplayName("Every broken rule is reported")
    void reportsAllErrors() {
        TradeParams params = new TradeParams(0, null, 0, Double.NaN);

        List<String> errors = params.validate();

        assertEquals(4, errors.size());
        assertTrue(errors.get(0).startsWith("triggerBar"));
        assertTrue(errors.get(1).startsWith("direction"));
        assertTrue(errors.get(2).startsWith("targetPct"));
        assertTrue(errors.get(3).startsWith("stopPct"));
    }

    @Test
    @DisplayName("Infinite percentages are rejected")
    void rejectsInfinity() {
        assertFalse(new TradeParams(1, TradeDirection.LONG, Double.POSITIVE_INFINITY, 10).isValid());
    }

    @Test
    @DisplayName("Directions parse case-insensitively")
    void directions() {
        assertEquals(TradeDirection.LONG, TradeDirection.fromValue("long"));
        assertEquals(TradeDirection.SHORT, TradeDirection.fromValue(" Short "));
        assertThrows(IllegalArgumentException.class, () -> TradeDirection.fromValue("sideways"));
        assertThrows(IllegalArgumentException.class, () -> TradeDirection.fromValue(null));
    }
}
