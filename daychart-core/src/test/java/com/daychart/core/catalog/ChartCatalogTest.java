package com.daychart.core.catalog;

import com.daychart.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChartCatalog loading, queries and view derivation.
 */
class ChartCatalogTest {

    private static final long T0 = 1704182400000L;

    private static List<double[]> upBars(int count, double start) {
        List<double[]> bars = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double open = start + i;
            bars.add(new double[] {T0 + i * 300_000L, open, open + 1, open, open + 1});
        }
        return bars;
    }

    private static RawDataset.Day day(String date, int barCount) {
        return new RawDataset.Day(date, "FLAT", "0-0.1%", false, false,
            100.0, 101.0, 99.0, upBars(barCount, 100));
    }

    private static RawDataset.Source source(String name, RawDataset.Day... days) {
        return new RawDataset.Source(name, "Europe/London", "08:00-16:30", Arrays.asList(days));
    }

    private static RawDataset dataset(RawDataset.Source... sources) {
        return new RawDataset(DatasetMetadata.defaults(), Arrays.asList(sources));
    }

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("Flattens source-major, keeping day order")
        void flattensInOrder() {
            ChartCatalog catalog = ChartCatalog.load(dataset(
                source("DAX", day("20240103", 6), day("20240102", 6)),
                source("FTSE", day("20240102", 6))));

            assertEquals(3, catalog.size());
            assertEquals(List.of("DAX", "FTSE"), catalog.sources());
            assertEquals(List.of("DAX/20240103", "DAX/20240102", "FTSE/20240102"),
                catalog.entries().stream().map(e -> e.source() + "/" + e.date()).toList());
        }

        @Test
        @DisplayName("Keeps source metadata and prior-day fields")
        void keepsMetadata() {
            ChartCatalog catalog = ChartCatalog.load(dataset(source("DAX", day("20240102", 6))));

            SourceInfo info = catalog.sourceMetadata("DAX");
            assertEquals("Europe/London", info.timezone());
            assertEquals("08:00-16:30", info.tradingHours());
            assertNull(catalog.sourceMetadata("NIKKEI"));

            TradingDayEntry entry = catalog.entries().get(0);
            assertEquals(GapDirection.FLAT, entry.gapDirection());
            assertEquals(GapSizeClass.UNDER_0_1, entry.gapSizeClass());
            assertEquals(100.0, entry.prevClose());
            assertEquals("Europe/London", catalog.view(entry, Frequency.FIVE_MINUTES, BarsOption.ALL).timezone());
            assertEquals(6, entry.barCount());
        }

        @Test
        @DisplayName("Missing metadata falls back to a 5min base")
        void defaultsMetadata() {
            ChartCatalog catalog = ChartCatalog.load(new RawDataset(null, List.of(source("DAX", day("20240102", 6)))));

            assertEquals(Frequency.FIVE_MINUTES, catalog.baseFrequency());
        }

        @Test
        @DisplayName("An empty source list gives an empty catalog")
        void emptyDataset() {
            ChartCatalog catalog = ChartCatalog.load(new RawDataset(null, List.of()));

            assertEquals(0, catalog.size());
            assertEquals(0, catalog.maxBaseBarCount());
            assertTrue(catalog.sources().isEmpty());
        }

        @Test
        @DisplayName("Max base bar count is capped at the ceiling")
        void maxBarCountCapped() {
            RawDataset data = dataset(source("DAX", day("20240102", 6), day("20240103", 9)));

            assertEquals(9, ChartCatalog.load(data).maxBaseBarCount());
            ChartCatalog capped = ChartCatalog.load(data, 7);
            assertEquals(7, capped.maxBaseBarCount());
            assertEquals(7, capped.barNumberCeiling());
            assertEquals(9, capped.longestDayBarCount());
            assertThrows(IllegalArgumentException.class, () -> ChartCatalog.load(data, 0));
        }
    }

    @Nested
    @DisplayName("Structural errors")
    class StructuralErrorTests {

        @Test
        @DisplayName("Missing sources list")
        void missingSources() {
            assertThrows(DatasetFormatException.class, () -> ChartCatalog.load(new RawDataset(null, null)));
            assertThrows(DatasetFormatException.class, () -> ChartCatalog.load(null));
        }

        @Test
        @DisplayName("Source without name or trading days")
        void badSource() {
            assertThrows(DatasetFormatException.class,
                () -> ChartCatalog.load(dataset(new RawDataset.Source(null, null, null, List.of()))));
            assertThrows(DatasetFormatException.class,
                () -> ChartCatalog.load(dataset(new RawDataset.Source("DAX", null, null, null))));
        }

        @Test
        @DisplayName("Day with a malformed date or missing bars")
        void badDay() {
            RawDataset.Day shortDate = new RawDataset.Day("2024-01-02", null, null, null, null,
                null, null, null, upBars(6, 100));
            RawDataset.Day noBars = new RawDataset.Day("20240102", null, null, null, null,
                null, null, null, null);

            assertThrows(DatasetFormatException.class, () -> ChartCatalog.load(dataset(source("DAX", shortDate))));
            assertThrows(DatasetFormatException.class, () -> ChartCatalog.load(dataset(source("DAX", noBars))));
        }

        @Test
        @DisplayName("Day with eight digits that are not a calendar date")
        void impossibleDate() {
            assertThrows(DatasetFormatException.class,
                () -> ChartCatalog.load(dataset(source("DAX", day("20241399", 6)))));
            assertThrows(DatasetFormatException.class,
                () -> ChartCatalog.load(dataset(source("DAX", day("20230229", 6)))));
        }

        @Test
        @DisplayName("Bar array with fewer than five values")
        void badBar() {
            List<double[]> bars = new ArrayList<>(upBars(3, 100));
            bars.add(new double[] {T0, 100, 101});
            RawDataset.Day broken = new RawDataset.Day("20240102", null, null, null, null,
                null, null, null, bars);

            DatasetFormatException e = assertThrows(DatasetFormatException.class,
                () -> ChartCatalog.load(dataset(source("DAX", broken))));
            assertTrue(e.getMessage().contains("bar #4"), e.getMessage());
        }

        @Test
        @DisplayName("Unknown gap label")
        void badGapLabel() {
            RawDataset.Day odd = new RawDataset.Day("20240102", "SIDEWAYS", null, null, null,
                null, null, null, upBars(6, 100));

            assertThrows(DatasetFormatException.class, () -> ChartCatalog.load(dataset(source("DAX", odd))));
        }

        @Test
        @DisplayName("Unparseable base frequency")
        void badBaseFrequency() {
            DatasetMetadata metadata = new DatasetMetadata(null, "weekly", List.of(), null, null);

            assertThrows(DatasetFormatException.class,
                () -> ChartCatalog.load(new RawDataset(metadata, List.of(source("DAX", day("20240102", 6))))));
        }
    }

    @Nested
    @DisplayName("Lookup and views")
    class ViewTests {

        private final ChartCatalog catalog = ChartCatalog.load(dataset(
            source("DAX", day("20240102", 12)),
            source("FTSE", day("20240102", 7))));

        @Test
        @DisplayName("Lookup miss is empty, not an error")
        void lookupMiss() {
            assertTrue(catalog.entry("DAX", "20991231").isEmpty());
            assertTrue(catalog.view("NIKKEI", "20240102", Frequency.FIVE_MINUTES, BarsOption.ALL).isEmpty());
        }

        @Test
        @DisplayName("Base frequency with all bars mirrors the entry")
        void baseView() {
            ChartView view = catalog.view("DAX", "20240102", Frequency.FIVE_MINUTES, BarsOption.ALL).orElseThrow();

            assertEquals(12, view.size());
            assertEquals(catalog.entry("DAX", "20240102").orElseThrow().bars(), view.bars());
            assertEquals("DAX-20240102-5min-all", view.key());
        }

        @Test
        @DisplayName("Aggregates before truncating")
        void aggregatesThenTruncates() {
            ChartView view = catalog.view("DAX", "20240102", Frequency.FIFTEEN_MINUTES, BarsOption.limited(3))
                .orElseThrow();

            assertEquals(3, view.size());
            Bar first = view.bars().get(0);
            assertEquals(100, first.open());
            assertEquals(103, first.high());
            assertEquals(100, first.low());
            assertEquals(103, first.close());
            assertEquals("DAX-20240102-15min-3", view.key());
        }

        @Test
        @DisplayName("Partial trailing chunk is part of the view")
        void partialChunk() {
            Optional<ChartView> view = catalog.view("FTSE", "20240102", Frequency.TEN_MINUTES, BarsOption.ALL);

            assertEquals(4, view.orElseThrow().size());
        }

        @Test
        @DisplayName("Classifications describe the derived bars")
        void classificationsMatchBars() {
            ChartView view = catalog.view("DAX", "20240102", Frequency.TEN_MINUTES, BarsOption.ALL).orElseThrow();

            assertEquals(view.size(), view.directions().size());
            assertEquals(view.size(), view.bodyRatios().size());
            assertTrue(view.directions().stream().allMatch(d -> d == BarDirection.UP));
            // Two 1-point up bars stacked: body 2, range 2
            assertTrue(view.bodyRatios().stream().allMatch(r -> r == BodyRatioClass.ABOVE_75));
        }

        @Test
        @DisplayName("Frequencies that are not a multiple of the base are rejected")
        void nonMultipleFrequency() {
            assertThrows(IllegalArgumentException.class,
                () -> catalog.view("DAX", "20240102", new Frequency(7), BarsOption.ALL));
        }

        @Test
        @DisplayName("Duplicate (source, date) resolves to the first entry")
        void duplicateFirstWins() {
            ChartCatalog dup = ChartCatalog.load(dataset(source("DAX", day("20240102", 6), day("20240102", 9))));

            assertEquals(2, dup.size());
            assertEquals(6, dup.entry("DAX", "20240102").orElseThrow().barCount());
        }
    }
}
