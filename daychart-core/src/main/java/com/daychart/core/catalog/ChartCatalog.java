package com.daychart.core.catalog;

import com.daychart.core.bars.BarAggregator;
import com.daychart.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable, flattened view of a multi-source dataset.
 *
 * Entries keep dataset order: source-major, then days as given. A catalog is a plain
 * value, so several datasets can be loaded side by side.
 */
public final class ChartCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(ChartCatalog.class);

    /** Upper bound for bar numbers offered to per-bar filters. */
    public static final int DEFAULT_BAR_NUMBER_CEILING = 120;

    private static final Pattern DATE = Pattern.compile("\\d{8}");

    private final DatasetMetadata metadata;
    private final Frequency baseFrequency;
    private final Map<String, SourceInfo> sources;
    private final List<TradingDayEntry> entries;
    private final Map<String, TradingDayEntry> entriesByKey;
    private final int barNumberCeiling;

    private ChartCatalog(DatasetMetadata metadata, Map<String, SourceInfo> sources,
                         List<TradingDayEntry> entries, int barNumberCeiling) {
        this.metadata = metadata;
        this.baseFrequency = metadata.baseFrequencyOrDefault();
        this.sources = Collections.unmodifiableMap(sources);
        this.entries = List.copyOf(entries);
        this.barNumberCeiling = barNumberCeiling;

        Map<String, TradingDayEntry> byKey = new LinkedHashMap<>();
        for (TradingDayEntry entry : this.entries) {
            // First occurrence wins, as a linear scan would find it
            byKey.putIfAbsent(lookupKey(entry.source(), entry.date()), entry);
        }
        this.entriesByKey = Collections.unmodifiableMap(byKey);
    }

    /**
     * Flatten a raw dataset with the default bar-number ceiling.
     *
     * @throws DatasetFormatException if the dataset does not have the expected shape
     */
    public static ChartCatalog load(RawDataset dataset) {
        return load(dataset, DEFAULT_BAR_NUMBER_CEILING);
    }

    /**
     * Flatten a raw dataset. No filtering is performed.
     *
     * @param barNumberCeiling cap applied by {@link #maxBaseBarCount()}
     * @throws DatasetFormatException if the dataset does not have the expected shape
     */
    public static ChartCatalog load(RawDataset dataset, int barNumberCeiling) {
        if (barNumberCeiling < 1) {
            throw new IllegalArgumentException("Bar number ceiling must be at least 1, got " + barNumberCeiling);
        }
        if (dataset == null || dataset.sources() == null) {
            throw new DatasetFormatException("Dataset has no 'sources' list");
        }

        DatasetMetadata metadata = dataset.metadata() != null ? dataset.metadata() : DatasetMetadata.defaults();
        try {
            metadata.baseFrequencyOrDefault();
        } catch (IllegalArgumentException e) {
            throw new DatasetFormatException("Invalid base frequency in metadata: " + metadata.baseFrequency(), e);
        }

        Map<String, SourceInfo> sources = new LinkedHashMap<>();
        List<TradingDayEntry> entries = new ArrayList<>();

        for (int s = 0; s < dataset.sources().size(); s++) {
            RawDataset.Source source = dataset.sources().get(s);
            if (source == null || source.name() == null || source.name().isBlank()) {
                throw new DatasetFormatException("Source #" + s + " has no name");
            }
            if (source.tradingDays() == null) {
                throw new DatasetFormatException("Source '" + source.name() + "' has no 'tradingDays' list");
            }
            sources.putIfAbsent(source.name(),
                new SourceInfo(source.name(), source.timezone(), source.tradingHours()));

            for (RawDataset.Day day : source.tradingDays()) {
                entries.add(toEntry(source, day));
            }
        }

        ChartCatalog catalog = new ChartCatalog(metadata, sources, entries, barNumberCeiling);
        LOG.info("Loaded chart catalog: {} sources, {} trading days, base frequency {}",
            sources.size(), entries.size(), catalog.baseFrequency.label());
        return catalog;
    }

    private static TradingDayEntry toEntry(RawDataset.Source source, RawDataset.Day day) {
        if (day == null) {
            throw new DatasetFormatException("Source '" + source.name() + "' contains a null trading day");
        }
        String where = "Source '" + source.name() + "', day " + day.date();
        if (day.date() == null || !DATE.matcher(day.date()).matches()) {
            throw new DatasetFormatException(where + ": date must have 8 digits (YYYYMMDD)");
        }
        try {
            LocalDate.parse(day.date(), DateTimeFormatter.BASIC_ISO_DATE);
        } catch (DateTimeParseException e) {
            throw new DatasetFormatException(where + ": not a calendar date", e);
        }
        if (day.bars() == null) {
            throw new DatasetFormatException(where + ": missing 'bars'");
        }

        List<Bar> bars = new ArrayList<>(day.bars().size());
        for (int i = 0; i < day.bars().size(); i++) {
            try {
                bars.add(Bar.fromArray(day.bars().get(i)));
            } catch (IllegalArgumentException e) {
                throw new DatasetFormatException(where + ", bar #" + (i + 1) + ": " + e.getMessage(), e);
            }
        }

        GapDirection gapDirection;
        GapSizeClass gapSizeClass;
        try {
            gapDirection = GapDirection.fromLabel(day.gapDirection());
            gapSizeClass = GapSizeClass.fromLabel(day.gapSizeClass());
        } catch (IllegalArgumentException e) {
            throw new DatasetFormatException(where + ": " + e.getMessage(), e);
        }

        return new TradingDayEntry(
            source.name(),
            source.timezone(),
            source.tradingHours(),
            day.date(),
            gapDirection,
            gapSizeClass,
            day.openAbovePrevHigh(),
            day.closeBelowPrevLow(),
            day.prevClose(),
            day.prevHigh(),
            day.prevLow(),
            bars
        );
    }

    // ========== Queries ==========

    /**
     * Source names in dataset order.
     */
    public List<String> sources() {
        return List.copyOf(sources.keySet());
    }

    /**
     * Timezone and trading hours of a source, or null if the source is unknown.
     */
    public SourceInfo sourceMetadata(String name) {
        return sources.get(name);
    }

    /**
     * Largest base-granularity bar count of any entry, capped at the bar-number ceiling.
     */
    public int maxBaseBarCount() {
        return Math.min(longestDayBarCount(), barNumberCeiling);
    }

    /**
     * Base-granularity bar count of the longest entry, without the ceiling.
     * A bar limit at or above it never truncates anything.
     */
    public int longestDayBarCount() {
        int max = 0;
        for (TradingDayEntry entry : entries) {
            max = Math.max(max, entry.barCount());
        }
        return max;
    }

    public int barNumberCeiling() {
        return barNumberCeiling;
    }

    public List<TradingDayEntry> entries() {
        return entries;
    }

    /**
     * Total number of trading days across all sources.
     */
    public int size() {
        return entries.size();
    }

    public DatasetMetadata metadata() {
        return metadata;
    }

    public Frequency baseFrequency() {
        return baseFrequency;
    }

    public Optional<TradingDayEntry> entry(String source, String date) {
        return Optional.ofNullable(entriesByKey.get(lookupKey(source, date)));
    }

    // ========== Views ==========

    /**
     * Re-express a trading day at a frequency and bar count.
     * Bars are aggregated first, then truncated, then classified.
     *
     * @return the view, or empty if the catalog has no such (source, date)
     * @throws IllegalArgumentException if the frequency is not a whole multiple of the base frequency
     */
    public Optional<ChartView> view(String source, String date, Frequency frequency, BarsOption barsOption) {
        return entry(source, date).map(entry -> view(entry, frequency, barsOption));
    }

    /**
     * Re-express a catalog entry at a frequency and bar count.
     */
    public ChartView view(TradingDayEntry entry, Frequency frequency, BarsOption barsOption) {
        List<Bar> aggregated = BarAggregator.aggregate(entry.bars(), baseFrequency, frequency);
        return ChartView.of(entry, frequency, barsOption, barsOption.apply(aggregated));
    }

    private static String lookupKey(String source, String date) {
        return source + "\u0000" + date;
    }
}
