package com.daychart.core.filter;

import com.daychart.core.catalog.ChartCatalog;
import com.daychart.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Selects trading days and generates the requested chart views.
 *
 * Pipeline per catalog entry:
 * 1. entry filters (source, gap direction, gap size, prior-day flags)
 * 2. one view per (frequency, bars option) pair, dropping views under {@link #MIN_VIEW_BARS} bars;
 *    a limit no shorter than the catalog's longest day counts as the full day
 * 3. per-bar filters, all of which must match
 *
 * Output follows catalog order, then frequency, then bars option. Filters never throw
 * for data they cannot evaluate; the view is simply excluded.
 */
public class FilterEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FilterEngine.class);

    /** Views with fewer bars are not usable and are silently dropped. */
    public static final int MIN_VIEW_BARS = 5;

    /**
     * Generate every view of the catalog that passes the filter.
     */
    public List<ChartView> generate(ChartCatalog catalog, FilterSpec spec) {
        List<ChartView> results = new ArrayList<>();
        int entriesMatched = 0;
        int viewsDropped = 0;
        List<BarsOption> barsOptions = resolveBarsOptions(spec.barsOptions(), catalog.longestDayBarCount());

        for (TradingDayEntry entry : catalog.entries()) {
            if (!matchesEntry(entry, spec)) {
                continue;
            }
            entriesMatched++;

            for (Frequency frequency : spec.frequencies()) {
                for (BarsOption barsOption : barsOptions) {
                    ChartView view = catalog.view(entry, frequency, barsOption);
                    if (view.size() < MIN_VIEW_BARS) {
                        viewsDropped++;
                        continue;
                    }
                    if (matchesBarFilters(view, spec.barFilters())) {
                        results.add(view);
                    }
                }
            }
        }

        LOG.debug("Filter matched {} of {} days, {} views ({} too short)",
            entriesMatched, catalog.size(), results.size(), viewsDropped);
        return results;
    }

    /**
     * Replace limits that cannot truncate any day of the catalog with {@link BarsOption#ALL},
     * then drop the duplicates this creates.
     */
    static List<BarsOption> resolveBarsOptions(List<BarsOption> options, int longestDay) {
        Set<BarsOption> resolved = new LinkedHashSet<>();
        for (BarsOption option : options) {
            if (option instanceof BarsOption.Limited limited && limited.count() >= longestDay) {
                resolved.add(BarsOption.ALL);
            } else {
                resolved.add(option);
            }
        }
        return new ArrayList<>(resolved);
    }

    /**
     * Entry-level filters: each non-empty dimension requires membership,
     * and every requested prior-day flag must be set on the entry.
     */
    public static boolean matchesEntry(TradingDayEntry entry, FilterSpec spec) {
        if (!spec.sources().isEmpty() && !spec.sources().contains(entry.source())) {
            return false;
        }
        if (!spec.gapDirections().isEmpty() && !spec.gapDirections().contains(entry.gapDirection())) {
            return false;
        }
        if (!spec.gapSizeClasses().isEmpty() && !spec.gapSizeClasses().contains(entry.gapSizeClass())) {
            return false;
        }
        for (PriorDayFlag flag : spec.priorDayFlags()) {
            if (!flag.isSetOn(entry)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Per-bar filters. An out-of-range bar number excludes the view.
     */
    public static boolean matchesBarFilters(ChartView view, List<BarFilter> barFilters) {
        for (BarFilter filter : barFilters) {
            if (!filter.matches(view)) {
                return false;
            }
        }
        return true;
    }
}
