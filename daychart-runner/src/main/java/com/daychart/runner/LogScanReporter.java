package com.daychart.runner;

import com.daychart.core.model.BarDirection;
import com.daychart.core.model.ChartView;
import com.daychart.engine.SimulationResult;
import com.daychart.engine.SimulationStats;
import com.daychart.engine.TradeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.StringJoiner;

/**
 * Writes a scan summary to the log: match counts, the first views, simulation stats.
 */
public class LogScanReporter implements ScanReporter {

    private static final Logger LOG = LoggerFactory.getLogger(LogScanReporter.class);

    /** Directions shown per view. */
    static final int DIRECTION_PREVIEW = 20;

    private final int displayLimit;

    public LogScanReporter(int displayLimit) {
        this.displayLimit = displayLimit;
    }

    @Override
    public void report(ScanOutcome outcome) {
        List<ChartView> views = outcome.views();
        int shown = Math.min(displayLimit, views.size());
        LOG.info("Catalog: {} sources, {} trading days, max bar number {} (ceiling {})",
            outcome.catalog().sources().size(), outcome.catalog().size(),
            outcome.catalog().maxBaseBarCount(), outcome.catalog().barNumberCeiling());
        LOG.info("Showing {} of {} matching charts", shown, views.size());

        for (int i = 0; i < shown; i++) {
            LOG.info("  {}", describe(views.get(i)));
        }

        if (outcome.hasSimulation()) {
            reportSimulation(outcome.simulation());
        }
    }

    private void reportSimulation(SimulationResult result) {
        if (!result.isValid()) {
            LOG.warn("Simulation not run, invalid parameters: {}", String.join("; ", result.errors()));
            return;
        }
        SimulationStats stats = result.stats();
        LOG.info("Simulation {}: {}", result.params(), stats.getSummary());
        LOG.info("  decisive {}, total P&L {}", stats.decisive(), String.format("%+.2f", stats.totalPnl()));
        if (LOG.isDebugEnabled()) {
            for (TradeResult trade : result.trades()) {
                LOG.debug("  {} {} {}", trade.key(), trade.outcome(),
                    trade.isSkip() ? trade.reason() : String.format("%+.2f", trade.pnl()));
            }
        }
    }

    /**
     * One-line description: source, date, timezone, frequency, bar count, gap, leading directions.
     */
    static String describe(ChartView view) {
        return String.format("%s %s (%s) %s/%s %d bars, %s %s | %s",
            view.source(),
            view.entry().formattedDate(),
            view.timezone(),
            view.frequency().label(),
            view.barsOption().label(),
            view.size(),
            view.gapDirection(),
            view.gapSizeClass(),
            directionPreview(view.directions(), DIRECTION_PREVIEW));
    }

    /**
     * Leading directions as "1:UP, 2:DOWN, ...".
     */
    static String directionPreview(List<BarDirection> directions, int max) {
        StringJoiner joiner = new StringJoiner(", ");
        for (int i = 0; i < Math.min(max, directions.size()); i++) {
            joiner.add((i + 1) + ":" + directions.get(i).getLabel());
        }
        return joiner.toString();
    }
}
