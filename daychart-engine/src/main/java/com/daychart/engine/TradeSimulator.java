package com.daychart.engine;

import com.daychart.core.model.Bar;
import com.daychart.core.model.ChartView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Backtests a single target/stop trade per chart view.
 *
 * The trade enters at the close of the trigger bar. Target and stop are offsets of the
 * trigger bar's range. Bars after the trigger are scanned in order until one of them
 * reaches a level. Each view is evaluated on its own; nothing carries over between views.
 *
 * OHLC bars hold no intrabar path, so a bar that reaches both levels is skipped rather
 * than guessed.
 */
public class TradeSimulator {

    private static final Logger LOG = LoggerFactory.getLogger(TradeSimulator.class);

    /**
     * Simulate the trade over every view.
     *
     * @return per-view results in input order plus aggregate stats, or an invalid result
     *         naming the broken rules if the parameters are unusable
     */
    public SimulationResult simulate(List<ChartView> views, TradeParams params) {
        if (params == null) {
            LOG.warn("Simulation rejected: no trade parameters");
            return SimulationResult.invalid(null, List.of("trade parameters are required"));
        }
        List<String> errors = params.validate();
        if (!errors.isEmpty()) {
            LOG.warn("Simulation rejected: {}", errors);
            return SimulationResult.invalid(params, errors);
        }

        List<TradeResult> trades = new ArrayList<>(views.size());
        for (ChartView view : views) {
            trades.add(simulateOne(view, params));
        }

        SimulationResult result = SimulationResult.of(params, trades);
        LOG.debug("Simulated {} from bar {} (target {}%, stop {}%) over {} views: {}",
            params.direction(), params.triggerBar(), params.targetPct(), params.stopPct(),
            views.size(), result.stats().getSummary());
        return result;
    }

    /**
     * Simulate the trade on one view. Callers validate the parameters first.
     */
    TradeResult simulateOne(ChartView view, TradeParams params) {
        return simulateBars(view.key(), view.bars(), params);
    }

    /**
     * Walk-forward resolution over a bar sequence.
     */
    TradeResult simulateBars(String key, List<Bar> bars, TradeParams params) {
        int triggerIndex = params.triggerBar() - 1;
        if (triggerIndex >= bars.size()) {
            return TradeResult.skip(key, SkipReason.NOT_ENOUGH_BARS, null, null, null);
        }

        Bar trigger = bars.get(triggerIndex);
        double entry = trigger.close();
        double range = trigger.range();
        if (range <= 0) {
            return TradeResult.skip(key, SkipReason.ZERO_RANGE, entry, null, null);
        }

        double targetOffset = (params.targetPct() / 100) * range;
        double stopOffset = (params.stopPct() / 100) * range;
        boolean isLong = params.direction().isLong();

        double targetPrice;
        double stopPrice;
        if (isLong) {
            // Long: target above entry, stop below
            targetPrice = entry + targetOffset;
            stopPrice = entry - stopOffset;
        } else {
            // Short: target below entry, stop above
            targetPrice = entry - targetOffset;
            stopPrice = entry + stopOffset;
        }

        for (int i = triggerIndex + 1; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            boolean hitTarget;
            boolean hitStop;
            if (isLong) {
                hitTarget = bar.high() >= targetPrice;
                hitStop = bar.low() <= stopPrice;
            } else {
                hitTarget = bar.low() <= targetPrice;
                hitStop = bar.high() >= stopPrice;
            }

            if (hitTarget && hitStop) {
                return TradeResult.skip(key, SkipReason.BOTH_HIT, entry, targetPrice, stopPrice);
            }
            if (hitTarget) {
                return TradeResult.win(key, targetOffset, entry, targetPrice, stopPrice);
            }
            if (hitStop) {
                return TradeResult.loss(key, -stopOffset, entry, targetPrice, stopPrice);
            }
        }

        return TradeResult.skip(key, SkipReason.END_OF_DAY, entry, targetPrice, stopPrice);
    }
}
