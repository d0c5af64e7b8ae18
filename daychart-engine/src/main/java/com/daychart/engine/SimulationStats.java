package com.daychart.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Aggregate score of a simulation run.
 * Win rate and average P&L only count decisive trades.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SimulationStats(
    int wins,
    int losses,
    int skipped,
    int decisive,
    double winRate,    // percent, 0 when there are no decisive trades
    double avgPnl,     // per decisive trade, 0 when there are none
    double totalPnl
) {
    public static SimulationStats empty() {
        return new SimulationStats(0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Score a list of trade results.
     */
    public static SimulationStats calculate(List<TradeResult> trades) {
        int wins = 0;
        int losses = 0;
        int skipped = 0;
        double totalPnl = 0;

        for (TradeResult t : trades) {
            if (!t.outcome().isDecisive()) {
                skipped++;
                continue;
            }
            if (t.isWin()) {
                wins++;
            } else {
                losses++;
            }
            totalPnl += t.pnl();
        }

        int decisive = wins + losses;
        double winRate = decisive > 0 ? (double) wins / decisive * 100 : 0;
        double avgPnl = decisive > 0 ? totalPnl / decisive : 0;
        return new SimulationStats(wins, losses, skipped, decisive, winRate, avgPnl, totalPnl);
    }

    /**
     * Get summary string
     */
    public String getSummary() {
        return String.format("%d wins, %d losses, %d skipped, %.1f%% win rate, %+.2f avg P&L",
            wins, losses, skipped, winRate, avgPnl);
    }
}
