package com.daychart.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Result of simulating one parameter set over a list of chart views.
 *
 * A run with rejected parameters carries its errors and no stats or trades, so callers
 * can tell it apart from a valid run that simply had no views.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SimulationResult(
    TradeParams params,
    SimulationStats stats,
    List<TradeResult> trades,
    List<String> errors
) {
    public SimulationResult {
        trades = trades == null ? List.of() : List.copyOf(trades);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static SimulationResult of(TradeParams params, List<TradeResult> trades) {
        return new SimulationResult(params, SimulationStats.calculate(trades), trades, List.of());
    }

    public static SimulationResult invalid(TradeParams params, List<String> errors) {
        return new SimulationResult(params, null, List.of(), errors);
    }

    /**
     * Check if the parameters were accepted and the simulation ran
     */
    @JsonIgnore
    public boolean isValid() {
        return errors.isEmpty();
    }
}
