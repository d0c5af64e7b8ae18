package com.daychart.runner;

import com.daychart.core.catalog.ChartCatalog;
import com.daychart.core.model.ChartView;
import com.daychart.engine.SimulationResult;

import java.util.List;

/**
 * Everything one scan produced.
 *
 * @param simulation null when the scan asked for no simulation
 */
public record ScanOutcome(
    ChartCatalog catalog,
    List<ChartView> views,
    SimulationResult simulation
) {
    public boolean hasSimulation() {
        return simulation != null;
    }
}
