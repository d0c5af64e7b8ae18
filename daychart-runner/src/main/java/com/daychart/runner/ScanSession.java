package com.daychart.runner;

import com.daychart.core.catalog.ChartCatalog;
import com.daychart.core.catalog.DatasetReader;
import com.daychart.core.filter.FilterEngine;
import com.daychart.core.model.ChartView;
import com.daychart.core.model.FilterSpec;
import com.daychart.engine.SimulationResult;
import com.daychart.engine.TradeSimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Load, filter, simulate: one scan from dataset file to results.
 */
public class ScanSession {

    private static final Logger LOG = LoggerFactory.getLogger(ScanSession.class);

    private final DatasetReader reader;
    private final FilterEngine filterEngine;
    private final TradeSimulator simulator;

    public ScanSession(DatasetReader reader, FilterEngine filterEngine, TradeSimulator simulator) {
        this.reader = reader;
        this.filterEngine = filterEngine;
        this.simulator = simulator;
    }

    public ScanSession(int barNumberCeiling) {
        this(new DatasetReader(barNumberCeiling), new FilterEngine(), new TradeSimulator());
    }

    /**
     * Read the dataset and run the scan on it.
     */
    public ScanOutcome run(Path dataset, ScanSettings settings) throws IOException {
        return run(reader.read(dataset), settings);
    }

    /**
     * Run the scan on an already loaded catalog.
     */
    public ScanOutcome run(ChartCatalog catalog, ScanSettings settings) {
        FilterSpec spec = settings.toFilterSpec();
        List<ChartView> views = filterEngine.generate(catalog, spec);
        LOG.info("Scan matched {} views across {} frequencies and {} bar options",
            views.size(), spec.frequencies().size(), spec.barsOptions().size());

        SimulationResult simulation = null;
        if (settings.hasSimulation()) {
            ScanSettings.SimulationSettings sim = settings.getSimulation();
            List<String> errors = sim.validate();
            simulation = errors.isEmpty()
                ? simulator.simulate(views, sim.toTradeParams())
                : SimulationResult.invalid(null, errors);
        }
        return new ScanOutcome(catalog, views, simulation);
    }
}
