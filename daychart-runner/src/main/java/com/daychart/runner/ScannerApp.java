package com.daychart.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Day Scanner - command-line entry point.
 *
 * Usage: ScannerApp [dataset.json] [scan.yaml]
 * Paths default to the daychart.dataset / daychart.scan settings.
 */
public class ScannerApp {
    private static final Logger LOG = LoggerFactory.getLogger(ScannerApp.class);

    public static void main(String[] args) {
        RunnerConfig config = RunnerConfig.load(args);
        LOG.info("Day Scanner starting: dataset {}, scan {}", config.getDatasetPath(), config.getScanPath());

        try {
            ScanSettings settings = ScanSettings.load(config.getScanPath());
            ScanSession session = new ScanSession(config.getBarNumberCeiling());
            ScanOutcome outcome = session.run(config.getDatasetPath(), settings);
            new LogScanReporter(config.getDisplayLimit()).report(outcome);
        } catch (IOException e) {
            LOG.error("Failed to read input: {}", e.getMessage(), e);
            System.exit(1);
        } catch (RuntimeException e) {
            LOG.error("Scan failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
