package com.daychart.runner;

import com.daychart.core.catalog.ChartCatalog;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration for the day scanner.
 * Each value comes from a system property, then an environment variable, then a default.
 */
public class RunnerConfig {
    private static final String DEFAULT_DATASET = "data/ohlc_data.json";
    private static final String DEFAULT_SCAN_FILE = "scan.yaml";
    private static final int DEFAULT_DISPLAY_LIMIT = 50;

    private final Path datasetPath;
    private final Path scanPath;
    private final int displayLimit;
    private final int barNumberCeiling;

    public RunnerConfig(Path datasetPath, Path scanPath, int displayLimit, int barNumberCeiling) {
        this.datasetPath = datasetPath;
        this.scanPath = scanPath;
        this.displayLimit = displayLimit;
        this.barNumberCeiling = barNumberCeiling;
    }

    public static RunnerConfig load() {
        Path dataset = Paths.get(setting("daychart.dataset", "DAYCHART_DATASET", DEFAULT_DATASET));
        Path scan = Paths.get(setting("daychart.scan", "DAYCHART_SCAN", DEFAULT_SCAN_FILE));

        int displayLimit = Integer.parseInt(setting("daychart.display.limit", "DAYCHART_DISPLAY_LIMIT",
            String.valueOf(DEFAULT_DISPLAY_LIMIT)));

        int ceiling = Integer.parseInt(setting("daychart.bar.ceiling", "DAYCHART_BAR_CEILING",
            String.valueOf(ChartCatalog.DEFAULT_BAR_NUMBER_CEILING)));

        return new RunnerConfig(dataset, scan, displayLimit, ceiling);
    }

    /**
     * Load configuration, letting positional arguments override the paths:
     * args[0] = dataset file, args[1] = scan file.
     */
    public static RunnerConfig load(String[] args) {
        RunnerConfig config = load();
        Path dataset = args.length > 0 ? Paths.get(args[0]) : config.datasetPath;
        Path scan = args.length > 1 ? Paths.get(args[1]) : config.scanPath;
        return new RunnerConfig(dataset, scan, config.displayLimit, config.barNumberCeiling);
    }

    private static String setting(String property, String envVar, String defaultValue) {
        return System.getProperty(property, System.getenv().getOrDefault(envVar, defaultValue));
    }

    public Path getDatasetPath() {
        return datasetPath;
    }

    public Path getScanPath() {
        return scanPath;
    }

    public int getDisplayLimit() {
        return displayLimit;
    }

    public int getBarNumberCeiling() {
        return barNumberCeiling;
    }
}
