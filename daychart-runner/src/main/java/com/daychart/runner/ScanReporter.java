package com.daychart.runner;

/**
 * Receives the result of a scan for presentation (log output, chart rendering, document export).
 */
public interface ScanReporter {

    void report(ScanOutcome outcome);
}
