package com.daychart.runner;

import com.daychart.core.model.*;
import com.daychart.engine.TradeDirection;
import com.daychart.engine.TradeParams;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A scan as written in a YAML scan file: which days and views to select,
 * and optionally which trade to simulate on them.
 *
 * <pre>
 * sources: [DAX, FTSE]
 * frequencies: [5min, 15min]
 * barsOptions: [36, all]
 * gapDirections: [GAP UP]
 * gapSizeClasses: []
 * prevDayFilters: [open_above_prev_high]
 * barFilters:
 *   - { bar: 1, direction: UP, bodyRatio: ">75%" }
 * simulation: { triggerBar: 1, direction: Long, targetPct: 50, stopPct: 50 }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanSettings {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private List<String> sources = new ArrayList<>();
    private List<String> frequencies = new ArrayList<>();
    private List<String> barsOptions = new ArrayList<>();
    private List<String> gapDirections = new ArrayList<>();
    private List<String> gapSizeClasses = new ArrayList<>();
    private List<String> prevDayFilters = new ArrayList<>();
    private List<BarFilterSettings> barFilters = new ArrayList<>();
    private SimulationSettings simulation;

    public ScanSettings() {
        // For Jackson
    }

    public static ScanSettings load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public static ScanSettings load(InputStream in) throws IOException {
        ScanSettings settings = YAML.readValue(in, ScanSettings.class);
        return settings != null ? settings : new ScanSettings();
    }

    /**
     * Convert to a filter spec.
     *
     * @throws IllegalArgumentException naming the first label that does not parse
     */
    @JsonIgnore
    public FilterSpec toFilterSpec() {
        FilterSpec.Builder builder = FilterSpec.builder().sources(sources);
        frequencies.forEach(f -> builder.frequencies(Frequency.parse(f)));
        barsOptions.forEach(b -> builder.barsOptions(BarsOption.parse(b)));
        gapDirections.forEach(g -> builder.gapDirections(GapDirection.fromLabel(g)));
        gapSizeClasses.forEach(g -> builder.gapSizeClasses(GapSizeClass.fromLabel(g)));
        prevDayFilters.forEach(p -> builder.priorDayFlags(PriorDayFlag.fromValue(p)));
        builder.barFilters(mergeByBar(barFilters));
        return builder.build();
    }

    /**
     * One constraint per bar number, ordered by bar number. A later entry for the same bar
     * replaces the earlier one, as when editing a bar in a filter form.
     */
    private static List<BarFilter> mergeByBar(List<BarFilterSettings> settings) {
        Map<Integer, BarFilter> byBar = new TreeMap<>();
        for (BarFilterSettings bf : settings) {
            BarFilter filter = bf.toBarFilter();
            byBar.put(filter.bar(), filter);
        }
        return new ArrayList<>(byBar.values());
    }

    @JsonIgnore
    public boolean hasSimulation() {
        return simulation != null;
    }

    // Getters and setters

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources != null ? sources : new ArrayList<>();
    }

    public List<String> getFrequencies() {
        return frequencies;
    }

    public void setFrequencies(List<String> frequencies) {
        this.frequencies = frequencies != null ? frequencies : new ArrayList<>();
    }

    public List<String> getBarsOptions() {
        return barsOptions;
    }

    public void setBarsOptions(List<String> barsOptions) {
        this.barsOptions = barsOptions != null ? barsOptions : new ArrayList<>();
    }

    public List<String> getGapDirections() {
        return gapDirections;
    }

    public void setGapDirections(List<String> gapDirections) {
        this.gapDirections = gapDirections != null ? gapDirections : new ArrayList<>();
    }

    public List<String> getGapSizeClasses() {
        return gapSizeClasses;
    }

    public void setGapSizeClasses(List<String> gapSizeClasses) {
        this.gapSizeClasses = gapSizeClasses != null ? gapSizeClasses : new ArrayList<>();
    }

    public List<String> getPrevDayFilters() {
        return prevDayFilters;
    }

    public void setPrevDayFilters(List<String> prevDayFilters) {
        this.prevDayFilters = prevDayFilters != null ? prevDayFilters : new ArrayList<>();
    }

    public List<BarFilterSettings> getBarFilters() {
        return barFilters;
    }

    public void setBarFilters(List<BarFilterSettings> barFilters) {
        this.barFilters = barFilters != null ? barFilters : new ArrayList<>();
    }

    public SimulationSettings getSimulation() {
        return simulation;
    }

    public void setSimulation(SimulationSettings simulation) {
        this.simulation = simulation;
    }

    /**
     * One per-bar constraint. A missing bodyRatio, or "any", matches every body ratio.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BarFilterSettings {
        private int bar;
        private String direction;
        private String bodyRatio;

        public BarFilterSettings() {
            // For Jackson
        }

        public BarFilterSettings(int bar, String direction, String bodyRatio) {
            this.bar = bar;
            this.direction = direction;
            this.bodyRatio = bodyRatio;
        }

        public BarFilter toBarFilter() {
            BodyRatioClass ratio = bodyRatio == null || bodyRatio.isBlank() || "any".equalsIgnoreCase(bodyRatio.trim())
                ? null
                : BodyRatioClass.fromLabel(bodyRatio);
            return new BarFilter(bar, BarDirection.fromLabel(direction), ratio);
        }

        public int getBar() {
            return bar;
        }

        public void setBar(int bar) {
            this.bar = bar;
        }

        public String getDirection() {
            return direction;
        }

        public void setDirection(String direction) {
            this.direction = direction;
        }

        public String getBodyRatio() {
            return bodyRatio;
        }

        public void setBodyRatio(String bodyRatio) {
            this.bodyRatio = bodyRatio;
        }
    }

    /**
     * Trade to simulate. Kept loosely typed so that bad values surface as
     * validation errors in the simulation result instead of parse failures.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SimulationSettings {
        private Double triggerBar;
        private String direction;
        private Double targetPct;
        private Double stopPct;

        public SimulationSettings() {
            // For Jackson
        }

        public SimulationSettings(Double triggerBar, String direction, Double targetPct, Double stopPct) {
            this.triggerBar = triggerBar;
            this.direction = direction;
            this.targetPct = targetPct;
            this.stopPct = stopPct;
        }

        /**
         * Problems that would prevent building trade parameters at all.
         */
        public List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (triggerBar == null) {
                errors.add("triggerBar is required");
            } else if (triggerBar != Math.rint(triggerBar) || Double.isInfinite(triggerBar)) {
                errors.add("triggerBar must be a whole number, got " + triggerBar);
            }
            if (direction == null) {
                errors.add("direction is required");
            } else {
                try {
                    TradeDirection.fromValue(direction);
                } catch (IllegalArgumentException e) {
                    errors.add(e.getMessage());
                }
            }
            if (targetPct == null) errors.add("targetPct is required");
            if (stopPct == null) errors.add("stopPct is required");
            return errors;
        }

        /**
         * Build trade parameters. Only call when {@link #validate()} is empty.
         */
        public TradeParams toTradeParams() {
            return new TradeParams(triggerBar.intValue(), TradeDirection.fromValue(direction), targetPct, stopPct);
        }

        public Double getTriggerBar() {
            return triggerBar;
        }

        public void setTriggerBar(Double triggerBar) {
            this.triggerBar = triggerBar;
        }

        public String getDirection() {
            return direction;
        }

        public void setDirection(String direction) {
            this.direction = direction;
        }

        public Double getTargetPct() {
            return targetPct;
        }

        public void setTargetPct(Double targetPct) {
            this.targetPct = targetPct;
        }

        public Double getStopPct() {
            return stopPct;
        }

        public void setStopPct(Double stopPct) {
            this.stopPct = stopPct;
        }
    }
}
