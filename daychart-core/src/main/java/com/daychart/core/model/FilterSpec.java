package com.daychart.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Selection of trading days and views.
 *
 * Every set is a disjunction of acceptable values; an empty set leaves the dimension
 * unconstrained. Prior-day flags are all required. Bar filters must all match, including
 * several filters on the same bar.
 */
public record FilterSpec(
    Set<String> sources,
    List<Frequency> frequencies,
    List<BarsOption> barsOptions,
    Set<GapDirection> gapDirections,
    Set<GapSizeClass> gapSizeClasses,
    Set<PriorDayFlag> priorDayFlags,
    List<BarFilter> barFilters
) {
    public FilterSpec {
        sources = sources == null ? Set.of() : Set.copyOf(sources);
        frequencies = frequencies == null || frequencies.isEmpty()
            ? List.of(Frequency.FIVE_MINUTES)
            : List.copyOf(new LinkedHashSet<>(frequencies));
        barsOptions = barsOptions == null || barsOptions.isEmpty()
            ? List.of(BarsOption.ALL)
            : List.copyOf(new LinkedHashSet<>(barsOptions));
        gapDirections = gapDirections == null ? Set.of() : Set.copyOf(gapDirections);
        gapSizeClasses = gapSizeClasses == null ? Set.of() : Set.copyOf(gapSizeClasses);
        priorDayFlags = priorDayFlags == null ? Set.of() : Set.copyOf(priorDayFlags);
        barFilters = barFilters == null ? List.of() : List.copyOf(barFilters);
    }

    /**
     * All days of all sources, base frequency, full day, no constraints.
     */
    public static FilterSpec all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Set<String> sources = new LinkedHashSet<>();
        private final List<Frequency> frequencies = new ArrayList<>();
        private final List<BarsOption> barsOptions = new ArrayList<>();
        private final Set<GapDirection> gapDirections = new LinkedHashSet<>();
        private final Set<GapSizeClass> gapSizeClasses = new LinkedHashSet<>();
        private final Set<PriorDayFlag> priorDayFlags = new LinkedHashSet<>();
        private final List<BarFilter> barFilters = new ArrayList<>();

        public Builder sources(String... names) {
            sources.addAll(List.of(names));
            return this;
        }

        public Builder sources(Collection<String> names) {
            sources.addAll(names);
            return this;
        }

        public Builder frequencies(Frequency... values) {
            frequencies.addAll(List.of(values));
            return this;
        }

        public Builder frequencies(Collection<Frequency> values) {
            frequencies.addAll(values);
            return this;
        }

        public Builder barsOptions(BarsOption... values) {
            barsOptions.addAll(List.of(values));
            return this;
        }

        public Builder barsOptions(Collection<BarsOption> values) {
            barsOptions.addAll(values);
            return this;
        }

        public Builder gapDirections(GapDirection... values) {
            gapDirections.addAll(List.of(values));
            return this;
        }

        public Builder gapDirections(Collection<GapDirection> values) {
            gapDirections.addAll(values);
            return this;
        }

        public Builder gapSizeClasses(GapSizeClass... values) {
            gapSizeClasses.addAll(List.of(values));
            return this;
        }

        public Builder gapSizeClasses(Collection<GapSizeClass> values) {
            gapSizeClasses.addAll(values);
            return this;
        }

        public Builder priorDayFlags(PriorDayFlag... values) {
            priorDayFlags.addAll(List.of(values));
            return this;
        }

        public Builder priorDayFlags(Collection<PriorDayFlag> values) {
            priorDayFlags.addAll(values);
            return this;
        }

        public Builder barFilter(int bar, BarDirection direction) {
            barFilters.add(new BarFilter(bar, direction));
            return this;
        }

        public Builder barFilter(int bar, BarDirection direction, BodyRatioClass bodyRatio) {
            barFilters.add(new BarFilter(bar, direction, bodyRatio));
            return this;
        }

        public Builder barFilters(Collection<BarFilter> filters) {
            barFilters.addAll(filters);
            return this;
        }

        public FilterSpec build() {
            return new FilterSpec(sources, frequencies, barsOptions,
                gapDirections, gapSizeClasses, priorDayFlags, barFilters);
        }
    }
}
