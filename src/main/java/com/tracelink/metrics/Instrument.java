package com.tracelink.metrics;

import java.util.List;
import java.util.Map;

/**
 * A named instrument whose state is partitioned by label set.
 */
public abstract sealed class Instrument
        permits CounterInstrument, HistogramInstrument, UpDownCounterInstrument {

    protected final MetricsRegistry registry;
    protected final String name;
    protected final String description;
    protected final String unit;

    Instrument(MetricsRegistry registry, String name, String description, String unit) {
        this.registry = registry;
        this.name = name;
        this.description = description;
        this.unit = unit;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String unit() {
        return unit;
    }

    public abstract InstrumentKind kind();

    /**
     * Appends one point per series. Called with the registry's snapshot lock
     * held exclusively.
     */
    abstract void collect(List<MetricPoint> into);

    static Labels labels(Map<String, String> labels) {
        return Labels.of(labels);
    }
}
