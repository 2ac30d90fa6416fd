package com.tracelink.metrics;

import io.micrometer.core.instrument.FunctionCounter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Monotonic sum per label set. Negative deltas are rejected as usage errors.
 */
public final class CounterInstrument extends Instrument {

    private final ConcurrentMap<Labels, DoubleAdder> series = new ConcurrentHashMap<>();

    CounterInstrument(MetricsRegistry registry, String name, String description, String unit) {
        super(registry, name, description, unit);
    }

    @Override
    public InstrumentKind kind() {
        return InstrumentKind.COUNTER;
    }

    public void add(double delta) {
        add(delta, Labels.empty());
    }

    public void add(double delta, Map<String, String> labels) {
        add(delta, labels(labels));
    }

    public void add(double delta, Labels labels) {
        if (delta < 0 || Double.isNaN(delta)) {
            registry.reportUsageError(name, "negative_counter_delta");
            return;
        }
        registry.update(() -> series.computeIfAbsent(labels, this::newSeries).add(delta));
    }

    public double value(Map<String, String> labels) {
        DoubleAdder adder = series.get(labels(labels));
        return adder != null ? adder.sum() : 0.0;
    }

    private DoubleAdder newSeries(Labels labels) {
        DoubleAdder adder = new DoubleAdder();
        FunctionCounter.builder(name, adder, DoubleAdder::sum)
                .description(description)
                .baseUnit(unit)
                .tags(labels.toTags())
                .register(registry.meterRegistry());
        return adder;
    }

    @Override
    void collect(List<MetricPoint> into) {
        series.forEach((labels, adder) ->
                into.add(MetricPoint.sum(name, kind(), labels, adder.sum())));
    }
}
