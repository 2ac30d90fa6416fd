package com.tracelink.metrics;

import io.micrometer.core.instrument.Gauge;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Sum per label set that may go up and down, such as in-flight requests.
 */
public final class UpDownCounterInstrument extends Instrument {

    private final ConcurrentMap<Labels, DoubleAdder> series = new ConcurrentHashMap<>();

    UpDownCounterInstrument(MetricsRegistry registry, String name, String description, String unit) {
        super(registry, name, description, unit);
    }

    @Override
    public InstrumentKind kind() {
        return InstrumentKind.UP_DOWN_COUNTER;
    }

    public void add(double delta) {
        add(delta, Labels.empty());
    }

    public void add(double delta, Map<String, String> labels) {
        add(delta, labels(labels));
    }

    public void add(double delta, Labels labels) {
        registry.update(() -> series.computeIfAbsent(labels, this::newSeries).add(delta));
    }

    public double value(Map<String, String> labels) {
        DoubleAdder adder = series.get(labels(labels));
        return adder != null ? adder.sum() : 0.0;
    }

    private DoubleAdder newSeries(Labels labels) {
        DoubleAdder adder = new DoubleAdder();
        Gauge.builder(name, adder, DoubleAdder::sum)
                .description(description)
                .baseUnit(unit)
                .tags(labels.toTags())
                .strongReference(true)
                .register(registry.meterRegistry());
        return adder;
    }

    @Override
    void collect(List<MetricPoint> into) {
        series.forEach((labels, adder) ->
                into.add(MetricPoint.sum(name, kind(), labels, adder.sum())));
    }
}
