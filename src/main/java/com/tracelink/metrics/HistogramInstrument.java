package com.tracelink.metrics;

import io.micrometer.core.instrument.DistributionSummary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Bucketed distribution per label set over fixed upper bounds. Bucket counts
 * are cumulative and never decay, unlike Micrometer's own time-windowed
 * histograms; observations are also mirrored into a Micrometer
 * {@link DistributionSummary} for the actuator endpoints. Negative and NaN
 * observations are rejected as usage errors.
 */
public final class HistogramInstrument extends Instrument {

    private final double[] bounds;
    private final ConcurrentMap<Labels, Series> series = new ConcurrentHashMap<>();

    HistogramInstrument(MetricsRegistry registry, String name, String description, String unit,
                        double[] bounds) {
        super(registry, name, description, unit);
        this.bounds = bounds.clone();
        Arrays.sort(this.bounds);
    }

    @Override
    public InstrumentKind kind() {
        return InstrumentKind.HISTOGRAM;
    }

    public double[] bounds() {
        return bounds.clone();
    }

    public void record(double value) {
        record(value, Labels.empty());
    }

    public void record(double value, Map<String, String> labels) {
        record(value, labels(labels));
    }

    public void record(double value, Labels labels) {
        if (Double.isNaN(value)) {
            registry.reportUsageError(name, "nan_observation");
            return;
        }
        // DistributionSummary drops negative amounts, so the series must too
        if (value < 0) {
            registry.reportUsageError(name, "negative_observation");
            return;
        }
        registry.update(() -> series.computeIfAbsent(labels, this::newSeries).record(value));
    }

    private Series newSeries(Labels labels) {
        DistributionSummary summary = DistributionSummary.builder(name)
                .description(description)
                .baseUnit(unit)
                .tags(labels.toTags())
                .serviceLevelObjectives(bounds)
                .register(registry.meterRegistry());
        return new Series(summary);
    }

    @Override
    void collect(List<MetricPoint> into) {
        series.forEach((labels, s) -> into.add(s.toPoint(labels)));
    }

    private final class Series {

        private final DistributionSummary mirror;
        private final LongAdder[] bucketCounts;
        private final LongAdder count = new LongAdder();
        private final DoubleAdder sum = new DoubleAdder();
        private final DoubleAccumulator max = new DoubleAccumulator(Math::max, Double.NEGATIVE_INFINITY);

        Series(DistributionSummary mirror) {
            this.mirror = mirror;
            // one extra bucket for observations above the last bound
            this.bucketCounts = new LongAdder[bounds.length + 1];
            for (int i = 0; i < bucketCounts.length; i++) {
                bucketCounts[i] = new LongAdder();
            }
        }

        void record(double value) {
            bucketCounts[bucketIndex(value)].increment();
            count.increment();
            sum.add(value);
            max.accumulate(value);
            mirror.record(value);
        }

        MetricPoint toPoint(Labels labels) {
            List<BucketCount> buckets = new ArrayList<>(bucketCounts.length);
            long running = 0;
            for (int i = 0; i < bucketCounts.length; i++) {
                running += bucketCounts[i].sum();
                double upper = i < bounds.length ? bounds[i] : Double.POSITIVE_INFINITY;
                buckets.add(new BucketCount(upper, running));
            }
            long n = count.sum();
            return new MetricPoint(name, kind(), labels.asMap(), sum.sum(), n,
                    n == 0 ? 0.0 : max.get(), buckets);
        }
    }

    private int bucketIndex(double value) {
        for (int i = 0; i < bounds.length; i++) {
            if (value <= bounds[i]) {
                return i;
            }
        }
        return bounds.length;
    }
}
