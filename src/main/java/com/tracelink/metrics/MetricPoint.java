package com.tracelink.metrics;

import java.util.List;
import java.util.Map;

/**
 * Value of one series at snapshot time. For counters and up/down counters
 * {@code value} is the running sum and the histogram fields are zero/empty.
 * For histograms {@code value} is the sum of observations.
 */
public record MetricPoint(
        String name,
        InstrumentKind kind,
        Map<String, String> labels,
        double value,
        long count,
        double max,
        List<BucketCount> buckets
) {
    public MetricPoint {
        labels = Map.copyOf(labels);
        buckets = List.copyOf(buckets);
    }

    static MetricPoint sum(String name, InstrumentKind kind, Labels labels, double value) {
        return new MetricPoint(name, kind, labels.asMap(), value, 0L, 0.0, List.of());
    }
}
