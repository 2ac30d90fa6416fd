package com.tracelink.metrics;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cumulative state of every series at one instant. Values never reset
 * between snapshots.
 */
public record MetricSnapshot(Instant timestamp, List<MetricPoint> points) {

    public MetricSnapshot {
        points = List.copyOf(points);
    }

    public Optional<MetricPoint> find(String name, Map<String, String> labels) {
        Map<String, String> wanted = Labels.of(labels).asMap();
        return points.stream()
                .filter(p -> p.name().equals(name) && p.labels().equals(wanted))
                .findFirst();
    }

    public List<MetricPoint> series(String name) {
        return points.stream().filter(p -> p.name().equals(name)).toList();
    }
}
