package com.tracelink.observability;

import com.tracelink.metrics.MetricSnapshot;
import com.tracelink.metrics.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryMetricsTest {

    private final MetricsRegistry registry =
            new MetricsRegistry(new SimpleMeterRegistry(), new double[] {0.1, 1.0}, Clock.systemUTC());
    private final TelemetryMetrics metrics = new TelemetryMetrics(registry);

    @Test
    void requestLifecycleUpdatesAllHttpInstruments() {
        metrics.requestStarted();
        metrics.requestStarted();
        metrics.requestFinished("/api/orders", "POST", 201, 0.25);

        MetricSnapshot snapshot = registry.snapshot();
        assertEquals(1.0, snapshot.find("http_requests_active", Map.of()).orElseThrow().value());
        assertEquals(1.0, snapshot.find("http_requests_total",
                Map.of("endpoint", "/api/orders", "method", "POST", "status", "201")).orElseThrow().value());
        assertEquals(0.25, snapshot.find("http_request_duration_seconds",
                Map.of("endpoint", "/api/orders", "method", "POST")).orElseThrow().value());
    }

    @Test
    void backgroundOutcomeIsLabelledBySuccess() {
        metrics.recordBackgroundOperation("cache-refresh", true, 0.4);
        metrics.recordBackgroundOperation("cache-refresh", false, 0.6);
        metrics.recordBackgroundError("cache-refresh", "update-cache");

        MetricSnapshot snapshot = registry.snapshot();
        assertEquals(1.0, snapshot.find("background_operations_total",
                Map.of("operation", "cache-refresh", "status", "success")).orElseThrow().value());
        assertEquals(1.0, snapshot.find("background_operations_total",
                Map.of("operation", "cache-refresh", "status", "failure")).orElseThrow().value());
        assertEquals(2, snapshot.find("background_operation_duration_seconds",
                Map.of("operation", "cache-refresh")).orElseThrow().count());
        assertEquals(1.0, snapshot.find("background_errors_total",
                Map.of("operation", "cache-refresh", "step", "update-cache")).orElseThrow().value());
    }
}
