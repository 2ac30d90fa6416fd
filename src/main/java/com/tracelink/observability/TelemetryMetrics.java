package com.tracelink.observability;

import com.tracelink.metrics.CounterInstrument;
import com.tracelink.metrics.HistogramInstrument;
import com.tracelink.metrics.Labels;
import com.tracelink.metrics.MetricsRegistry;
import com.tracelink.metrics.UpDownCounterInstrument;

/**
 * The application's instruments. Names and label keys match what the
 * dashboards query, so change them together.
 */
public class TelemetryMetrics {

    private final MetricsRegistry registry;

    private final CounterInstrument httpRequests;
    private final HistogramInstrument httpRequestDuration;
    private final UpDownCounterInstrument httpRequestsActive;

    private final CounterInstrument backgroundOperations;
    private final HistogramInstrument backgroundOperationDuration;
    private final CounterInstrument backgroundErrors;

    public TelemetryMetrics(MetricsRegistry registry) {
        this.registry = registry;
        this.httpRequests = registry.counter("http_requests_total",
                "Total HTTP requests", "1");
        this.httpRequestDuration = registry.histogram("http_request_duration_seconds",
                "HTTP request duration in seconds", "s");
        this.httpRequestsActive = registry.upDownCounter("http_requests_active",
                "Number of active HTTP requests", "1");
        this.backgroundOperations = registry.counter("background_operations_total",
                "Total background operations executed", "1");
        this.backgroundOperationDuration = registry.histogram("background_operation_duration_seconds",
                "Background operation duration", "s");
        this.backgroundErrors = registry.counter("background_errors_total",
                "Total background operation errors", "1");
    }

    // --- HTTP metrics ---

    public void requestStarted() {
        httpRequestsActive.add(1);
    }

    public void requestFinished(String endpoint, String method, int status, double durationSeconds) {
        httpRequestsActive.add(-1);
        httpRequests.add(1, Labels.of("endpoint", endpoint, "method", method,
                "status", String.valueOf(status)));
        httpRequestDuration.record(durationSeconds, Labels.of("endpoint", endpoint, "method", method));
    }

    // --- Background workload metrics ---

    public void recordBackgroundOperation(String operation, boolean success, double durationSeconds) {
        backgroundOperations.add(1, Labels.of("operation", operation,
                "status", success ? "success" : "failure"));
        backgroundOperationDuration.record(durationSeconds, Labels.of("operation", operation));
    }

    public void recordBackgroundError(String operation, String step) {
        backgroundErrors.add(1, Labels.of("operation", operation, "step", step));
    }

    public MetricsRegistry getRegistry() {
        return registry;
    }
}
