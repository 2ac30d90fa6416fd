package com.tracelink.export;

import com.tracelink.logging.LogRecord;
import com.tracelink.metrics.MetricSnapshot;
import com.tracelink.trace.SpanData;

import java.util.List;

/**
 * Ships telemetry off-process. Implementations own the wire format and the
 * transport; failures are reported by throwing and are never retried by the
 * caller.
 */
public interface TelemetryExporter {

    void exportSpans(List<SpanData> spans);

    void exportLogs(List<LogRecord> logs);

    void exportMetrics(MetricSnapshot snapshot);
}
