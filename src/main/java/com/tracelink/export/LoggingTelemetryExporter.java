package com.tracelink.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelink.logging.LogRecord;
import com.tracelink.metrics.MetricPoint;
import com.tracelink.metrics.MetricSnapshot;
import com.tracelink.trace.SpanData;
import com.tracelink.trace.SpanEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes every exported item as one JSON line to the {@code tracelink.export}
 * logger at DEBUG. Stands in for a collector client: enable the logger to see
 * exactly what would be shipped.
 */
public class LoggingTelemetryExporter implements TelemetryExporter {

    private static final Logger exportLog = LoggerFactory.getLogger("tracelink.export");

    private final ObjectMapper objectMapper;
    private final ServiceResource resource;

    public LoggingTelemetryExporter(ObjectMapper objectMapper, ServiceResource resource) {
        this.objectMapper = objectMapper;
        this.resource = resource;
    }

    @Override
    public void exportSpans(List<SpanData> spans) {
        if (!exportLog.isDebugEnabled()) return;
        for (SpanData span : spans) {
            write("span", spanFields(span));
        }
    }

    @Override
    public void exportLogs(List<LogRecord> logs) {
        if (!exportLog.isDebugEnabled()) return;
        for (LogRecord record : logs) {
            write("log", record.toFields());
        }
    }

    @Override
    public void exportMetrics(MetricSnapshot snapshot) {
        if (!exportLog.isDebugEnabled()) return;
        for (MetricPoint point : snapshot.points()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("timestamp", snapshot.timestamp().toString());
            fields.put("name", point.name());
            fields.put("kind", point.kind().name());
            fields.put("labels", point.labels());
            fields.put("value", point.value());
            if (point.count() > 0) {
                fields.put("count", point.count());
                fields.put("max", point.max());
                fields.put("buckets", point.buckets());
            }
            write("metric", fields);
        }
    }

    Map<String, Object> spanFields(SpanData span) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("traceID", span.traceId().toHex());
        fields.put("spanID", span.spanId().toHex());
        if (!span.isRoot()) {
            fields.put("parentSpanID", span.parentSpanId().toHex());
        }
        fields.put("name", span.name());
        fields.put("startTime", span.startTime().toString());
        fields.put("endTime", span.endTime().toString());
        fields.put("durationMs", span.duration().toMillis());
        fields.put("status", span.status().code().name());
        if (span.status().description() != null) {
            fields.put("statusMessage", span.status().description());
        }
        fields.put("attributes", span.attributes());
        if (!span.events().isEmpty()) {
            fields.put("events", span.events().stream().map(LoggingTelemetryExporter::eventFields).toList());
        }
        return fields;
    }

    private static Map<String, Object> eventFields(SpanEvent event) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", event.name());
        fields.put("timestamp", event.timestamp().toString());
        fields.put("attributes", event.attributes());
        return fields;
    }

    private void write(String signal, Map<String, Object> fields) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("signal", signal);
        envelope.put("service.name", resource.name());
        envelope.put("service.version", resource.version());
        envelope.put("deployment.environment", resource.environment());
        envelope.putAll(fields);
        try {
            exportLog.debug(objectMapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + signal + " for export", e);
        }
    }
}
