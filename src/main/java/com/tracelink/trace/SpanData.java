package com.tracelink.trace;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a span after it was closed. This is what the export
 * pipeline receives.
 */
public record SpanData(
        TraceId traceId,
        SpanId spanId,
        SpanId parentSpanId,
        String name,
        Instant startTime,
        Instant endTime,
        Map<String, Object> attributes,
        List<SpanEvent> events,
        SpanStatus status
) {
    public SpanData {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        events = List.copyOf(events);
    }

    public boolean isRoot() {
        return parentSpanId == null;
    }

    public Duration duration() {
        return Duration.between(startTime, endTime);
    }
}
