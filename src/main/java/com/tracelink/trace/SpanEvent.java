package com.tracelink.trace;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SpanEvent(
        String name,
        Instant timestamp,
        Map<String, Object> attributes
) {
    public SpanEvent {
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
