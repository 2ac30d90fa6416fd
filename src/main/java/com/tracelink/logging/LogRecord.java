package com.tracelink.logging;

import org.slf4j.event.Level;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One structured log emission. {@code traceId} and {@code spanId} are present
 * only if a span was current on the emitting thread.
 */
public record LogRecord(
        Instant timestamp,
        Level level,
        String logger,
        String message,
        Map<String, Object> extraFields,
        String traceId,
        String spanId
) {
    public LogRecord {
        extraFields = extraFields == null || extraFields.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
    }

    public boolean isCorrelated() {
        return traceId != null;
    }

    /**
     * Flat field map in rendering order. Extra fields come last and cannot
     * overwrite the fixed ones.
     */
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("timestamp", timestamp.toString());
        fields.put("level", level.name());
        fields.put("logger", logger);
        fields.put("message", message);
        if (traceId != null) {
            fields.put("traceID", traceId);
            fields.put("spanID", spanId);
        }
        extraFields.forEach(fields::putIfAbsent);
        return fields;
    }
}
