package com.tracelink.trace;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One unit of work while it is open. Spans are created by {@link Tracer#open}
 * and are owned by the thread that opened them until {@link Tracer#close}
 * seals them into a {@link SpanData}. Mutations after that point are usage
 * errors: they are reported to the tracer and otherwise ignored.
 */
public final class Span {

    private final Tracer tracer;
    private final TraceId traceId;
    private final SpanId spanId;
    private final SpanId parentSpanId;
    private final Instant startTime;

    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final List<SpanEvent> events = new ArrayList<>();
    private String name;
    private SpanStatus status = SpanStatus.UNSET;
    private boolean ended;

    Span(Tracer tracer, TraceId traceId, SpanId spanId, SpanId parentSpanId,
         String name, Instant startTime) {
        this.tracer = tracer;
        this.traceId = traceId;
        this.spanId = spanId;
        this.parentSpanId = parentSpanId;
        this.name = name;
        this.startTime = startTime;
    }

    public TraceId traceId() { return traceId; }
    public SpanId spanId() { return spanId; }
    public SpanId parentSpanId() { return parentSpanId; }
    public Instant startTime() { return startTime; }
    public boolean isRoot() { return parentSpanId == null; }

    public synchronized String name() { return name; }
    public synchronized SpanStatus status() { return status; }
    public synchronized boolean isEnded() { return ended; }

    public synchronized Map<String, Object> attributes() {
        return Map.copyOf(attributes);
    }

    public synchronized List<SpanEvent> events() {
        return List.copyOf(events);
    }

    public TraceContext context() {
        return new TraceContext(traceId, spanId);
    }

    public synchronized Span updateName(String newName) {
        if (rejectIfEnded("update_name")) return this;
        this.name = newName;
        return this;
    }

    public Span setAttribute(String key, String value) {
        return putAttribute(key, value);
    }

    public Span setAttribute(String key, long value) {
        return putAttribute(key, value);
    }

    public Span setAttribute(String key, double value) {
        return putAttribute(key, value);
    }

    public Span setAttribute(String key, boolean value) {
        return putAttribute(key, value);
    }

    /**
     * Stores a scalar attribute. Integral numbers are widened to {@code Long},
     * floating point numbers to {@code Double}; anything else non-scalar is
     * stored as its string form.
     */
    public Span setAttribute(String key, Object value) {
        return putAttribute(key, value);
    }

    public Span addEvent(String eventName) {
        return addEvent(eventName, Map.of());
    }

    public synchronized Span addEvent(String eventName, Map<String, ?> eventAttributes) {
        if (rejectIfEnded("add_event")) return this;
        Map<String, Object> normalized = new LinkedHashMap<>();
        eventAttributes.forEach((k, v) -> normalized.put(k, normalize(v)));
        events.add(new SpanEvent(eventName, tracer.now(), normalized));
        return this;
    }

    public synchronized Span setStatus(SpanStatus newStatus) {
        if (rejectIfEnded("set_status")) return this;
        this.status = newStatus;
        return this;
    }

    public Span setStatus(StatusCode code, String description) {
        return setStatus(new SpanStatus(code, description));
    }

    /**
     * Adds an {@code exception} event describing the throwable. Does not
     * change the status.
     */
    public Span recordException(Throwable error) {
        Map<String, Object> eventAttributes = new LinkedHashMap<>();
        eventAttributes.put("exception.type", error.getClass().getName());
        if (error.getMessage() != null) {
            eventAttributes.put("exception.message", error.getMessage());
        }
        return addEvent("exception", eventAttributes);
    }

    private synchronized Span putAttribute(String key, Object value) {
        if (rejectIfEnded("set_attribute")) return this;
        if (key == null || value == null) {
            return this;
        }
        attributes.put(key, normalize(value));
        return this;
    }

    synchronized SpanData end(Instant endTime) {
        ended = true;
        return new SpanData(traceId, spanId, parentSpanId, name, startTime, endTime,
                attributes, events, status);
    }

    private boolean rejectIfEnded(String operation) {
        if (ended) {
            tracer.reportUsageError("mutate_closed_span", this, operation);
            return true;
        }
        return false;
    }

    private static Object normalize(Object value) {
        if (value instanceof String || value instanceof Boolean
                || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return "Span[name=" + name() + ", traceId=" + traceId + ", spanId=" + spanId + "]";
    }
}
