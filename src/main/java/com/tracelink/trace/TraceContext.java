package com.tracelink.trace;

/**
 * Identity of the span that is current in some execution context.
 * This is what gets stamped onto correlated log records.
 */
public record TraceContext(TraceId traceId, SpanId spanId) {

    public String traceIdHex() {
        return traceId.toHex();
    }

    public String spanIdHex() {
        return spanId.toHex();
    }
}
