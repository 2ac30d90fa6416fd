package com.tracelink.trace;

/**
 * Receives every span once it is sealed.
 */
@FunctionalInterface
public interface SpanProcessor {

    SpanProcessor NOOP = span -> { };

    void onEnd(SpanData span);
}
