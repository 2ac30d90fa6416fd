package com.tracelink.trace;

@FunctionalInterface
public interface SpanRunnable<E extends Exception> {

    void run(Span span) throws E;
}
