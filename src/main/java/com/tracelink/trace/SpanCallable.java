package com.tracelink.trace;

@FunctionalInterface
public interface SpanCallable<T, E extends Exception> {

    T call(Span span) throws E;
}
