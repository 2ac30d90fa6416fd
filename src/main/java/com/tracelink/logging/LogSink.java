package com.tracelink.logging;

/**
 * Destination for correlated log records. Implementations must not block the
 * caller for long; bounded or async hand-off is expected.
 */
public interface LogSink {

    String name();

    void accept(LogRecord record);
}
