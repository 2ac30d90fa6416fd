package com.tracelink.metrics;

public enum InstrumentKind {
    COUNTER,
    HISTOGRAM,
    UP_DOWN_COUNTER
}
