package com.tracelink.export;

/**
 * Telemetry signal types carried by the export pipeline.
 */
public enum Signal {
    SPAN("span"),
    LOG("log"),
    METRIC("metric");

    private final String tagValue;

    Signal(String tagValue) {
        this.tagValue = tagValue;
    }

    public String tagValue() {
        return tagValue;
    }
}
