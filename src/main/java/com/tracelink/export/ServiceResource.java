package com.tracelink.export;

/**
 * Identifies this service on every exported batch.
 */
public record ServiceResource(String name, String version, String environment) {
}
