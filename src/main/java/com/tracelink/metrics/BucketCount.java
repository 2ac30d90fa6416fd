package com.tracelink.metrics;

/**
 * Cumulative count of observations less than or equal to {@code upperBound}.
 * The last bucket of a histogram has an infinite upper bound.
 */
public record BucketCount(double upperBound, long count) {
}
