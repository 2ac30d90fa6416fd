package com.tracelink.trace;

import java.util.Random;

/**
 * Draws trace and span ids from a caller supplied random source.
 * {@link Random} is safe for concurrent use; pass a seeded instance for
 * reproducible ids in tests. All-zero ids are invalid and never returned.
 */
public class IdGenerator {

    private final Random random;

    public IdGenerator(Random random) {
        this.random = random;
    }

    public TraceId newTraceId() {
        long high;
        long low;
        do {
            high = random.nextLong();
            low = random.nextLong();
        } while (high == 0L && low == 0L);
        return new TraceId(high, low);
    }

    public SpanId newSpanId() {
        long value;
        do {
            value = random.nextLong();
        } while (value == 0L);
        return new SpanId(value);
    }
}
