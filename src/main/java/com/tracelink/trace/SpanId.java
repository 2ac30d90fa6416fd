package com.tracelink.trace;

import java.util.HexFormat;

/**
 * 64-bit span identifier, unique per span.
 */
public record SpanId(long value) {

    public static final SpanId INVALID = new SpanId(0L);

    public boolean isValid() {
        return value != 0L;
    }

    /** Lowercase, zero-padded, 16 hex characters. */
    public String toHex() {
        return HexFormat.of().toHexDigits(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
