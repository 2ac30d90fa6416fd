package com.tracelink.trace;

import java.util.HexFormat;

/**
 * 128-bit trace identifier shared by every span of one trace.
 */
public record TraceId(long high, long low) {

    public static final TraceId INVALID = new TraceId(0L, 0L);

    public boolean isValid() {
        return high != 0L || low != 0L;
    }

    /** Lowercase, zero-padded, 32 hex characters. */
    public String toHex() {
        HexFormat hex = HexFormat.of();
        return hex.toHexDigits(high) + hex.toHexDigits(low);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
