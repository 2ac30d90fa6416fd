package com.tracelink.trace;

public record SpanStatus(StatusCode code, String description) {

    public static final SpanStatus UNSET = new SpanStatus(StatusCode.UNSET, null);
    public static final SpanStatus OK = new SpanStatus(StatusCode.OK, null);

    public SpanStatus {
        if (code == null) {
            throw new IllegalArgumentException("status code is required");
        }
        // Only an error carries a description
        if (code != StatusCode.ERROR) {
            description = null;
        }
    }

    public static SpanStatus error(String description) {
        return new SpanStatus(StatusCode.ERROR, description);
    }

    public boolean isError() {
        return code == StatusCode.ERROR;
    }
}
