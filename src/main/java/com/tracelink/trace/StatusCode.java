package com.tracelink.trace;

public enum StatusCode {
    UNSET,
    OK,
    ERROR
}
