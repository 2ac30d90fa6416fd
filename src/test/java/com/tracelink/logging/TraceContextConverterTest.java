package com.tracelink.logging;

import ch.qos.logback.classic.spi.LoggingEvent;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextConverterTest {

    private final TraceContextConverter converter = new TraceContextConverter();

    private static LoggingEvent eventWithMdc(Map<String, String> mdc) {
        LoggingEvent event = new LoggingEvent();
        event.setMDCPropertyMap(mdc);
        return event;
    }

    @Test
    void rendersTraceAndSpanFromMdc() {
        LoggingEvent event = eventWithMdc(Map.of(
                "traceId", "4bf92f3577b34da6a3ce929d0e0e4736",
                "spanId", "00f067aa0ba902b7"));

        assertEquals("[trace=4bf92f3577b34da6a3ce929d0e0e4736 span=00f067aa0ba902b7] ",
                converter.convert(event));
    }

    @Test
    void rendersNothingOutsideSpan() {
        assertEquals("", converter.convert(eventWithMdc(Map.of("requestId", "abc"))));
    }
}
