package com.tracelink.logging;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import com.tracelink.trace.Tracer;

import java.util.Map;

/**
 * Logback converter for {@code %traceContext}: renders the trace and span id
 * the {@link Tracer} put into the MDC, or nothing outside a span. Reads the
 * MDC snapshot of the event, so it stays correct behind async appenders.
 */
public class TraceContextConverter extends ClassicConverter {

    @Override
    public String convert(ILoggingEvent event) {
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc == null) return "";

        String traceId = mdc.get(Tracer.TRACE_ID_MDC_KEY);
        if (traceId == null) return "";

        String spanId = mdc.get(Tracer.SPAN_ID_MDC_KEY);
        return "[trace=" + traceId + " span=" + (spanId != null ? spanId : "-") + "] ";
    }
}
