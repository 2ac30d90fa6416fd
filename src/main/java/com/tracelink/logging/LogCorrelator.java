package com.tracelink.logging;

import com.tracelink.trace.TraceContext;
import com.tracelink.trace.Tracer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Emits structured log records stamped with the identity of the span that is
 * current on the calling thread.
 *
 * <p>The trace and span ids are read once, at emission, from the caller's own
 * context stack, so a record can only ever carry ids of a span opened on the
 * same thread. With no span open the record is simply uncorrelated.
 */
public class LogCorrelator {

    private static final Logger log = LoggerFactory.getLogger(LogCorrelator.class);

    private final Tracer tracer;
    private final List<LogSink> sinks;
    private final String loggerName;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public LogCorrelator(Tracer tracer, List<LogSink> sinks, String loggerName,
                         Clock clock, MeterRegistry meterRegistry) {
        this.tracer = tracer;
        this.sinks = List.copyOf(sinks);
        this.loggerName = loggerName;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public LogRecord info(String message, Map<String, ?> extraFields) {
        return emit(Level.INFO, message, extraFields);
    }

    public LogRecord warn(String message, Map<String, ?> extraFields) {
        return emit(Level.WARN, message, extraFields);
    }

    public LogRecord error(String message, Map<String, ?> extraFields) {
        return emit(Level.ERROR, message, extraFields);
    }

    public LogRecord emit(Level level, String message, Map<String, ?> extraFields) {
        Optional<TraceContext> context = tracer.currentContext();
        LogRecord record = new LogRecord(
                clock.instant(),
                level,
                loggerName,
                message,
                extraFields == null ? Map.of() : new LinkedHashMap<>(extraFields),
                context.map(TraceContext::traceIdHex).orElse(null),
                context.map(TraceContext::spanIdHex).orElse(null));

        for (LogSink sink : sinks) {
            try {
                sink.accept(record);
            } catch (RuntimeException e) {
                log.warn("Log sink {} failed: {}", sink.name(), e.getMessage());
                Counter.builder("tracelink.logs.sink_failures")
                        .description("Log records a sink failed to accept")
                        .tag("sink", sink.name())
                        .register(meterRegistry)
                        .increment();
            }
        }
        return record;
    }

    /**
     * Ordered field map from alternating keys and values. Null values are
     * skipped.
     */
    public static Map<String, Object> fields(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("fields need key/value pairs");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                fields.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return fields;
    }
}
