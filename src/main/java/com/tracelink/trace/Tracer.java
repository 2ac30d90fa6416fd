package com.tracelink.trace;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Opens and closes spans on the calling thread's {@link ContextStack}.
 *
 * <p>{@link #inSpan} is the form application code should use: it guarantees
 * the span is closed exactly once and records a failure of the unit of work
 * on the span. {@link #open} and {@link #close} are the primitives it is built
 * from.
 *
 * <p>Every push and pop mirrors the new top of stack into the SLF4J MDC under
 * {@value #TRACE_ID_MDC_KEY} and {@value #SPAN_ID_MDC_KEY}, so plain log lines
 * written inside a span carry its identity as well.
 */
public class Tracer {

    public static final String TRACE_ID_MDC_KEY = "traceId";
    public static final String SPAN_ID_MDC_KEY = "spanId";

    private static final Logger log = LoggerFactory.getLogger(Tracer.class);

    private final IdGenerator idGenerator;
    private final ContextStorage contextStorage;
    private final SpanProcessor spanProcessor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public Tracer(IdGenerator idGenerator,
                  ContextStorage contextStorage,
                  SpanProcessor spanProcessor,
                  Clock clock,
                  MeterRegistry meterRegistry) {
        this.idGenerator = idGenerator;
        this.contextStorage = contextStorage;
        this.spanProcessor = spanProcessor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public Span open(String name) {
        return open(name, Map.of());
    }

    /**
     * Opens a span as a child of the calling thread's current span, or as the
     * root of a new trace when nothing is current, and makes it current.
     */
    public Span open(String name, Map<String, ?> attributes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("span name is required");
        }
        ContextStack stack = contextStorage.current();
        Span parent = stack.current().orElse(null);

        TraceId traceId = parent != null ? parent.traceId() : idGenerator.newTraceId();
        SpanId parentSpanId = parent != null ? parent.spanId() : null;
        Span span = new Span(this, traceId, idGenerator.newSpanId(), parentSpanId, name, now());
        attributes.forEach(span::setAttribute);

        stack.push(span);
        syncMdc(stack);
        log.trace("Opened span {} trace={} parent={}", name, traceId, parentSpanId);
        return span;
    }

    public boolean close(Span span) {
        return close(span, null);
    }

    /**
     * Seals the span, pops it and hands it to the span processor.
     *
     * @return {@code false} if the span is not the calling thread's current
     *         span or was already closed; nothing is changed in that case
     */
    public boolean close(Span span, SpanStatus status) {
        if (span.isEnded()) {
            reportUsageError("already_closed", span, "close");
            return false;
        }
        ContextStack stack = contextStorage.current();
        if (!stack.popIfTop(span)) {
            String reason = stack.contains(span) ? "close_not_current" : "close_foreign_context";
            reportUsageError(reason, span, "close");
            return false;
        }
        if (status != null) {
            span.setStatus(status);
        }
        SpanData data = span.end(now());
        syncMdc(stack);
        contextStorage.releaseIfEmpty();

        try {
            spanProcessor.onEnd(data);
        } catch (RuntimeException e) {
            log.warn("Span processor failed for span={} trace={}", data.name(), data.traceId(), e);
        }
        return true;
    }

    /**
     * Closes {@code span} after ending every span still open above it. The
     * abandoned spans are closed with {@code ERROR("abandoned")}, exported and
     * counted as {@code abandoned_span} usage errors. Meant for the owner of
     * an execution boundary, such as the request filter, so a leak inside the
     * boundary cannot outlive it.
     *
     * @return {@code false} if {@code span} is not on the calling thread's stack
     */
    public boolean closeScope(Span span, SpanStatus status) {
        ContextStack stack = contextStorage.current();
        if (!span.isEnded() && stack.contains(span)) {
            while (!stack.isTop(span)) {
                Span abandoned = stack.current().orElseThrow();
                reportUsageError("abandoned_span", abandoned, "close");
                close(abandoned, SpanStatus.error("abandoned"));
            }
        }
        return close(span, status);
    }

    /**
     * Discards whatever is left on the calling thread's stack. The spans are
     * not exported; each one is counted as a {@code stale_context} usage error.
     *
     * @return the number of spans discarded
     */
    public int resetContext() {
        ContextStack stack = contextStorage.current();
        int discarded = 0;
        while (!stack.isEmpty()) {
            reportUsageError("stale_context", stack.pop(), "reset");
            discarded++;
        }
        syncMdc(stack);
        contextStorage.releaseIfEmpty();
        return discarded;
    }

    /**
     * The calling thread's current span, if any. Does not change the stack.
     */
    public Optional<Span> current() {
        return contextStorage.current().current();
    }

    public Optional<TraceContext> currentContext() {
        return current().map(Span::context);
    }

    public <T, E extends Exception> T inSpan(String name, SpanCallable<T, E> work) throws E {
        return inSpan(name, Map.of(), work);
    }

    /**
     * Runs {@code work} inside a new span that is current for its whole
     * duration. If {@code work} throws, the throwable is recorded as an
     * {@code exception} event, the status becomes {@link StatusCode#ERROR} and
     * the throwable is rethrown unchanged. The span is closed in every case.
     */
    public <T, E extends Exception> T inSpan(String name, Map<String, ?> attributes,
                                             SpanCallable<T, E> work) throws E {
        Span span = open(name, attributes);
        try {
            return work.call(span);
        } catch (Throwable t) {
            span.recordException(t);
            span.setStatus(SpanStatus.error(describe(t)));
            throw t;
        } finally {
            close(span);
        }
    }

    public <E extends Exception> void runInSpan(String name, SpanRunnable<E> work) throws E {
        runInSpan(name, Map.of(), work);
    }

    public <E extends Exception> void runInSpan(String name, Map<String, ?> attributes,
                                                SpanRunnable<E> work) throws E {
        this.<Object, E>inSpan(name, attributes, span -> {
            work.run(span);
            return null;
        });
    }

    Instant now() {
        return clock.instant();
    }

    void reportUsageError(String reason, Span span, String operation) {
        log.warn("Tracer usage error reason={} operation={} span={} trace={} spanId={}",
                reason, operation, span.name(), span.traceId(), span.spanId());
        Counter.builder("tracelink.tracer.usage_errors")
                .description("Invalid span operations that were ignored")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    private static void syncMdc(ContextStack stack) {
        Optional<Span> top = stack.current();
        if (top.isPresent()) {
            MDC.put(TRACE_ID_MDC_KEY, top.get().traceId().toHex());
            MDC.put(SPAN_ID_MDC_KEY, top.get().spanId().toHex());
        } else {
            MDC.remove(TRACE_ID_MDC_KEY);
            MDC.remove(SPAN_ID_MDC_KEY);
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
