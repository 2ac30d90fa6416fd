package com.tracelink.trace;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TracerTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final List<SpanData> finished = new CopyOnWriteArrayList<>();

    private Tracer tracer;

    @BeforeEach
    void setUp() {
        tracer = new Tracer(new IdGenerator(new Random(42)), new ContextStorage(),
                finished::add, Clock.systemUTC(), meterRegistry);
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    private double usageErrors(String reason) {
        return meterRegistry.counter("tracelink.tracer.usage_errors", "reason", reason).count();
    }

    @Test
    void spanOpenedWithNothingCurrentStartsNewTrace() {
        Span root = tracer.open("root");

        assertTrue(root.isRoot());
        assertNull(root.parentSpanId());
        assertTrue(root.traceId().isValid());
        assertTrue(root.spanId().isValid());
        assertSame(root, tracer.current().orElseThrow());

        assertTrue(tracer.close(root));
        assertTrue(tracer.current().isEmpty());
    }

    @Test
    void childSpanLinksToSpanCurrentAtOpen() {
        Span root = tracer.open("bg-data-sync");
        Span child = tracer.open("fetch-remote");
        Span grandChild = tracer.open("db-query");

        assertEquals(root.spanId(), child.parentSpanId());
        assertEquals(child.spanId(), grandChild.parentSpanId());
        assertEquals(root.traceId(), child.traceId());
        assertEquals(root.traceId(), grandChild.traceId());

        tracer.close(grandChild);
        tracer.close(child);
        tracer.close(root);

        assertEquals(List.of("db-query", "fetch-remote", "bg-data-sync"),
                finished.stream().map(SpanData::name).toList());
    }

    @Test
    void successiveRootsGetDifferentTraceIds() {
        Span first = tracer.open("first");
        tracer.close(first);
        Span second = tracer.open("second");
        tracer.close(second);

        assertNotEquals(first.traceId(), second.traceId());
    }

    @Test
    void closingSpanThatIsNotCurrentIsRejected() {
        Span s1 = tracer.open("s1");
        Span s2 = tracer.open("s2");
        Span s3 = tracer.open("s3");

        assertFalse(tracer.close(s2));
        assertFalse(s2.isEnded());
        assertSame(s3, tracer.current().orElseThrow());
        assertEquals(1.0, usageErrors("close_not_current"));
        assertTrue(finished.isEmpty());

        assertTrue(tracer.close(s3));
        assertTrue(tracer.close(s2));
        assertTrue(tracer.close(s1));
        assertEquals(3, finished.size());
    }

    @Test
    void closingTwiceIsRejected() {
        Span span = tracer.open("once");
        assertTrue(tracer.close(span));
        assertFalse(tracer.close(span));

        assertEquals(1, finished.size());
        assertEquals(1.0, usageErrors("already_closed"));
    }

    @Test
    void mutatingClosedSpanIsIgnored() {
        Span span = tracer.open("sealed");
        span.setAttribute("before", "yes");
        tracer.close(span);

        span.setAttribute("after", "no");
        span.addEvent("late");
        span.setStatus(SpanStatus.error("too late"));

        SpanData data = finished.get(0);
        assertEquals(Map.of("before", "yes"), data.attributes());
        assertTrue(data.events().isEmpty());
        assertEquals(StatusCode.UNSET, data.status().code());
        assertEquals(3.0, usageErrors("mutate_closed_span"));
    }

    @Test
    void closeWithStatusSetsStatusBeforeSealing() {
        Span span = tracer.open("op");
        tracer.close(span, SpanStatus.error("cancelled"));

        SpanStatus status = finished.get(0).status();
        assertTrue(status.isError());
        assertEquals("cancelled", status.description());
    }

    @Test
    void attributesAreNormalized() {
        Span span = tracer.open("typed", Map.of("count", 3));
        span.setAttribute("ratio", 0.5f);
        span.setAttribute("flag", true);
        tracer.close(span);

        Map<String, Object> attributes = finished.get(0).attributes();
        assertEquals(3L, attributes.get("count"));
        assertEquals(0.5d, attributes.get("ratio"));
        assertEquals(Boolean.TRUE, attributes.get("flag"));
    }

    @Test
    void inSpanReturnsResultAndClosesSpan() {
        String result = tracer.inSpan("compute", span -> {
            span.setAttribute("step", "one");
            return "done";
        });

        assertEquals("done", result);
        assertTrue(tracer.current().isEmpty());
        assertEquals(1, finished.size());
        assertEquals("one", finished.get(0).attributes().get("step"));
    }

    @Test
    void inSpanRecordsFailureAndRethrowsIt() {
        IOException thrown = assertThrows(IOException.class,
                () -> tracer.inSpan("read", span -> {
                    throw new IOException("disk unavailable");
                }));

        assertEquals("disk unavailable", thrown.getMessage());
        assertTrue(tracer.current().isEmpty());

        SpanData data = finished.get(0);
        assertEquals(StatusCode.ERROR, data.status().code());
        assertEquals("disk unavailable", data.status().description());
        SpanEvent event = data.events().get(0);
        assertEquals("exception", event.name());
        assertEquals("java.io.IOException", event.attributes().get("exception.type"));
        assertEquals("disk unavailable", event.attributes().get("exception.message"));
    }

    @Test
    void nestedInSpanFailureLeavesParentCurrent() {
        tracer.runInSpan("parent", parent -> {
            assertThrows(IllegalStateException.class, () -> tracer.runInSpan("child", child -> {
                throw new IllegalStateException("boom");
            }));
            assertSame(parent, tracer.current().orElseThrow());
        });

        assertEquals(2, finished.size());
        assertTrue(finished.get(0).status().isError());
        assertFalse(finished.get(1).status().isError());
    }

    @Test
    void mdcTracksCurrentSpan() {
        Span root = tracer.open("root");
        assertEquals(root.traceId().toHex(), MDC.get(Tracer.TRACE_ID_MDC_KEY));
        assertEquals(root.spanId().toHex(), MDC.get(Tracer.SPAN_ID_MDC_KEY));

        Span child = tracer.open("child");
        assertEquals(child.spanId().toHex(), MDC.get(Tracer.SPAN_ID_MDC_KEY));

        tracer.close(child);
        assertEquals(root.spanId().toHex(), MDC.get(Tracer.SPAN_ID_MDC_KEY));

        tracer.close(root);
        assertNull(MDC.get(Tracer.TRACE_ID_MDC_KEY));
        assertNull(MDC.get(Tracer.SPAN_ID_MDC_KEY));
    }

    @Test
    void concurrentThreadsHaveIndependentContexts() throws Exception {
        CountDownLatch bothOpen = new CountDownLatch(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<TraceContext[]> a = pool.submit(() -> openAndObserve("request-a", bothOpen));
            Future<TraceContext[]> b = pool.submit(() -> openAndObserve("request-b", bothOpen));

            TraceContext[] seenByA = a.get(5, TimeUnit.SECONDS);
            TraceContext[] seenByB = b.get(5, TimeUnit.SECONDS);

            assertNotEquals(seenByA[0].traceId(), seenByB[0].traceId());
            // each thread still saw its own span while the other one was open
            assertEquals(seenByA[0], seenByA[1]);
            assertEquals(seenByB[0], seenByB[1]);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(2, finished.size());
    }

    private TraceContext[] openAndObserve(String name, CountDownLatch bothOpen) throws InterruptedException {
        Span span = tracer.open(name);
        bothOpen.countDown();
        bothOpen.await(5, TimeUnit.SECONDS);
        TraceContext observed = tracer.currentContext().orElseThrow();
        tracer.close(span);
        return new TraceContext[] {span.context(), observed};
    }

    @Test
    void closingSpanFromAnotherThreadIsRejected() throws Exception {
        Span span = tracer.open("owned");
        AtomicReference<Boolean> closed = new AtomicReference<>();

        Thread other = new Thread(() -> closed.set(tracer.close(span)));
        other.start();
        other.join(5000);

        assertEquals(Boolean.FALSE, closed.get());
        assertFalse(span.isEnded());
        assertEquals(1.0, usageErrors("close_foreign_context"));
        assertTrue(tracer.close(span));
    }

    @Test
    void failingProcessorDoesNotBreakClose() {
        Tracer failing = new Tracer(new IdGenerator(new Random(1)), new ContextStorage(),
                data -> { throw new IllegalStateException("exporter down"); },
                Clock.systemUTC(), meterRegistry);

        Span span = failing.open("op");
        assertTrue(failing.close(span));
        assertTrue(failing.current().isEmpty());
    }

    @Test
    void blankNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> tracer.open(" "));
        assertTrue(tracer.current().isEmpty());
    }

    @Test
    void closeScopeEndsAbandonedChildrenFirst() {
        Span root = tracer.open("GET /a");
        Span leaked = tracer.open("leaked-step");

        assertTrue(tracer.closeScope(root, null));

        assertTrue(tracer.current().isEmpty());
        assertTrue(leaked.isEnded());
        assertEquals(List.of("leaked-step", "GET /a"), finished.stream().map(SpanData::name).toList());
        assertEquals(StatusCode.ERROR, finished.get(0).status().code());
        assertEquals("abandoned", finished.get(0).status().description());
        assertEquals(1.0, usageErrors("abandoned_span"));
        assertNull(MDC.get(Tracer.TRACE_ID_MDC_KEY));
    }

    @Test
    void resetContextDiscardsStaleSpans() {
        Span stale = tracer.open("stale-root");
        tracer.open("stale-child");

        assertEquals(2, tracer.resetContext());

        assertTrue(tracer.current().isEmpty());
        assertTrue(finished.isEmpty());
        assertEquals(2.0, usageErrors("stale_context"));
        assertNull(MDC.get(Tracer.SPAN_ID_MDC_KEY));

        Span next = tracer.open("next");
        assertTrue(next.isRoot());
        assertNotEquals(stale.traceId(), next.traceId());
        tracer.close(next);
    }

    @Test
    void resetContextOnEmptyStackIsNoop() {
        assertEquals(0, tracer.resetContext());
        assertEquals(0.0, usageErrors("stale_context"));
    }
}
