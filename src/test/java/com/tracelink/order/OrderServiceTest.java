package com.tracelink.order;

import com.tracelink.config.TracelinkProperties;
import com.tracelink.logging.LogCorrelator;
import com.tracelink.logging.LogRecord;
import com.tracelink.logging.LogSink;
import com.tracelink.trace.ContextStorage;
import com.tracelink.trace.IdGenerator;
import com.tracelink.trace.Span;
import com.tracelink.trace.SpanData;
import com.tracelink.trace.StatusCode;
import com.tracelink.trace.Tracer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class OrderServiceTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final List<SpanData> finished = new CopyOnWriteArrayList<>();
    private final List<LogRecord> logs = new CopyOnWriteArrayList<>();
    private final TracelinkProperties.DemoProperties demo = new TracelinkProperties.DemoProperties();

    private Tracer tracer;
    private LogCorrelator correlator;

    @BeforeEach
    void setUp() {
        tracer = new Tracer(new IdGenerator(new Random(3)), new ContextStorage(),
                finished::add, Clock.systemUTC(), meterRegistry);
        correlator = new LogCorrelator(tracer, List.of(new LogSink() {
            @Override
            public String name() {
                return "recording";
            }

            @Override
            public void accept(LogRecord record) {
                logs.add(record);
            }
        }), "test-app", Clock.systemUTC(), meterRegistry);
    }

    /** Random whose nextDouble always returns the same value. */
    private static Random fixedDouble(double value) {
        return new Random(1) {
            @Override
            public double nextDouble() {
                return value;
            }
        };
    }

    private OrderService service(double nextDouble) {
        return new OrderService(tracer, correlator, d -> { }, fixedDouble(nextDouble), demo);
    }

    private SpanData span(String name) {
        return finished.stream().filter(s -> s.name().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void createOrderRunsStepsAsChildSpansOfRequest() {
        Span request = tracer.open("POST /api/orders");
        OrderConfirmation confirmation = service(0.5).createOrder();
        tracer.close(request);

        assertTrue(confirmation.orderId().matches("ORD-\\d{4}"));
        assertEquals("created", confirmation.status());
        assertEquals(List.of("validate-order", "db-query", "check-inventory", "process-payment", "POST /api/orders"),
                finished.stream().map(SpanData::name).toList());

        assertEquals(request.spanId(), span("validate-order").parentSpanId());
        assertEquals(span("check-inventory").spanId(), span("db-query").parentSpanId());
        assertEquals("postgresql", span("db-query").attributes().get("db.system"));
        assertEquals("USD", span("process-payment").attributes().get("payment.currency"));
        assertEquals("payment_processed", span("process-payment").events().get(0).name());
        assertEquals(confirmation.orderId(), span("validate-order").attributes().get("order.id"));

        LogRecord inventoryQuery = logs.stream()
                .filter(r -> r.message().equals("Executing inventory query"))
                .findFirst().orElseThrow();
        assertEquals(span("db-query").spanId().toHex(), inventoryQuery.spanId());
        assertTrue(logs.stream().noneMatch(r -> r.message().equals("Payment gateway slow")));
    }

    @Test
    void slowPaymentLogsWarning() {
        service(0.05).createOrder();

        LogRecord slow = logs.stream()
                .filter(r -> r.message().equals("Payment gateway slow"))
                .findFirst().orElseThrow();
        assertEquals(span("process-payment").spanId().toHex(), slow.spanId());
    }

    @Test
    void getOrderReturnsDetailsWhenFound() {
        OrderDetails details = service(0.5).getOrder("ORD-1234");

        assertEquals("ORD-1234", details.orderId());
        assertTrue(details.total().startsWith("$"));
        assertEquals(Boolean.TRUE, span("fetch-from-db").attributes().get("order.found"));
    }

    @Test
    void missingOrderThrowsWithoutFailingTheDbSpan() {
        OrderService service = service(0.1);

        assertThrows(OrderService.OrderNotFoundException.class, () -> service.getOrder("ORD-4040"));

        SpanData fetch = span("fetch-from-db");
        assertEquals(Boolean.FALSE, fetch.attributes().get("order.found"));
        assertNotEquals(StatusCode.ERROR, fetch.status().code());
    }

    @Test
    void triggerFailureRecordsExceptionOnSpan() {
        OrderService.SimulatedFailureException failure = assertThrows(
                OrderService.SimulatedFailureException.class, () -> service(0.5).triggerFailure());

        assertEquals("Simulated error for demonstration", failure.getMessage());
        SpanData failing = span("failing-operation");
        assertEquals(StatusCode.ERROR, failing.status().code());
        assertEquals(Boolean.TRUE, failing.attributes().get("error"));
        assertEquals("exception", failing.events().get(0).name());
        assertTrue(logs.stream().anyMatch(r -> r.message().equals("Exception occurred")
                && "SimulatedFailureException".equals(r.extraFields().get("error_type"))));
    }

    @Test
    void probabilityOutsideUnitIntervalFailsConstruction() {
        demo.setNotFoundProbability(1.5);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> service(0.5));
        assertTrue(e.getMessage().contains("demo.not-found-probability"));

        demo.setNotFoundProbability(0.2);
        demo.setSlowPaymentProbability(-0.1);
        assertThrows(IllegalStateException.class, () -> service(0.5));
    }
}
