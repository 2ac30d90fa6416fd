package com.tracelink.web;

import com.tracelink.export.ExportPipeline;
import com.tracelink.export.TelemetryExporter;
import com.tracelink.logging.LogRecord;
import com.tracelink.metrics.MetricSnapshot;
import com.tracelink.metrics.MetricsRegistry;
import com.tracelink.trace.SpanData;
import com.tracelink.trace.StatusCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "tracelink.simulator.enabled=false",
        "tracelink.demo.not-found-probability=0",
        "tracelink.demo.slow-payment-probability=0",
        "tracelink.export.flush-interval=3600000",
        "tracelink.export.metrics-interval=3600000"
})
@AutoConfigureMockMvc
@Import(RequestTracingIntegrationTest.CapturingExporterConfig.class)
class RequestTracingIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CapturingExporter exporter;

    @Autowired
    private ExportPipeline exportPipeline;

    @Autowired
    private MetricsRegistry metricsRegistry;

    @BeforeEach
    void setUp() {
        exportPipeline.flush();
        exporter.clear();
    }

    private List<SpanData> exportedSpans() {
        exportPipeline.flush();
        return exporter.spans;
    }

    private SpanData exported(String name) {
        return exportedSpans().stream().filter(s -> s.name().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void homeRequestGetsRootSpanAndCorrelatedLog() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Hello from test-app!"));

        SpanData root = exported("GET /");
        assertTrue(root.isRoot());
        assertEquals("GET", root.attributes().get("http.method"));
        assertEquals("/", root.attributes().get("http.route"));
        assertEquals(200L, root.attributes().get("http.status_code"));

        LogRecord log = exporter.logs.stream()
                .filter(r -> r.message().equals("Home page requested"))
                .findFirst().orElseThrow();
        assertEquals(root.traceId().toHex(), log.traceId());
        assertEquals(root.spanId().toHex(), log.spanId());
    }

    @Test
    void createOrderReturnsCreatedAndNestsStepSpans() throws Exception {
        mockMvc.perform(post("/api/orders"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.order_id").isString())
                .andExpect(jsonPath("$.status").value("created"));

        SpanData root = exported("POST /api/orders");
        SpanData validate = exported("validate-order");
        assertEquals(root.spanId(), validate.parentSpanId());
        assertEquals(root.traceId(), exported("db-query").traceId());

        MetricSnapshot snapshot = metricsRegistry.snapshot();
        assertTrue(snapshot.find("http_requests_total",
                Map.of("endpoint", "/api/orders", "method", "POST", "status", "201")).isPresent());
        assertTrue(snapshot.find("http_request_duration_seconds",
                Map.of("endpoint", "/api/orders", "method", "POST")).isPresent());
        assertEquals(0.0, snapshot.find("http_requests_active", Map.of()).orElseThrow().value());
    }

    @Test
    void orderLookupIsNamedByRouteTemplate() throws Exception {
        mockMvc.perform(get("/api/orders/ORD-1234"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order_id").value("ORD-1234"));

        SpanData root = exported("GET /api/orders/{id}");
        assertEquals("/api/orders/{id}", root.attributes().get("http.route"));
        assertEquals(Boolean.TRUE, exported("fetch-from-db").attributes().get("order.found"));
    }

    @Test
    void errorEndpointReturns500AndMarksSpans() throws Exception {
        mockMvc.perform(get("/api/error"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Simulated error for demonstration"));

        SpanData root = exported("GET /api/error");
        assertEquals(StatusCode.ERROR, root.status().code());
        assertEquals(500L, root.attributes().get("http.status_code"));
        assertEquals(StatusCode.ERROR, exported("failing-operation").status().code());
        assertTrue(metricsRegistry.snapshot().find("http_requests_total",
                Map.of("endpoint", "/api/error", "method", "GET", "status", "500")).isPresent());
    }

    @Test
    void healthIsNotTraced() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));

        assertTrue(exportedSpans().isEmpty());
    }

    @TestConfiguration
    static class CapturingExporterConfig {
        @Bean
        @Primary
        CapturingExporter capturingExporter() {
            return new CapturingExporter();
        }
    }

    static class CapturingExporter implements TelemetryExporter {
        final List<SpanData> spans = new CopyOnWriteArrayList<>();
        final List<LogRecord> logs = new CopyOnWriteArrayList<>();

        @Override
        public void exportSpans(List<SpanData> batch) {
            spans.addAll(batch);
        }

        @Override
        public void exportLogs(List<LogRecord> batch) {
            logs.addAll(batch);
        }

        @Override
        public void exportMetrics(MetricSnapshot snapshot) {
        }

        void clear() {
            spans.clear();
            logs.clear();
        }
    }
}
