package com.tracelink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelink.export.ExportBuffer;
import com.tracelink.export.ExportPipeline;
import com.tracelink.export.LoggingTelemetryExporter;
import com.tracelink.export.ServiceResource;
import com.tracelink.export.TelemetryExporter;
import com.tracelink.logging.ConsoleJsonLogSink;
import com.tracelink.logging.ExportLogSink;
import com.tracelink.logging.LogCorrelator;
import com.tracelink.logging.LogSink;
import com.tracelink.metrics.MetricsRegistry;
import com.tracelink.observability.TelemetryMetrics;
import com.tracelink.trace.ContextStorage;
import com.tracelink.trace.IdGenerator;
import com.tracelink.trace.Tracer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;

/**
 * Wires the tracer, log correlator, metrics registry and export pipeline.
 * Every span the tracer closes and every record the correlator emits flows
 * into the same bounded export queue.
 */
@Configuration
public class TelemetryConfig {

    private static final Logger log = LoggerFactory.getLogger(TelemetryConfig.class);

    @Bean
    public Clock telemetryClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ServiceResource serviceResource(TracelinkProperties properties) {
        TracelinkProperties.ServiceProperties service = properties.getService();
        log.info("Telemetry resource: service.name={} service.version={} deployment.environment={}",
                service.getName(), service.getVersion(), service.getEnvironment());
        return new ServiceResource(service.getName(), service.getVersion(), service.getEnvironment());
    }

    // --- Export ---

    @Bean
    public ExportBuffer exportBuffer(TracelinkProperties properties, MeterRegistry meterRegistry) {
        int capacity = properties.getExport().getQueueCapacity();
        if (capacity < 1) {
            throw new IllegalStateException("tracelink.export.queue-capacity must be positive: " + capacity);
        }
        return new ExportBuffer(capacity, meterRegistry);
    }

    @Bean
    public TelemetryExporter telemetryExporter(ObjectMapper objectMapper, ServiceResource resource) {
        return new LoggingTelemetryExporter(objectMapper, resource);
    }

    @Bean
    public ExportPipeline exportPipeline(ExportBuffer buffer,
                                         TelemetryExporter exporter,
                                         TracelinkProperties properties,
                                         MeterRegistry meterRegistry) {
        int batchSize = properties.getExport().getMaxBatchSize();
        if (batchSize < 1) {
            throw new IllegalStateException("tracelink.export.max-batch-size must be positive: " + batchSize);
        }
        return new ExportPipeline(buffer, exporter, batchSize, meterRegistry);
    }

    // --- Tracing ---

    @Bean
    public IdGenerator idGenerator() {
        return new IdGenerator(new SecureRandom());
    }

    @Bean
    public ContextStorage contextStorage() {
        return new ContextStorage();
    }

    @Bean
    public Tracer tracer(IdGenerator idGenerator,
                         ContextStorage contextStorage,
                         ExportPipeline exportPipeline,
                         Clock telemetryClock,
                         MeterRegistry meterRegistry) {
        return new Tracer(idGenerator, contextStorage, exportPipeline, telemetryClock, meterRegistry);
    }

    // --- Metrics ---

    @Bean
    public MetricsRegistry metricsRegistry(MeterRegistry meterRegistry,
                                           TracelinkProperties properties,
                                           Clock telemetryClock) {
        List<Double> buckets = properties.getMetrics().getHistogramBuckets();
        if (buckets == null || buckets.isEmpty()) {
            throw new IllegalStateException("tracelink.metrics.histogram-buckets must not be empty");
        }
        double[] bounds = buckets.stream().mapToDouble(Double::doubleValue).toArray();
        return new MetricsRegistry(meterRegistry, bounds, telemetryClock);
    }

    @Bean
    public TelemetryMetrics telemetryMetrics(MetricsRegistry metricsRegistry) {
        return new TelemetryMetrics(metricsRegistry);
    }

    // --- Logs ---

    @Bean
    public ConsoleJsonLogSink consoleJsonLogSink(ObjectMapper objectMapper,
                                                 TracelinkProperties properties,
                                                 MeterRegistry meterRegistry) {
        int capacity = properties.getExport().getConsoleQueueCapacity();
        if (capacity < 1) {
            throw new IllegalStateException("tracelink.export.console-queue-capacity must be positive: " + capacity);
        }
        return new ConsoleJsonLogSink(objectMapper, capacity, meterRegistry);
    }

    @Bean
    public ExportLogSink exportLogSink(ExportPipeline exportPipeline) {
        return new ExportLogSink(exportPipeline);
    }

    @Bean
    public LogCorrelator logCorrelator(Tracer tracer,
                                       List<LogSink> sinks,
                                       TracelinkProperties properties,
                                       Clock telemetryClock,
                                       MeterRegistry meterRegistry) {
        return new LogCorrelator(tracer, sinks, properties.getService().getName(),
                telemetryClock, meterRegistry);
    }
}
