package com.tracelink.export;

import com.tracelink.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pushes a cumulative snapshot of every metric series to the export queue on
 * a fixed interval.
 */
@Component
public class MetricsExportScheduler {

    private static final Logger log = LoggerFactory.getLogger(MetricsExportScheduler.class);

    private final MetricsRegistry metricsRegistry;
    private final ExportPipeline exportPipeline;

    public MetricsExportScheduler(MetricsRegistry metricsRegistry, ExportPipeline exportPipeline) {
        this.metricsRegistry = metricsRegistry;
        this.exportPipeline = exportPipeline;
    }

    @Scheduled(fixedRateString = "${tracelink.export.metrics-interval:5000}",
            initialDelayString = "${tracelink.export.metrics-interval:5000}")
    public void exportSnapshot() {
        if (!exportPipeline.submitMetrics(metricsRegistry.snapshot())) {
            log.debug("Metric snapshot dropped, export queue full");
        }
    }
}
