package com.tracelink.export;

import com.tracelink.logging.LogRecord;
import com.tracelink.metrics.MetricSnapshot;
import com.tracelink.trace.SpanData;
import com.tracelink.trace.SpanProcessor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.ArrayList;
import java.util.List;

/**
 * Single export task: drains the {@link ExportBuffer} in batches and pushes
 * each signal to the {@link TelemetryExporter}. Exporter failures discard the
 * batch and are counted; nothing is retried here.
 */
public class ExportPipeline implements SpanProcessor {

    private static final Logger log = LoggerFactory.getLogger(ExportPipeline.class);

    private final ExportBuffer buffer;
    private final TelemetryExporter exporter;
    private final int maxBatchSize;
    private final MeterRegistry meterRegistry;

    public ExportPipeline(ExportBuffer buffer, TelemetryExporter exporter,
                          int maxBatchSize, MeterRegistry meterRegistry) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("export batch size must be positive: " + maxBatchSize);
        }
        this.buffer = buffer;
        this.exporter = exporter;
        this.maxBatchSize = maxBatchSize;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onEnd(SpanData span) {
        buffer.offer(new ExportItem.SpanItem(span));
    }

    public boolean submitLog(LogRecord record) {
        return buffer.offer(new ExportItem.LogItem(record));
    }

    public boolean submitMetrics(MetricSnapshot snapshot) {
        return buffer.offer(new ExportItem.MetricItem(snapshot));
    }

    /**
     * Drains everything currently queued.
     *
     * @return number of items handed to the exporter, including failed batches
     */
    @Scheduled(fixedDelayString = "${tracelink.export.flush-interval:1000}")
    public synchronized int flush() {
        int exported = 0;
        List<ExportItem> batch;
        while (!(batch = buffer.drain(maxBatchSize)).isEmpty()) {
            exportBatch(batch);
            exported += batch.size();
        }
        return exported;
    }

    @PreDestroy
    public void shutdown() {
        int exported = flush();
        log.info("Export pipeline flushed {} items on shutdown (dropped={})",
                exported, buffer.droppedTotal());
    }

    private void exportBatch(List<ExportItem> batch) {
        List<SpanData> spans = new ArrayList<>();
        List<LogRecord> logs = new ArrayList<>();
        List<MetricSnapshot> snapshots = new ArrayList<>();
        for (ExportItem item : batch) {
            if (item instanceof ExportItem.SpanItem spanItem) {
                spans.add(spanItem.span());
            } else if (item instanceof ExportItem.LogItem logItem) {
                logs.add(logItem.log());
            } else if (item instanceof ExportItem.MetricItem metricItem) {
                snapshots.add(metricItem.snapshot());
            }
        }
        if (!spans.isEmpty()) {
            send(Signal.SPAN, spans.size(), () -> exporter.exportSpans(spans));
        }
        if (!logs.isEmpty()) {
            send(Signal.LOG, logs.size(), () -> exporter.exportLogs(logs));
        }
        for (MetricSnapshot snapshot : snapshots) {
            send(Signal.METRIC, snapshot.points().size(), () -> exporter.exportMetrics(snapshot));
        }
    }

    private void send(Signal signal, int size, Runnable export) {
        try {
            export.run();
        } catch (RuntimeException e) {
            log.warn("Exporter failed, discarding {} {} items: {}", size, signal.tagValue(), e.getMessage());
            Counter.builder("tracelink.export.failures")
                    .description("Export batches discarded because the exporter failed")
                    .tag("signal", signal.tagValue())
                    .register(meterRegistry)
                    .increment();
        }
    }
}
