package com.tracelink.logging;

import com.tracelink.export.ExportPipeline;

/**
 * Hands records to the export pipeline. Drops when the export queue is full;
 * the drop is counted by the queue.
 */
public class ExportLogSink implements LogSink {

    private final ExportPipeline pipeline;

    public ExportLogSink(ExportPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public String name() {
        return "export";
    }

    @Override
    public void accept(LogRecord record) {
        pipeline.submitLog(record);
    }
}
