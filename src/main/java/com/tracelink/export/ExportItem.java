package com.tracelink.export;

import com.tracelink.logging.LogRecord;
import com.tracelink.metrics.MetricSnapshot;
import com.tracelink.trace.SpanData;

/**
 * One unit waiting in the {@link ExportBuffer}.
 */
public sealed interface ExportItem {

    Signal signal();

    record SpanItem(SpanData span) implements ExportItem {
        @Override
        public Signal signal() { return Signal.SPAN; }
    }

    record LogItem(LogRecord log) implements ExportItem {
        @Override
        public Signal signal() { return Signal.LOG; }
    }

    record MetricItem(MetricSnapshot snapshot) implements ExportItem {
        @Override
        public Signal signal() { return Signal.METRIC; }
    }
}
