package com.tracelink.export;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded hand-off between the many producers of telemetry (span closes, log
 * emissions, metric flushes) and the single export task.
 *
 * <p>When full, the newest item is dropped: {@link #offer} returns
 * {@code false} immediately and the drop is counted per signal. Producers
 * never block.
 */
public class ExportBuffer {

    private static final Logger log = LoggerFactory.getLogger(ExportBuffer.class);

    private final BlockingQueue<ExportItem> queue;
    private final int capacity;
    private final Map<Signal, AtomicLong> dropped = new EnumMap<>(Signal.class);
    private final Map<Signal, Counter> dropCounters = new EnumMap<>(Signal.class);

    public ExportBuffer(int capacity, MeterRegistry meterRegistry) {
        if (capacity < 1) {
            throw new IllegalArgumentException("export queue capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        for (Signal signal : Signal.values()) {
            dropped.put(signal, new AtomicLong());
            dropCounters.put(signal, Counter.builder("tracelink.export.dropped")
                    .description("Telemetry items dropped because the export queue was full")
                    .tag("signal", signal.tagValue())
                    .register(meterRegistry));
        }
        Gauge.builder("tracelink.export.queue.size", queue, BlockingQueue::size)
                .description("Items waiting for export")
                .register(meterRegistry);
    }

    public boolean offer(ExportItem item) {
        if (queue.offer(item)) {
            return true;
        }
        long total = dropped.get(item.signal()).incrementAndGet();
        dropCounters.get(item.signal()).increment();
        // warn on the 1st, 2nd, 4th, 8th... drop of each signal
        if (Long.bitCount(total) == 1) {
            log.warn("Export queue full (capacity={}), dropped {} {} items so far",
                    capacity, total, item.signal().tagValue());
        }
        return false;
    }

    /**
     * Removes up to {@code maxItems} items in FIFO order.
     */
    public List<ExportItem> drain(int maxItems) {
        List<ExportItem> batch = new ArrayList<>(Math.min(maxItems, queue.size()));
        queue.drainTo(batch, maxItems);
        return batch;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public long dropped(Signal signal) {
        return dropped.get(signal).get();
    }

    public long droppedTotal() {
        return dropped.values().stream().mapToLong(AtomicLong::get).sum();
    }
}
