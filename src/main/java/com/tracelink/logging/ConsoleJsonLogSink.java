package com.tracelink.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Renders records as single-line JSON through the {@code tracelink.console}
 * logger.
 *
 * <p>Emitting threads only offer the record to a bounded queue; a single
 * writer thread named {@value #WRITER_THREAD_NAME} renders and writes it. When
 * the queue is full the record is dropped and counted on
 * {@code tracelink.export.dropped{signal=console}}, so a slow stdout never
 * stalls the caller and never loses records silently.
 */
public class ConsoleJsonLogSink implements LogSink, SmartLifecycle {

    public static final String LOGGER_NAME = "tracelink.console";
    public static final String WRITER_THREAD_NAME = "console-log-writer";
    public static final String DROP_SIGNAL = "console";

    private static final Logger log = LoggerFactory.getLogger(ConsoleJsonLogSink.class);
    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(2);

    private final ObjectMapper objectMapper;
    private final Logger console;
    private final BlockingQueue<LogRecord> queue;
    private final int capacity;
    private final AtomicLong dropped = new AtomicLong();
    private final Counter dropCounter;

    private volatile Thread writer;

    public ConsoleJsonLogSink(ObjectMapper objectMapper, int capacity, MeterRegistry meterRegistry) {
        this(objectMapper, capacity, meterRegistry, LoggerFactory.getLogger(LOGGER_NAME));
    }

    ConsoleJsonLogSink(ObjectMapper objectMapper, int capacity, MeterRegistry meterRegistry, Logger console) {
        if (capacity < 1) {
            throw new IllegalArgumentException("console queue capacity must be positive: " + capacity);
        }
        this.objectMapper = objectMapper;
        this.console = console;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.dropCounter = Counter.builder("tracelink.export.dropped")
                .description("Telemetry items dropped because the export queue was full")
                .tag("signal", DROP_SIGNAL)
                .register(meterRegistry);
        Gauge.builder("tracelink.logs.console.queue.size", queue, BlockingQueue::size)
                .description("Log records waiting for the console writer")
                .register(meterRegistry);
    }

    @Override
    public String name() {
        return "console";
    }

    @Override
    public void accept(LogRecord record) {
        if (!console.isEnabledForLevel(record.level())) {
            return;
        }
        if (queue.offer(record)) {
            return;
        }
        long total = dropped.incrementAndGet();
        dropCounter.increment();
        // warn on the 1st, 2nd, 4th, 8th... drop
        if (Long.bitCount(total) == 1) {
            log.warn("Console log queue full (capacity={}), dropped {} records so far", capacity, total);
        }
    }

    @Override
    public synchronized void start() {
        if (writer != null && writer.isAlive()) {
            return;
        }
        Thread thread = new Thread(this::writeLoop, WRITER_THREAD_NAME);
        thread.setDaemon(true);
        writer = thread;
        thread.start();
    }

    @Override
    public void stop() {
        Thread thread;
        synchronized (this) {
            thread = writer;
            if (thread == null) {
                return;
            }
            thread.interrupt();
        }
        try {
            thread.join(JOIN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Console log writer did not stop within {}", JOIN_TIMEOUT);
            return;
        }
        synchronized (this) {
            if (writer == thread) {
                writer = null;
            }
        }
        writePending();
    }

    @Override
    public boolean isRunning() {
        Thread thread = writer;
        return thread != null && thread.isAlive();
    }

    /**
     * Starts before and stops after the default phase, so components that
     * log during their own shutdown still reach the console.
     */
    @Override
    public int getPhase() {
        return DEFAULT_PHASE - 1;
    }

    /**
     * Writes every queued record on the calling thread.
     *
     * @return the number of records taken off the queue
     */
    int writePending() {
        List<LogRecord> pending = new ArrayList<>(queue.size());
        queue.drainTo(pending);
        pending.forEach(this::write);
        return pending.size();
    }

    public long dropped() {
        return dropped.get();
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    String render(LogRecord record) {
        try {
            return objectMapper.writeValueAsString(record.toFields());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render log record as JSON", e);
        }
    }

    private void writeLoop() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                write(queue.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void write(LogRecord record) {
        try {
            console.atLevel(record.level()).log(render(record));
        } catch (RuntimeException e) {
            log.warn("Could not write log record to console: {}", record.message(), e);
        }
    }
}
