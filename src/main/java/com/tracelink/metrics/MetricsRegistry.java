package com.tracelink.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Named instruments with label-set keyed aggregation.
 *
 * <p>Updates from any number of threads proceed in parallel under the shared
 * side of a read/write lock; {@link #snapshot()} takes the exclusive side so
 * that every snapshot reflects a single point in the update history. Values
 * are cumulative: nothing is reset by a snapshot, so no increment can fall
 * between two exports.
 *
 * <p>Each series is mirrored into the Micrometer {@link MeterRegistry} so it
 * also shows up under the actuator metrics endpoint.
 */
public class MetricsRegistry {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final MeterRegistry meterRegistry;
    private final double[] defaultBuckets;
    private final Clock clock;
    private final ConcurrentMap<String, Instrument> instruments = new ConcurrentHashMap<>();
    private final ReadWriteLock snapshotLock = new ReentrantReadWriteLock();

    public MetricsRegistry(MeterRegistry meterRegistry, double[] defaultBuckets, Clock clock) {
        this.meterRegistry = meterRegistry;
        this.defaultBuckets = defaultBuckets.clone();
        this.clock = clock;
    }

    public CounterInstrument counter(String name, String description, String unit) {
        return getOrCreate(name, CounterInstrument.class,
                n -> new CounterInstrument(this, n, description, unit));
    }

    public HistogramInstrument histogram(String name, String description, String unit) {
        return histogram(name, description, unit, defaultBuckets);
    }

    public HistogramInstrument histogram(String name, String description, String unit, double[] buckets) {
        return getOrCreate(name, HistogramInstrument.class,
                n -> new HistogramInstrument(this, n, description, unit, buckets));
    }

    public UpDownCounterInstrument upDownCounter(String name, String description, String unit) {
        return getOrCreate(name, UpDownCounterInstrument.class,
                n -> new UpDownCounterInstrument(this, n, description, unit));
    }

    public MetricSnapshot snapshot() {
        List<MetricPoint> points = new ArrayList<>();
        snapshotLock.writeLock().lock();
        try {
            instruments.values().stream()
                    .sorted(Comparator.comparing(Instrument::name))
                    .forEach(instrument -> instrument.collect(points));
        } finally {
            snapshotLock.writeLock().unlock();
        }
        return new MetricSnapshot(clock.instant(), points);
    }

    public List<Instrument> instruments() {
        return List.copyOf(instruments.values());
    }

    MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    void update(Runnable mutation) {
        snapshotLock.readLock().lock();
        try {
            mutation.run();
        } finally {
            snapshotLock.readLock().unlock();
        }
    }

    void reportUsageError(String instrument, String reason) {
        log.warn("Metrics usage error instrument={} reason={}", instrument, reason);
        Counter.builder("tracelink.metrics.usage_errors")
                .description("Invalid instrument operations that were ignored")
                .tag("instrument", instrument)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    private <T extends Instrument> T getOrCreate(String name, Class<T> type, Function<String, T> factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("instrument name is required");
        }
        Instrument instrument = instruments.computeIfAbsent(name, factory::apply);
        if (!type.isInstance(instrument)) {
            throw new IllegalArgumentException("instrument " + name + " is already registered as "
                    + instrument.kind() + ", not " + type.getSimpleName());
        }
        return type.cast(instrument);
    }
}
