package com.tracelink.simulator;

import com.tracelink.logging.LogCorrelator;
import com.tracelink.observability.TelemetryMetrics;
import com.tracelink.trace.Span;
import com.tracelink.trace.SpanStatus;
import com.tracelink.trace.Tracer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

import static com.tracelink.logging.LogCorrelator.fields;

/**
 * Emits one correlated trace, log stream and metric set per cycle: a root
 * span {@code bg-<operation>} with one child span per step, each step
 * sleeping for a random time and failing with the configured probability.
 *
 * <p>A cycle moves through {@link SimulatorState#RUNNING_ROOT} and
 * {@link SimulatorState#RUNNING_STEP} and ends in {@link SimulatorState#IDLE}.
 * Cancellation is only observed between steps, or when the step sleep is
 * interrupted; the root span is then closed with status
 * {@code ERROR("cancelled")}.
 *
 * <p>Not thread-safe: drive it from a single thread.
 */
public class WorkloadSimulator {

    private final Tracer tracer;
    private final LogCorrelator correlator;
    private final TelemetryMetrics metrics;
    private final OperationCatalog catalog;
    private final SimulatorSettings settings;
    private final Random random;
    private final Sleeper sleeper;
    private final Clock clock;

    private final AtomicLong cycles = new AtomicLong();
    private volatile SimulatorState state = SimulatorState.IDLE;

    public WorkloadSimulator(Tracer tracer,
                             LogCorrelator correlator,
                             TelemetryMetrics metrics,
                             OperationCatalog catalog,
                             SimulatorSettings settings,
                             Random random,
                             Sleeper sleeper,
                             Clock clock) {
        this.tracer = tracer;
        this.correlator = correlator;
        this.metrics = metrics;
        this.catalog = catalog;
        this.settings = settings;
        this.random = random;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public CycleResult runCycle() {
        return runCycle(() -> false);
    }

    /**
     * Runs one full cycle on the calling thread.
     *
     * @param cancelRequested polled before every step
     */
    public CycleResult runCycle(BooleanSupplier cancelRequested) {
        long cycle = cycles.incrementAndGet();
        OperationDefinition operation = catalog.pick(random);
        Instant started = clock.instant();
        state = SimulatorState.RUNNING_ROOT;
        try {
            return tracer.inSpan(operation.rootSpanName(),
                    Map.of("operation.type", "background", "operation.cycle", cycle),
                    root -> runOperation(root, operation, cycle, started, cancelRequested));
        } finally {
            state = SimulatorState.IDLE;
        }
    }

    /**
     * Random pause before the next cycle, within the configured delay range.
     */
    public Duration nextDelay() {
        return uniform(settings.delayMin(), settings.delayMax());
    }

    public SimulatorState state() {
        return state;
    }

    public long cycles() {
        return cycles.get();
    }

    private CycleResult runOperation(Span root, OperationDefinition operation, long cycle,
                                     Instant started, BooleanSupplier cancelRequested) {
        String name = operation.name();
        correlator.info("Background operation started: " + name, fields("operation", name, "cycle", cycle));

        List<String> completed = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        boolean cancelled = false;

        for (String step : operation.steps()) {
            if (cancelRequested.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                cancelled = true;
                break;
            }
            state = SimulatorState.RUNNING_STEP;
            boolean interrupted = tracer.inSpan(step, Map.of("step.name", step),
                    span -> runStep(span, name, step, cycle, failed));
            state = SimulatorState.RUNNING_ROOT;
            if (interrupted) {
                cancelled = true;
                break;
            }
            completed.add(step);
        }

        Duration elapsed = Duration.between(started, clock.instant());
        long durationMs = elapsed.toMillis();
        CycleResult result = new CycleResult(cycle, name, root.traceId(), completed, failed, cancelled, elapsed);

        if (cancelled) {
            root.setAttribute("operation.cancelled", true);
            root.setStatus(SpanStatus.error("cancelled"));
            correlator.warn("Background operation cancelled: " + name,
                    fields("operation", name, "completed_steps", completed.size(), "cycle", cycle));
            return result;
        }

        boolean success = failed.isEmpty();
        metrics.recordBackgroundOperation(name, success, elapsed.toNanos() / 1e9);
        root.setAttribute("operation.success", success);
        root.setAttribute("operation.duration_ms", durationMs);
        root.setStatus(success ? SpanStatus.OK : SpanStatus.error(failed.size() + " step(s) failed"));
        correlator.info("Background operation completed: " + name,
                fields("operation", name, "success", success, "duration_ms", durationMs, "cycle", cycle));
        return result;
    }

    /**
     * @return {@code true} if the step was interrupted before it finished
     */
    private boolean runStep(Span span, String operation, String step, long cycle, List<String> failed) {
        Duration work = uniform(settings.stepMin(), settings.stepMax());
        try {
            sleeper.sleep(work);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.setStatus(SpanStatus.error("cancelled"));
            return true;
        }

        long durationMs = work.toMillis();
        if (random.nextDouble() < settings.failureProbability()) {
            String message = "Random failure in " + step;
            failed.add(step);
            span.setAttribute("error", true);
            span.setStatus(SpanStatus.error(message));
            span.addEvent("error_occurred", Map.of(
                    "error.type", "SimulatedError",
                    "error.message", message));
            correlator.error("Step failed: " + step,
                    fields("operation", operation, "step", step, "cycle", cycle));
            metrics.recordBackgroundError(operation, step);
        } else {
            span.addEvent("step_completed", Map.of("duration_ms", durationMs));
            correlator.info("Step completed: " + step,
                    fields("operation", operation, "step", step, "duration_ms", durationMs));
        }
        return false;
    }

    private Duration uniform(Duration min, Duration max) {
        long spread = max.toNanos() - min.toNanos();
        if (spread <= 0) {
            return min;
        }
        return min.plusNanos((long) (random.nextDouble() * spread));
    }
}
