package com.tracelink.simulator;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * Drives the {@link WorkloadSimulator} on one dedicated daemon thread named
 * {@value #THREAD_NAME} for the lifetime of the application context.
 *
 * <p>{@link #stop()} raises a flag the simulator polls between steps and
 * interrupts the thread to cut short any sleep in progress. A cycle that
 * throws is logged and counted; the loop carries on with the next one.
 */
public class WorkloadRunner implements SmartLifecycle {

    public static final String THREAD_NAME = "workload-simulator";

    private static final Logger log = LoggerFactory.getLogger(WorkloadRunner.class);
    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(5);

    private final WorkloadSimulator simulator;
    private final Sleeper sleeper;
    private final Counter cycleFailures;
    private final Duration joinTimeout;

    private volatile boolean stopRequested;
    private volatile Thread worker;

    public WorkloadRunner(WorkloadSimulator simulator, Sleeper sleeper, MeterRegistry meterRegistry) {
        this(simulator, sleeper, meterRegistry, JOIN_TIMEOUT);
    }

    WorkloadRunner(WorkloadSimulator simulator, Sleeper sleeper, MeterRegistry meterRegistry,
                   Duration joinTimeout) {
        this.simulator = simulator;
        this.sleeper = sleeper;
        this.joinTimeout = joinTimeout;
        this.cycleFailures = Counter.builder("tracelink.simulator.cycle_failures")
                .description("Simulator cycles that ended with an unexpected exception")
                .register(meterRegistry);
    }

    @Override
    public synchronized void start() {
        if (worker != null) {
            if (worker.isAlive()) {
                // the previous thread is still finishing a cycle; never run two
                return;
            }
            worker = null;
        }
        stopRequested = false;
        Thread thread = new Thread(this::runLoop, THREAD_NAME);
        thread.setDaemon(true);
        worker = thread;
        thread.start();
        log.info("Background workload simulator started on thread {}", THREAD_NAME);
    }

    @Override
    public void stop() {
        Thread thread;
        synchronized (this) {
            thread = worker;
            if (thread == null) {
                return;
            }
            stopRequested = true;
            thread.interrupt();
        }
        try {
            thread.join(joinTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Workload simulator did not stop within {}, keeping thread {} registered",
                    joinTimeout, thread.getName());
            return;
        }
        synchronized (this) {
            if (worker == thread) {
                worker = null;
            }
        }
        log.info("Background workload simulator stopped after {} cycles", simulator.cycles());
    }

    @Override
    public boolean isRunning() {
        Thread thread = worker;
        return thread != null && thread.isAlive();
    }

    public long cycleFailures() {
        return (long) cycleFailures.count();
    }

    void runLoop() {
        while (!stopRequested) {
            try {
                CycleResult result = simulator.runCycle(() -> stopRequested);
                if (result.cancelled()) {
                    break;
                }
            } catch (RuntimeException e) {
                cycleFailures.increment();
                log.error("Workload simulator cycle failed", e);
            }
            try {
                sleeper.sleep(simulator.nextDelay());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }
}
