package com.tracelink.observability;

import com.tracelink.export.ExportBuffer;
import com.tracelink.export.Signal;
import com.tracelink.logging.ConsoleJsonLogSink;
import com.tracelink.simulator.WorkloadRunner;
import com.tracelink.simulator.WorkloadSimulator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Export queue fill level and drop counts plus the simulator state. Drops do
 * not make the application unhealthy; a simulator thread that died does.
 */
@Component
public class TelemetryHealthIndicator implements HealthIndicator {

    private final ExportBuffer exportBuffer;
    private final ConsoleJsonLogSink consoleSink;
    private final WorkloadSimulator simulator;
    private final ObjectProvider<WorkloadRunner> runner;

    public TelemetryHealthIndicator(ExportBuffer exportBuffer,
                                    ConsoleJsonLogSink consoleSink,
                                    WorkloadSimulator simulator,
                                    ObjectProvider<WorkloadRunner> runner) {
        this.exportBuffer = exportBuffer;
        this.consoleSink = consoleSink;
        this.simulator = simulator;
        this.runner = runner;
    }

    @Override
    public Health health() {
        Map<String, Long> dropped = new LinkedHashMap<>();
        for (Signal signal : Signal.values()) {
            dropped.put(signal.tagValue(), exportBuffer.dropped(signal));
        }
        dropped.put(ConsoleJsonLogSink.DROP_SIGNAL, consoleSink.dropped());

        Map<String, Object> simulatorStatus = new LinkedHashMap<>();
        WorkloadRunner workloadRunner = runner.getIfAvailable();
        boolean simulatorDown = false;
        if (workloadRunner == null) {
            simulatorStatus.put("enabled", false);
        } else {
            simulatorStatus.put("enabled", true);
            simulatorStatus.put("running", workloadRunner.isRunning());
            simulatorStatus.put("cycleFailures", workloadRunner.cycleFailures());
            simulatorDown = !workloadRunner.isRunning();
        }
        simulatorStatus.put("state", simulator.state().name());
        simulatorStatus.put("cycles", simulator.cycles());

        Health.Builder builder = simulatorDown ? Health.down() : Health.up();
        return builder
                .withDetail("exportQueue", Map.of(
                        "size", exportBuffer.size(),
                        "capacity", exportBuffer.capacity()))
                .withDetail("consoleQueue", Map.of(
                        "size", consoleSink.size(),
                        "capacity", consoleSink.capacity()))
                .withDetail("dropped", dropped)
                .withDetail("simulator", simulatorStatus)
                .build();
    }
}
