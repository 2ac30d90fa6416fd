package com.tracelink.config;

import com.tracelink.logging.LogCorrelator;
import com.tracelink.observability.TelemetryMetrics;
import com.tracelink.simulator.OperationCatalog;
import com.tracelink.simulator.OperationDefinition;
import com.tracelink.simulator.SimulatorSettings;
import com.tracelink.simulator.Sleeper;
import com.tracelink.simulator.WorkloadRunner;
import com.tracelink.simulator.WorkloadSimulator;
import com.tracelink.trace.Tracer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Random;

@Configuration
public class SimulatorConfig {

    private static final Logger log = LoggerFactory.getLogger(SimulatorConfig.class);

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public OperationCatalog operationCatalog(TracelinkProperties properties) {
        List<OperationDefinition> operations = properties.getSimulator().getOperations().stream()
                .map(op -> new OperationDefinition(op.getName(),
                        op.getSteps() != null ? op.getSteps() : List.of()))
                .toList();
        return new OperationCatalog(operations);
    }

    @Bean
    public SimulatorSettings simulatorSettings(TracelinkProperties properties) {
        TracelinkProperties.SimulatorProperties sim = properties.getSimulator();
        return new SimulatorSettings(sim.getFailureProbability(),
                sim.getStepMin(), sim.getStepMax(), sim.getDelayMin(), sim.getDelayMax());
    }

    @Bean
    public WorkloadSimulator workloadSimulator(Tracer tracer,
                                               LogCorrelator logCorrelator,
                                               TelemetryMetrics telemetryMetrics,
                                               OperationCatalog operationCatalog,
                                               SimulatorSettings simulatorSettings,
                                               Sleeper sleeper,
                                               Clock telemetryClock,
                                               TracelinkProperties properties) {
        Long seed = properties.getSimulator().getSeed();
        Random random = seed != null ? new Random(seed) : new Random();
        if (seed != null) {
            log.info("Workload simulator seeded with {}", seed);
        }
        return new WorkloadSimulator(tracer, logCorrelator, telemetryMetrics, operationCatalog,
                simulatorSettings, random, sleeper, telemetryClock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "tracelink.simulator", name = "enabled",
            havingValue = "true", matchIfMissing = true)
    public WorkloadRunner workloadRunner(WorkloadSimulator workloadSimulator,
                                         OperationCatalog operationCatalog,
                                         Sleeper sleeper,
                                         MeterRegistry meterRegistry) {
        log.info("Background workload simulator enabled with {} operations", operationCatalog.size());
        return new WorkloadRunner(workloadSimulator, sleeper, meterRegistry);
    }
}
