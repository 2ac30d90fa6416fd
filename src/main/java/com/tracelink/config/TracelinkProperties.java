package com.tracelink.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "tracelink")
public class TracelinkProperties {

    private ServiceProperties service = new ServiceProperties();
    private ExportProperties export = new ExportProperties();
    private MetricsProperties metrics = new MetricsProperties();
    private SimulatorProperties simulator = new SimulatorProperties();
    private DemoProperties demo = new DemoProperties();

    public ServiceProperties getService() { return service; }
    public void setService(ServiceProperties service) { this.service = service; }

    public ExportProperties getExport() { return export; }
    public void setExport(ExportProperties export) { this.export = export; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public SimulatorProperties getSimulator() { return simulator; }
    public void setSimulator(SimulatorProperties simulator) { this.simulator = simulator; }

    public DemoProperties getDemo() { return demo; }
    public void setDemo(DemoProperties demo) { this.demo = demo; }

    public static class ServiceProperties {
        private String name = "test-app";
        private String version = "1.0.0";
        private String environment = "development";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
        public String getEnvironment() { return environment; }
        public void setEnvironment(String environment) { this.environment = environment; }
    }

    /**
     * Intervals are also read by {@code @Scheduled} placeholders, so keep them
     * as plain milliseconds or ISO-8601 ({@code PT5S}) in configuration files.
     */
    public static class ExportProperties {
        private Duration metricsInterval = Duration.ofSeconds(5);
        private Duration flushInterval = Duration.ofSeconds(1);
        private int queueCapacity = 2048;
        private int maxBatchSize = 512;
        private int consoleQueueCapacity = 8192;

        public Duration getMetricsInterval() { return metricsInterval; }
        public void setMetricsInterval(Duration metricsInterval) { this.metricsInterval = metricsInterval; }
        public Duration getFlushInterval() { return flushInterval; }
        public void setFlushInterval(Duration flushInterval) { this.flushInterval = flushInterval; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }
        public int getConsoleQueueCapacity() { return consoleQueueCapacity; }
        public void setConsoleQueueCapacity(int consoleQueueCapacity) { this.consoleQueueCapacity = consoleQueueCapacity; }
    }

    public static class MetricsProperties {
        private List<Double> histogramBuckets = new ArrayList<>(List.of(
                0.005, 0.01, 0.025, 0.05, 0.075, 0.1, 0.25, 0.5, 0.75, 1.0, 2.5, 5.0, 7.5, 10.0));

        public List<Double> getHistogramBuckets() { return histogramBuckets; }
        public void setHistogramBuckets(List<Double> histogramBuckets) { this.histogramBuckets = histogramBuckets; }
    }

    public static class SimulatorProperties {
        private boolean enabled = true;
        private Long seed;
        private double failureProbability = 0.1;
        private Duration stepMin = Duration.ofMillis(50);
        private Duration stepMax = Duration.ofMillis(200);
        private Duration delayMin = Duration.ofSeconds(3);
        private Duration delayMax = Duration.ofSeconds(8);
        private List<OperationProperties> operations = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }
        public double getFailureProbability() { return failureProbability; }
        public void setFailureProbability(double p) { this.failureProbability = p; }
        public Duration getStepMin() { return stepMin; }
        public void setStepMin(Duration stepMin) { this.stepMin = stepMin; }
        public Duration getStepMax() { return stepMax; }
        public void setStepMax(Duration stepMax) { this.stepMax = stepMax; }
        public Duration getDelayMin() { return delayMin; }
        public void setDelayMin(Duration delayMin) { this.delayMin = delayMin; }
        public Duration getDelayMax() { return delayMax; }
        public void setDelayMax(Duration delayMax) { this.delayMax = delayMax; }
        public List<OperationProperties> getOperations() { return operations; }
        public void setOperations(List<OperationProperties> operations) { this.operations = operations; }
    }

    public static class OperationProperties {
        private String name;
        private List<String> steps = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public List<String> getSteps() { return steps; }
        public void setSteps(List<String> steps) { this.steps = steps; }
    }

    /**
     * Randomized outcomes of the demo order endpoints.
     */
    public static class DemoProperties {
        private double notFoundProbability = 0.2;
        private double slowPaymentProbability = 0.1;
        private Duration slowPaymentDelay = Duration.ofMillis(200);

        public double getNotFoundProbability() { return notFoundProbability; }
        public void setNotFoundProbability(double p) { this.notFoundProbability = p; }
        public double getSlowPaymentProbability() { return slowPaymentProbability; }
        public void setSlowPaymentProbability(double p) { this.slowPaymentProbability = p; }
        public Duration getSlowPaymentDelay() { return slowPaymentDelay; }
        public void setSlowPaymentDelay(Duration slowPaymentDelay) { this.slowPaymentDelay = slowPaymentDelay; }
    }
}
