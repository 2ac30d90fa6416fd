package com.tracelink.simulator;

import java.time.Duration;

/**
 * Timing and failure knobs of the simulator. Validated on construction;
 * an invalid combination fails application startup.
 */
public record SimulatorSettings(
        double failureProbability,
        Duration stepMin,
        Duration stepMax,
        Duration delayMin,
        Duration delayMax
) {
    public static final SimulatorSettings DEFAULTS = new SimulatorSettings(
            0.1, Duration.ofMillis(50), Duration.ofMillis(200), Duration.ofSeconds(3), Duration.ofSeconds(8));

    public SimulatorSettings {
        if (Double.isNaN(failureProbability) || failureProbability < 0.0 || failureProbability > 1.0) {
            throw new IllegalStateException("failure-probability must be within [0, 1]: " + failureProbability);
        }
        requireRange("step", stepMin, stepMax);
        requireRange("delay", delayMin, delayMax);
    }

    private static void requireRange(String what, Duration min, Duration max) {
        if (min == null || max == null) {
            throw new IllegalStateException(what + "-min and " + what + "-max are required");
        }
        if (min.isNegative()) {
            throw new IllegalStateException(what + "-min must not be negative: " + min);
        }
        if (min.compareTo(max) > 0) {
            throw new IllegalStateException(what + "-min " + min + " exceeds " + what + "-max " + max);
        }
    }
}
