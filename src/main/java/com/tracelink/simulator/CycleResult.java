package com.tracelink.simulator;

import com.tracelink.trace.TraceId;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one simulator cycle.
 *
 * @param completedSteps steps that ran, failed ones included, in order
 * @param failedSteps    subset of {@code completedSteps} that failed
 * @param cancelled      the cycle stopped at a step boundary before the last step
 */
public record CycleResult(
        long cycle,
        String operation,
        TraceId traceId,
        List<String> completedSteps,
        List<String> failedSteps,
        boolean cancelled,
        Duration duration
) {
    public CycleResult {
        completedSteps = List.copyOf(completedSteps);
        failedSteps = List.copyOf(failedSteps);
    }

    public boolean success() {
        return !cancelled && failedSteps.isEmpty();
    }
}
