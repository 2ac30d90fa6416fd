package com.tracelink.simulator;

import java.time.Duration;

/**
 * Blocking pause used for simulated work, swappable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

    void sleep(Duration duration) throws InterruptedException;
}
