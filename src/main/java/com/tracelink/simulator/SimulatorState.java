package com.tracelink.simulator;

public enum SimulatorState {
    IDLE,
    RUNNING_ROOT,
    RUNNING_STEP
}
