package com.tracelink.simulator;

import java.util.List;

/**
 * A background operation and the ordered steps each run goes through.
 */
public record OperationDefinition(String name, List<String> steps) {

    public OperationDefinition {
        steps = List.copyOf(steps);
    }

    public String rootSpanName() {
        return "bg-" + name;
    }
}
