package com.tracelink.simulator;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * The fixed set of operations the simulator picks from.
 */
public class OperationCatalog {

    private final List<OperationDefinition> operations;

    public OperationCatalog(List<OperationDefinition> operations) {
        if (operations == null || operations.isEmpty()) {
            throw new IllegalStateException("Simulator operation catalog is empty");
        }
        Set<String> names = new HashSet<>();
        for (OperationDefinition operation : operations) {
            if (operation.name() == null || operation.name().isBlank()) {
                throw new IllegalStateException("Simulator operation without a name");
            }
            if (!names.add(operation.name())) {
                throw new IllegalStateException("Duplicate simulator operation: " + operation.name());
            }
            if (operation.steps().isEmpty()) {
                throw new IllegalStateException("Simulator operation has no steps: " + operation.name());
            }
            for (String step : operation.steps()) {
                if (step == null || step.isBlank()) {
                    throw new IllegalStateException("Blank step in simulator operation: " + operation.name());
                }
            }
        }
        this.operations = List.copyOf(operations);
    }

    public OperationDefinition pick(Random random) {
        return operations.get(random.nextInt(operations.size()));
    }

    public List<OperationDefinition> operations() {
        return operations;
    }

    public int size() {
        return operations.size();
    }
}
