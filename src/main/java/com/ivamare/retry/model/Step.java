package com.ivamare.retry.model;

import java.util.Objects;

/**
 * A named operation to retry.
 *
 * @param name Name used to attribute failures and log lines
 * @param operation The action to run
 */
public record Step(
    String name,
    Operation operation
) {
    public Step {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(operation, "operation is required");
    }

    public static Step of(String name, Operation operation) {
        return new Step(name, operation);
    }
}
