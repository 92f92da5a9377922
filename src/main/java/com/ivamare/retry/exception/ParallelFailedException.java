package com.ivamare.retry.exception;

import java.util.List;

/**
 * Raised when one or more steps of a parallel run fail.
 *
 * <p>The cause is the first failure observed in completion order. Every other failure is
 * attached as a suppressed exception and listed by {@link #getFailures()}.
 */
public class ParallelFailedException extends RetryException {

    private final List<StepFailedException> failures;

    public ParallelFailedException(List<StepFailedException> failures) {
        super(Topology.PARALLEL, "parallel: " + first(failures).getMessage(), first(failures));
        this.failures = List.copyOf(failures);
        for (int i = 1; i < this.failures.size(); i++) {
            addSuppressed(this.failures.get(i));
        }
    }

    /**
     * Get the representative failure, the first one observed.
     */
    public StepFailedException getFailure() {
        return failures.get(0);
    }

    /**
     * Get every step failure, in completion order.
     */
    public List<StepFailedException> getFailures() {
        return failures;
    }

    /**
     * Get the names of the failed steps, in completion order.
     */
    public List<String> getFailedStepNames() {
        return failures.stream().map(StepFailedException::getStepName).toList();
    }

    private static StepFailedException first(List<StepFailedException> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("at least one failure is required");
        }
        return failures.get(0);
    }
}
