package com.ivamare.retry.exception;

/**
 * Raised when a step of a chain fails; steps after it were not run.
 */
public class ChainFailedException extends RetryException {

    private final int stepIndex;

    public ChainFailedException(int stepIndex, StepFailedException cause) {
        super(Topology.CHAIN, "chain: " + cause.getMessage(), cause);
        this.stepIndex = stepIndex;
    }

    /**
     * Get the zero-based position of the failed step in the chain.
     */
    public int getStepIndex() {
        return stepIndex;
    }

    public String getStepName() {
        return getFailure().getStepName();
    }

    /**
     * Get the failure of the step that stopped the chain.
     */
    public StepFailedException getFailure() {
        return (StepFailedException) getCause();
    }
}
