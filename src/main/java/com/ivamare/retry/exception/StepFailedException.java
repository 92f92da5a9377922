package com.ivamare.retry.exception;

/**
 * Raised when a single step stops retrying without succeeding.
 *
 * <p>The cause is the error returned by the last attempt.
 */
public class StepFailedException extends RetryException {

    private final String stepName;
    private final int attempts;
    private final FailureReason reason;

    /**
     * Create a step failed exception.
     *
     * @param stepName The name of the failed step
     * @param attempts Number of attempts made
     * @param reason Why retrying stopped
     * @param cause The error of the last attempt
     */
    public StepFailedException(String stepName, int attempts, FailureReason reason, Throwable cause) {
        super(Topology.SINGLE, stepName + ": " + describe(cause), cause);
        this.stepName = stepName;
        this.attempts = attempts;
        this.reason = reason;
    }

    /**
     * Get the name of the failed step.
     */
    public String getStepName() {
        return stepName;
    }

    /**
     * Get the number of attempts made before giving up.
     */
    public int getAttempts() {
        return attempts;
    }

    public FailureReason getReason() {
        return reason;
    }

    static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }
}
