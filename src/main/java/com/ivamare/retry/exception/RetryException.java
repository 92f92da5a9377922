package com.ivamare.retry.exception;

/**
 * Base exception for all failures raised by a retrier.
 *
 * <p>The original operation error is always reachable through the cause chain, so callers
 * can test for a known error with {@link #isCausedBy(Throwable)} no matter how many
 * topology layers wrapped it.
 */
public class RetryException extends RuntimeException {

    private final Topology topology;

    public RetryException(Topology topology, String message, Throwable cause) {
        super(message, cause);
        this.topology = topology;
    }

    /**
     * Get the topology that raised this failure.
     */
    public Topology getTopology() {
        return topology;
    }

    /**
     * Check whether this failure is, or wraps, the given error value.
     *
     * @param sentinel the error to look for
     * @return true if present anywhere in the cause chain
     */
    public boolean isCausedBy(Throwable sentinel) {
        return ErrorChain.contains(this, sentinel);
    }

    /**
     * Check whether this failure wraps an error of the given type.
     *
     * @param type the exception type to look for
     * @return true if present anywhere in the cause chain
     */
    public boolean isCausedBy(Class<? extends Throwable> type) {
        return ErrorChain.containsInstanceOf(this, type);
    }
}
