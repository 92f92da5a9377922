package com.ivamare.retry.listener;

/**
 * Receives failed attempts when the retry policy is verbose.
 *
 * <p>Called on the thread that ran the attempt. Implementations must be thread-safe and
 * must return quickly; an exception thrown from here is logged and otherwise ignored.
 */
@FunctionalInterface
public interface AttemptListener {

    /**
     * Called after an attempt failed with a non-fatal error.
     *
     * @param stepName Name of the step
     * @param attempt Zero-based index of the failed attempt
     * @param error The error raised by the attempt
     */
    void onAttemptFailed(String stepName, int attempt, Throwable error);

    /**
     * Listener that ignores every record.
     */
    static AttemptListener noop() {
        return (stepName, attempt, error) -> { };
    }
}
