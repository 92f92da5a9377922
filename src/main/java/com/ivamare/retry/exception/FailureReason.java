package com.ivamare.retry.exception;

/**
 * Why a step stopped retrying without succeeding.
 */
public enum FailureReason {
    /**
     * Every allowed attempt failed.
     */
    EXHAUSTED,

    /**
     * The operation raised an error registered as fatal, so no further attempt was made.
     */
    FATAL,

    /**
     * The retrying thread was interrupted while waiting or while running the operation.
     */
    INTERRUPTED
}
