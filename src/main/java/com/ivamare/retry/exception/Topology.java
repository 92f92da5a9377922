package com.ivamare.retry.exception;

/**
 * Execution topology a failure was raised from.
 */
public enum Topology {
    /** One operation retried on the calling thread. */
    SINGLE,

    /** Operations retried one after another, stopping at the first failure. */
    CHAIN,

    /** Operations retried concurrently, all run to completion. */
    PARALLEL
}
