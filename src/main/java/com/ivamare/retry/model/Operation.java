package com.ivamare.retry.model;

/**
 * A fallible action that can be invoked more than once.
 *
 * <p>Implementations should be idempotent enough to retry and, when used in a parallel
 * run, safe to invoke concurrently with unrelated operations.
 */
@FunctionalInterface
public interface Operation {

    /**
     * Run the action.
     *
     * @throws Exception if the attempt failed
     */
    void run() throws Exception;
}
