package com.ivamare.retry.api;

import com.ivamare.retry.exception.ChainFailedException;
import com.ivamare.retry.exception.ParallelFailedException;
import com.ivamare.retry.exception.StepFailedException;
import com.ivamare.retry.model.Operation;
import com.ivamare.retry.model.Step;
import com.ivamare.retry.policy.RetryPolicy;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs operations under a {@link RetryPolicy}.
 *
 * <p>The Retrier provides three topologies:
 * <ul>
 *   <li>Single - one operation retried until it succeeds or gives up</li>
 *   <li>Chain - operations run one after another, stopping at the first failure</li>
 *   <li>Parallel - operations run concurrently, every one to completion</li>
 * </ul>
 *
 * <p>Success returns normally. Every failure is raised as a subclass of
 * {@link com.ivamare.retry.exception.RetryException} whose cause chain holds the
 * operation's own error. A {@link java.lang.Error} thrown by an operation is not a
 * failure and propagates unchanged.
 *
 * <p>Implementations are thread-safe.
 */
public interface Retrier {

    static RetrierBuilder builder() {
        return new RetrierBuilder();
    }

    /**
     * Get the policy this retrier applies.
     */
    RetryPolicy policy();

    // --- Single ---

    /**
     * Run an operation until it succeeds, hits a fatal error or runs out of attempts.
     *
     * @param name Step name used in errors and logs
     * @param operation The action to run
     * @throws StepFailedException if the operation did not succeed
     */
    void single(String name, Operation operation);

    /**
     * Run a value-producing operation under the same rules as {@link #single}.
     *
     * @param name Step name used in errors and logs
     * @param callable The action to run
     * @param <T> Result type
     * @return the value of the first successful attempt
     * @throws StepFailedException if the operation did not succeed
     */
    <T> T call(String name, Callable<T> callable);

    // --- Chain ---

    /**
     * Run steps in order; a step starts only after the previous one succeeded.
     * An empty chain succeeds.
     *
     * @param steps Steps to run
     * @throws ChainFailedException at the first step that did not succeed
     */
    void chain(List<Step> steps);

    default void chain(Step... steps) {
        chain(List.of(steps));
    }

    // --- Parallel ---

    /**
     * Run steps concurrently, at most {@link RetryPolicy#parallelism()} at a time when
     * it is positive. Waits for every step to finish, whatever happens to the others.
     * An empty run succeeds.
     *
     * @param steps Steps to run
     * @throws ParallelFailedException if any step did not succeed
     */
    void parallel(List<Step> steps);

    default void parallel(Step... steps) {
        parallel(List.of(steps));
    }
}
