package com.ivamare.retry.api;

import com.ivamare.retry.api.impl.DefaultRetrier;
import com.ivamare.retry.listener.AttemptListener;
import com.ivamare.retry.listener.LoggingAttemptListener;
import com.ivamare.retry.policy.RetryOption;
import com.ivamare.retry.policy.RetryPolicy;
import com.ivamare.retry.support.Sleeper;
import com.ivamare.retry.support.ThreadSleeper;

import java.util.concurrent.ExecutorService;

/**
 * Builder for creating Retrier instances.
 */
public class RetrierBuilder {

    private RetryPolicy policy;
    private AttemptListener listener;
    private Sleeper sleeper;
    private ExecutorService executor;

    /**
     * Set the retry policy (default: {@link RetryPolicy#defaultPolicy()}).
     *
     * @param policy The retry policy
     * @return this builder
     */
    public RetrierBuilder policy(RetryPolicy policy) {
        this.policy = policy;
        return this;
    }

    /**
     * Set the retry policy from options.
     *
     * @param options Options applied to a zero-valued configuration
     * @return this builder
     */
    public RetrierBuilder options(RetryOption... options) {
        this.policy = RetryPolicy.of(options);
        return this;
    }

    /**
     * Set the listener for failed attempts (default: SLF4J logging).
     *
     * @param listener The attempt listener
     * @return this builder
     */
    public RetrierBuilder listener(AttemptListener listener) {
        this.listener = listener;
        return this;
    }

    /**
     * Set how the retrier waits between attempts (default: {@link Thread#sleep}).
     *
     * @param sleeper The sleeper
     * @return this builder
     */
    public RetrierBuilder sleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
    }

    /**
     * Set the executor for parallel runs (default: a short-lived pool per run).
     *
     * <p>The executor is not shut down by the retrier.
     *
     * @param executor The executor service
     * @return this builder
     */
    public RetrierBuilder executor(ExecutorService executor) {
        this.executor = executor;
        return this;
    }

    /**
     * Build the retrier instance.
     *
     * @return configured Retrier
     */
    public Retrier build() {
        if (policy == null) {
            policy = RetryPolicy.defaultPolicy();
        }

        if (listener == null) {
            listener = new LoggingAttemptListener();
        }

        if (sleeper == null) {
            sleeper = ThreadSleeper.INSTANCE;
        }

        return new DefaultRetrier(policy, listener, sleeper, executor);
    }
}
