package com.ivamare.retry.policy;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable configuration that {@link RetryOption}s write to.
 *
 * <p>Starts zero-valued; {@link #build()} clamps anything invalid.
 */
public class RetryPolicyBuilder {

    private int maxAttempts;
    private Duration baseDelay = Duration.ZERO;
    private Duration jitter = Duration.ZERO;
    private BackoffStrategy strategy = BackoffStrategy.SIMPLE;
    private int parallelism;
    private boolean verbose;
    private final Set<Throwable> fatalErrors = new LinkedHashSet<>();
    private final Set<Class<? extends Throwable>> fatalTypes = new LinkedHashSet<>();

    RetryPolicyBuilder() {
    }

    /**
     * Set the total number of attempts (default: 1).
     *
     * @param maxAttempts Number of tries, including the first
     * @return this builder
     */
    public RetryPolicyBuilder maxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
        return this;
    }

    /**
     * Set the base delay between attempts (default: 500ms).
     *
     * @param baseDelay Base wait unit
     * @return this builder
     */
    public RetryPolicyBuilder baseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
        return this;
    }

    /**
     * Set the jitter term (default: none).
     *
     * @param jitter Per-attempt scaling term
     * @return this builder
     */
    public RetryPolicyBuilder jitter(Duration jitter) {
        this.jitter = jitter;
        return this;
    }

    /**
     * Set the backoff strategy (default: SIMPLE).
     *
     * @param strategy Delay-growth function
     * @return this builder
     */
    public RetryPolicyBuilder strategy(BackoffStrategy strategy) {
        this.strategy = strategy;
        return this;
    }

    /**
     * Set the concurrency cap for parallel runs (default: 0, unlimited).
     *
     * @param parallelism Maximum simultaneous tasks
     * @return this builder
     */
    public RetryPolicyBuilder parallelism(int parallelism) {
        this.parallelism = parallelism;
        return this;
    }

    /**
     * Enable/disable reporting of failed attempts (default: false).
     *
     * @param verbose Whether to report failed attempts
     * @return this builder
     */
    public RetryPolicyBuilder verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    /**
     * Register error values that stop retrying. Adds to previously registered values.
     *
     * @param errors Fatal error values
     * @return this builder
     */
    public RetryPolicyBuilder fatal(Throwable... errors) {
        Arrays.stream(errors).map(e -> Objects.requireNonNull(e, "fatal error")).forEach(fatalErrors::add);
        return this;
    }

    /**
     * Register error types that stop retrying. Adds to previously registered types.
     *
     * @param types Fatal error types
     * @return this builder
     */
    @SafeVarargs
    public final RetryPolicyBuilder fatalOn(Class<? extends Throwable>... types) {
        Arrays.stream(types).map(t -> Objects.requireNonNull(t, "fatal type")).forEach(fatalTypes::add);
        return this;
    }

    /**
     * Apply options in order.
     *
     * @param options Options to apply
     * @return this builder
     */
    public RetryPolicyBuilder apply(RetryOption... options) {
        for (RetryOption option : options) {
            option.applyTo(this);
        }
        return this;
    }

    /**
     * Build the policy, clamping invalid values.
     *
     * @return validated policy
     */
    public RetryPolicy build() {
        return new RetryPolicy(
            maxAttempts,
            baseDelay,
            jitter,
            strategy,
            parallelism,
            verbose,
            fatalErrors,
            fatalTypes
        );
    }
}
