package com.ivamare.retry.policy;

import com.ivamare.retry.exception.ErrorChain;

import java.time.Duration;
import java.util.Set;

/**
 * Policy for retrying operations.
 *
 * <p>Invalid values are clamped to safe minimums, never rejected, so every instance is
 * valid and can be shared between threads.
 *
 * @param maxAttempts Total number of tries per operation, including the first
 * @param baseDelay Base wait unit between attempts
 * @param jitter Per-attempt scaling term, meaning depends on the strategy
 * @param strategy Delay-growth function
 * @param parallelism Concurrency cap for parallel runs, 0 for unlimited
 * @param verbose Whether failed attempts are reported to the attempt listener
 * @param fatalErrors Error values that stop retrying when found in a failure's cause chain
 * @param fatalTypes Error types that stop retrying when found in a failure's cause chain
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    Duration jitter,
    BackoffStrategy strategy,
    int parallelism,
    boolean verbose,
    Set<Throwable> fatalErrors,
    Set<Class<? extends Throwable>> fatalTypes
) {
    public static final int MIN_ATTEMPTS = 1;
    public static final int MIN_PARALLELISM = 0;
    public static final Duration MIN_DELAY = Duration.ofMillis(500);

    /**
     * Creates a RetryPolicy, clamping invalid values.
     */
    public RetryPolicy {
        if (maxAttempts < MIN_ATTEMPTS) {
            maxAttempts = MIN_ATTEMPTS;
        }
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            baseDelay = MIN_DELAY;
        }
        if (jitter == null || jitter.isNegative()) {
            jitter = Duration.ZERO;
        }
        if (strategy == null) {
            strategy = BackoffStrategy.SIMPLE;
        }
        if (parallelism < MIN_PARALLELISM) {
            parallelism = MIN_PARALLELISM;
        }
        fatalErrors = fatalErrors != null ? Set.copyOf(fatalErrors) : Set.of();
        fatalTypes = fatalTypes != null ? Set.copyOf(fatalTypes) : Set.of();
    }

    /**
     * Build a policy by applying options, in order, to a zero-valued configuration.
     *
     * @param options Options to apply
     * @return validated policy
     */
    public static RetryPolicy of(RetryOption... options) {
        RetryPolicyBuilder builder = builder();
        for (RetryOption option : options) {
            option.applyTo(builder);
        }
        return builder.build();
    }

    /**
     * Default policy: a single attempt with a 500ms base delay.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return of();
    }

    public static RetryPolicyBuilder builder() {
        return new RetryPolicyBuilder();
    }

    /**
     * Get the delay to wait after the given attempt.
     *
     * @param attempt The attempt just completed (1-based when used between tries)
     * @return Delay before the next attempt
     * @throws IllegalArgumentException if attempt is negative
     */
    public Duration delay(int attempt) {
        return strategy.delay(baseDelay, jitter, attempt);
    }

    /**
     * Check if an error must stop retrying.
     *
     * @param error The error raised by an attempt
     * @return true if the error, or any cause, is a registered fatal value or type
     */
    public boolean isFatal(Throwable error) {
        if (error == null) {
            return false;
        }
        return ErrorChain.containsAny(error, fatalErrors)
            || ErrorChain.containsInstanceOfAny(error, fatalTypes);
    }

    /**
     * Check if another attempt is allowed.
     *
     * @param attempt The number of attempts already made
     * @return true if more attempts are allowed
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Get the number of simultaneous tasks for a parallel run of the given size.
     *
     * @param taskCount Number of tasks in the run
     * @return permits to hand out, at least 1
     */
    public int concurrencyFor(int taskCount) {
        int tasks = Math.max(1, taskCount);
        return parallelism > 0 ? Math.min(parallelism, tasks) : tasks;
    }
}
