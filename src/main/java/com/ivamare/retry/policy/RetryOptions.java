package com.ivamare.retry.policy;

import java.time.Duration;

/**
 * Factory methods for {@link RetryOption}s.
 *
 * <p>Example:
 * <pre>
 * RetryPolicy policy = RetryPolicy.of(
 *     RetryOptions.count(5),
 *     RetryOptions.sleep(Duration.ofMillis(200)),
 *     RetryOptions.strategy(BackoffStrategy.EXPONENTIAL),
 *     RetryOptions.fatal(AUTH_REJECTED)
 * );
 * </pre>
 */
public final class RetryOptions {

    private RetryOptions() {
        // Utility class - no instantiation
    }

    /**
     * Sets the total number of attempts.
     */
    public static RetryOption count(int attempts) {
        return builder -> builder.maxAttempts(attempts);
    }

    /**
     * Sets the base delay between attempts.
     */
    public static RetryOption sleep(Duration delay) {
        return builder -> builder.baseDelay(delay);
    }

    /**
     * Sets the jitter term. With the SIMPLE strategy each attempt waits
     * {@code sleep + jitter * attempt}.
     */
    public static RetryOption jitter(Duration jitter) {
        return builder -> builder.jitter(jitter);
    }

    /**
     * Sets the backoff strategy.
     */
    public static RetryOption strategy(BackoffStrategy strategy) {
        return builder -> builder.strategy(strategy);
    }

    /**
     * Sets the parallelism cap, zero means no limit.
     */
    public static RetryOption parallelism(int parallelism) {
        return builder -> builder.parallelism(parallelism);
    }

    public static RetryOption verbose(boolean verbose) {
        return builder -> builder.verbose(verbose);
    }

    /**
     * Registers fatal error values, additive.
     */
    public static RetryOption fatal(Throwable... errors) {
        Throwable[] copy = errors.clone();
        return builder -> builder.fatal(copy);
    }

    /**
     * Registers fatal error types, additive.
     */
    @SafeVarargs
    public static RetryOption fatalOn(Class<? extends Throwable>... types) {
        Class<? extends Throwable>[] copy = types.clone();
        return builder -> builder.fatalOn(copy);
    }
}
