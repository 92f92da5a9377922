package com.ivamare.retry.policy;

import java.time.Duration;

/**
 * Delay-growth functions used between attempts.
 *
 * <p>All arithmetic is done on nanoseconds with exact long operations. A result that
 * does not fit saturates at {@link #MAX_DELAY}.
 */
public enum BackoffStrategy {

    /**
     * {@code baseDelay + jitter * attempt}.
     */
    SIMPLE {
        @Override
        long delayNanos(long baseNanos, long jitterNanos, int attempt) {
            return Math.addExact(baseNanos, Math.multiplyExact(jitterNanos, attempt));
        }
    },

    /**
     * {@code baseDelay * attempt + jitter}.
     */
    LINEAR {
        @Override
        long delayNanos(long baseNanos, long jitterNanos, int attempt) {
            return Math.addExact(Math.multiplyExact(baseNanos, attempt), jitterNanos);
        }
    },

    /**
     * {@code baseDelay * 2^attempt + jitter}.
     */
    EXPONENTIAL {
        @Override
        long delayNanos(long baseNanos, long jitterNanos, int attempt) {
            if (attempt >= Long.SIZE - 1) {
                throw new ArithmeticException("2^" + attempt + " overflows");
            }
            return Math.addExact(Math.multiplyExact(baseNanos, 1L << attempt), jitterNanos);
        }
    },

    /**
     * {@code baseDelay * fib(attempt) + jitter}, with {@code fib(0) = 0} and {@code fib(1) = 1}.
     */
    FIBONACCI {
        @Override
        long delayNanos(long baseNanos, long jitterNanos, int attempt) {
            return Math.addExact(Math.multiplyExact(baseNanos, fibonacci(attempt)), jitterNanos);
        }
    };

    /**
     * Largest delay this strategy will ever return.
     */
    public static final Duration MAX_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    abstract long delayNanos(long baseNanos, long jitterNanos, int attempt);

    /**
     * Compute the delay to wait after the given attempt.
     *
     * @param baseDelay base wait unit, must not be negative
     * @param jitter per-attempt scaling term, must not be negative
     * @param attempt attempt number just completed (0 or more)
     * @return the delay, saturated at {@link #MAX_DELAY}
     * @throws IllegalArgumentException if attempt is negative
     */
    public Duration delay(Duration baseDelay, Duration jitter, int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        try {
            return Duration.ofNanos(delayNanos(toNanos(baseDelay), toNanos(jitter), attempt));
        } catch (ArithmeticException e) {
            return MAX_DELAY;
        }
    }

    /**
     * Iterative Fibonacci number, {@code fib(0) = 0}, {@code fib(1) = 1}.
     *
     * @throws ArithmeticException when the value no longer fits in a long
     */
    static long fibonacci(int n) {
        long previous = 0;
        long current = n == 0 ? 0 : 1;
        for (int i = 2; i <= n; i++) {
            long next = Math.addExact(previous, current);
            previous = current;
            current = next;
        }
        return current;
    }

    private static long toNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
