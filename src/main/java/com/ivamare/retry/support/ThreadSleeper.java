package com.ivamare.retry.support;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link Sleeper} backed by {@link Thread#sleep}.
 */
public final class ThreadSleeper implements Sleeper {

    public static final ThreadSleeper INSTANCE = new ThreadSleeper();

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return;
        }
        long nanos;
        try {
            nanos = duration.toNanos();
        } catch (ArithmeticException e) {
            nanos = Long.MAX_VALUE;
        }
        TimeUnit.NANOSECONDS.sleep(nanos);
    }
}
