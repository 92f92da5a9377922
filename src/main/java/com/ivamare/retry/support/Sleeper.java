package com.ivamare.retry.support;

import java.time.Duration;

/**
 * Blocks the current thread between attempts.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Block for the given duration.
     *
     * @param duration How long to wait; zero or negative returns immediately
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;
}
