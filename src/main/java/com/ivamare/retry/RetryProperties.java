package com.ivamare.retry;

import com.ivamare.retry.policy.BackoffStrategy;
import com.ivamare.retry.policy.RetryPolicy;
import com.ivamare.retry.policy.RetryPolicyBuilder;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for jretry.
 *
 * <p>Example configuration:
 * <pre>
 * jretry:
 *   enabled: true
 *   max-attempts: 5
 *   sleep: 200ms
 *   jitter: 50ms
 *   strategy: exponential
 *   parallelism: 4
 *   verbose: true
 *   fatal-exceptions:
 *     - java.lang.IllegalArgumentException
 * </pre>
 */
@ConfigurationProperties(prefix = "jretry")
public class RetryProperties {

    /**
     * Enable/disable jretry auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Total number of attempts per step, including the first.
     */
    private int maxAttempts = RetryPolicy.MIN_ATTEMPTS;

    /**
     * Base delay between attempts.
     */
    private Duration sleep = RetryPolicy.MIN_DELAY;

    /**
     * Jitter term, meaning depends on the strategy.
     */
    private Duration jitter = Duration.ZERO;

    /**
     * Delay-growth strategy.
     */
    private BackoffStrategy strategy = BackoffStrategy.SIMPLE;

    /**
     * Maximum steps running at once in a parallel run, 0 for unlimited.
     */
    private int parallelism = 0;

    /**
     * Log every failed attempt.
     */
    private boolean verbose = false;

    /**
     * Exception types that stop retrying immediately.
     */
    private List<Class<? extends Throwable>> fatalExceptions = new ArrayList<>();

    /**
     * Build the policy these properties describe.
     *
     * @return validated retry policy
     */
    public RetryPolicy toPolicy() {
        RetryPolicyBuilder builder = RetryPolicy.builder()
            .maxAttempts(maxAttempts)
            .baseDelay(sleep)
            .jitter(jitter)
            .strategy(strategy)
            .parallelism(parallelism)
            .verbose(verbose);
        for (Class<? extends Throwable> type : fatalExceptions) {
            builder.fatalOn(type);
        }
        return builder.build();
    }

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getSleep() {
        return sleep;
    }

    public void setSleep(Duration sleep) {
        this.sleep = sleep;
    }

    public Duration getJitter() {
        return jitter;
    }

    public void setJitter(Duration jitter) {
        this.jitter = jitter;
    }

    public BackoffStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(BackoffStrategy strategy) {
        this.strategy = strategy;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public List<Class<? extends Throwable>> getFatalExceptions() {
        return fatalExceptions;
    }

    public void setFatalExceptions(List<Class<? extends Throwable>> fatalExceptions) {
        this.fatalExceptions = fatalExceptions != null ? fatalExceptions : new ArrayList<>();
    }
}
