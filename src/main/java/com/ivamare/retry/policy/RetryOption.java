package com.ivamare.retry.policy;

/**
 * A single change to a policy configuration.
 *
 * @see RetryOptions
 */
@FunctionalInterface
public interface RetryOption {

    /**
     * Apply this option.
     *
     * @param builder The configuration to change
     */
    void applyTo(RetryPolicyBuilder builder);
}
