package com.ivamare.retry;

import com.ivamare.retry.api.Retrier;
import com.ivamare.retry.api.impl.DefaultRetrier;
import com.ivamare.retry.listener.AttemptListener;
import com.ivamare.retry.listener.LoggingAttemptListener;
import com.ivamare.retry.policy.RetryPolicy;
import com.ivamare.retry.support.Sleeper;
import com.ivamare.retry.support.ThreadSleeper;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for jretry.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Retry Policy</li>
 *   <li>Attempt Listener</li>
 *   <li>Sleeper</li>
 *   <li>Retrier</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * jretry.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "jretry", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RetryProperties.class)
public class RetryAutoConfiguration {

    // --- Retry Policy ---

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(RetryProperties properties) {
        return properties.toPolicy();
    }

    // --- Collaborators ---

    @Bean
    @ConditionalOnMissingBean
    public AttemptListener attemptListener() {
        return new LoggingAttemptListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper retrySleeper() {
        return ThreadSleeper.INSTANCE;
    }

    // --- Retrier ---

    @Bean
    @ConditionalOnMissingBean
    public Retrier retrier(RetryPolicy retryPolicy, AttemptListener attemptListener, Sleeper retrySleeper) {
        return new DefaultRetrier(retryPolicy, attemptListener, retrySleeper);
    }
}
