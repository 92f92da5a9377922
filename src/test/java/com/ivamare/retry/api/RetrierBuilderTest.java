package com.ivamare.retry.api;

import com.ivamare.retry.api.impl.DefaultRetrier;
import com.ivamare.retry.listener.AttemptListener;
import com.ivamare.retry.policy.RetryPolicy;
import com.ivamare.retry.support.Sleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static com.ivamare.retry.policy.RetryOptions.count;
import static com.ivamare.retry.policy.RetryOptions.sleep;
import static com.ivamare.retry.policy.RetryOptions.verbose;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetrierBuilder")
class RetrierBuilderTest {

    @Mock
    private AttemptListener listener;

    @Mock
    private Sleeper sleeper;

    private RetrierBuilder builder;

    @BeforeEach
    void setUp() {
        builder = Retrier.builder();
    }

    @Test
    @DisplayName("should build retrier with default policy")
    void shouldBuildRetrierWithDefaultPolicy() {
        Retrier retrier = builder.build();

        assertInstanceOf(DefaultRetrier.class, retrier);
        assertEquals(RetryPolicy.defaultPolicy(), retrier.policy());
    }

    @Test
    @DisplayName("should use provided policy")
    void shouldUseProvidedPolicy() {
        RetryPolicy policy = RetryPolicy.of(count(5));

        Retrier retrier = builder.policy(policy).build();

        assertSame(policy, retrier.policy());
    }

    @Test
    @DisplayName("should build policy from options")
    void shouldBuildPolicyFromOptions() {
        Retrier retrier = builder.options(count(4), sleep(Duration.ofMillis(20))).build();

        assertEquals(4, retrier.policy().maxAttempts());
        assertEquals(Duration.ofMillis(20), retrier.policy().baseDelay());
    }

    @Test
    @DisplayName("should wire listener and sleeper")
    void shouldWireListenerAndSleeper() throws InterruptedException {
        AtomicInteger invocations = new AtomicInteger();
        Retrier retrier = builder
            .options(count(3), sleep(Duration.ofMillis(10)), verbose(true))
            .listener(listener)
            .sleeper(sleeper)
            .build();

        retrier.single("wired", () -> {
            if (invocations.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
        });

        verify(listener, times(2)).onAttemptFailed(any(), anyInt(), any());
        verify(sleeper, times(2)).sleep(Duration.ofMillis(10));
    }
}
