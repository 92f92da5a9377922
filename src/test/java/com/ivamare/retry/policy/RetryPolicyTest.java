package com.ivamare.retry.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

import static com.ivamare.retry.policy.RetryOptions.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    private static final RuntimeException ERR_FATAL = new IllegalStateException("custom fatal error");
    private static final RuntimeException ERR_FAIL = new IllegalStateException("test fail");

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("should create default policy with one attempt")
        void shouldCreateDefaultPolicyWithOneAttempt() {
            RetryPolicy policy = RetryPolicy.of();

            assertEquals(1, policy.maxAttempts());
            assertEquals(RetryPolicy.MIN_DELAY, policy.baseDelay());
            assertEquals(Duration.ZERO, policy.jitter());
            assertEquals(BackoffStrategy.SIMPLE, policy.strategy());
            assertEquals(0, policy.parallelism());
            assertFalse(policy.verbose());
            assertTrue(policy.fatalErrors().isEmpty());
            assertTrue(policy.fatalTypes().isEmpty());
            assertEquals(policy, RetryPolicy.defaultPolicy());
        }

        @Test
        @DisplayName("should clamp invalid values")
        void shouldClampInvalidValues() {
            RetryPolicy policy = RetryPolicy.of(
                count(-10),
                parallelism(-6),
                sleep(Duration.ofHours(-1)),
                jitter(Duration.ofMinutes(-1)),
                verbose(true)
            );

            assertEquals(1, policy.maxAttempts());
            assertEquals(0, policy.parallelism());
            assertEquals(RetryPolicy.MIN_DELAY, policy.baseDelay());
            assertEquals(Duration.ZERO, policy.jitter());
            assertTrue(policy.verbose());
        }

        @Test
        @DisplayName("should clamp zero and null delays")
        void shouldClampZeroAndNullDelays() {
            RetryPolicy zero = RetryPolicy.of(sleep(Duration.ZERO));
            RetryPolicy nulls = new RetryPolicy(1, null, null, null, 0, false, null, null);

            assertEquals(RetryPolicy.MIN_DELAY, zero.baseDelay());
            assertEquals(RetryPolicy.MIN_DELAY, nulls.baseDelay());
            assertEquals(Duration.ZERO, nulls.jitter());
            assertEquals(BackoffStrategy.SIMPLE, nulls.strategy());
            assertEquals(Set.of(), nulls.fatalErrors());
            assertEquals(Set.of(), nulls.fatalTypes());
        }

        @Test
        @DisplayName("should apply options in order")
        void shouldApplyOptionsInOrder() {
            RetryPolicy policy = RetryPolicy.of(
                count(2),
                sleep(Duration.ofMillis(10)),
                count(7),
                strategy(BackoffStrategy.FIBONACCI),
                parallelism(3)
            );

            assertEquals(7, policy.maxAttempts());
            assertEquals(Duration.ofMillis(10), policy.baseDelay());
            assertEquals(BackoffStrategy.FIBONACCI, policy.strategy());
            assertEquals(3, policy.parallelism());
        }

        @Test
        @DisplayName("should accumulate fatal registrations")
        void shouldAccumulateFatalRegistrations() {
            RuntimeException other = new RuntimeException("other");

            RetryPolicy policy = RetryPolicy.of(
                fatal(ERR_FATAL),
                fatal(other),
                fatalOn(IOException.class),
                fatalOn(IllegalArgumentException.class)
            );

            assertEquals(Set.of(ERR_FATAL, other), policy.fatalErrors());
            assertEquals(Set.of(IOException.class, IllegalArgumentException.class), policy.fatalTypes());
        }

        @Test
        @DisplayName("should build the same policy fluently")
        void shouldBuildSamePolicyFluently() {
            RetryPolicy fromBuilder = RetryPolicy.builder()
                .maxAttempts(3)
                .baseDelay(Duration.ofMillis(5))
                .strategy(BackoffStrategy.LINEAR)
                .build();

            assertEquals(RetryPolicy.of(count(3), sleep(Duration.ofMillis(5)), strategy(BackoffStrategy.LINEAR)), fromBuilder);
        }

        @Test
        @DisplayName("should make fatal collections immutable")
        void shouldMakeFatalCollectionsImmutable() {
            Set<Throwable> errors = new HashSet<>();
            errors.add(ERR_FATAL);
            RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ZERO,
                BackoffStrategy.SIMPLE, 0, false, errors, Set.of());

            errors.add(ERR_FAIL);

            assertEquals(1, policy.fatalErrors().size());
            assertThrows(UnsupportedOperationException.class, () -> policy.fatalErrors().add(ERR_FAIL));
            assertThrows(UnsupportedOperationException.class, () -> policy.fatalTypes().add(IOException.class));
        }

        @Test
        @DisplayName("should reject null fatal values")
        void shouldRejectNullFatalValues() {
            assertThrows(NullPointerException.class, () -> RetryPolicy.of(fatal((Throwable) null)));
        }
    }

    @Nested
    @DisplayName("delay")
    class Delay {

        @Test
        @DisplayName("should delegate to the strategy")
        void shouldDelegateToStrategy() {
            RetryPolicy policy = RetryPolicy.of(
                sleep(Duration.ofMillis(100)),
                jitter(Duration.ofMillis(10)),
                strategy(BackoffStrategy.EXPONENTIAL)
            );

            assertEquals(Duration.ofMillis(210), policy.delay(1));
            assertEquals(Duration.ofMillis(410), policy.delay(2));
        }

        @Test
        @DisplayName("should default to simple strategy")
        void shouldDefaultToSimpleStrategy() {
            RetryPolicy policy = RetryPolicy.of(sleep(Duration.ofSeconds(1)), jitter(Duration.ofMillis(250)));

            assertEquals(Duration.ofMillis(1250), policy.delay(1));
            assertEquals(Duration.ofMillis(1750), policy.delay(3));
        }
    }

    @Nested
    @DisplayName("isFatal")
    class IsFatal {

        private final RetryPolicy policy = RetryPolicy.of(fatal(ERR_FATAL), fatalOn(IOException.class));

        @Test
        @DisplayName("should match registered value")
        void shouldMatchRegisteredValue() {
            assertTrue(policy.isFatal(ERR_FATAL));
        }

        @Test
        @DisplayName("should match value wrapped as a cause")
        void shouldMatchWrappedValue() {
            RuntimeException wrapped = new RuntimeException("outer", new RuntimeException("middle", ERR_FATAL));

            assertTrue(policy.isFatal(wrapped));
        }

        @Test
        @DisplayName("should not match by message")
        void shouldNotMatchByMessage() {
            assertFalse(policy.isFatal(new IllegalStateException("custom fatal error")));
            assertFalse(policy.isFatal(ERR_FAIL));
        }

        @Test
        @DisplayName("should match registered type anywhere in the chain")
        void shouldMatchRegisteredType() {
            assertTrue(policy.isFatal(new IOException("disk")));
            assertTrue(policy.isFatal(new UncheckedIOException(new IOException("disk"))));
            assertTrue(policy.isFatal(new java.io.FileNotFoundException("subtype")));
        }

        @Test
        @DisplayName("should treat null as non-fatal")
        void shouldTreatNullAsNonFatal() {
            assertFalse(policy.isFatal(null));
        }

        @Test
        @DisplayName("should never be fatal without registrations")
        void shouldNeverBeFatalWithoutRegistrations() {
            assertFalse(RetryPolicy.defaultPolicy().isFatal(ERR_FATAL));
        }
    }

    @Test
    @DisplayName("should allow retry while attempts remain")
    void shouldAllowRetryWhileAttemptsRemain() {
        RetryPolicy policy = RetryPolicy.of(count(3));

        assertTrue(policy.shouldRetry(1));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
        assertFalse(policy.shouldRetry(5));
    }

    @Test
    @DisplayName("should size concurrency from parallelism")
    void shouldSizeConcurrencyFromParallelism() {
        assertThat(RetryPolicy.of(parallelism(2)).concurrencyFor(10)).isEqualTo(2);
        assertThat(RetryPolicy.of(parallelism(20)).concurrencyFor(10)).isEqualTo(10);
        assertThat(RetryPolicy.of().concurrencyFor(10)).isEqualTo(10);
        assertThat(RetryPolicy.of().concurrencyFor(0)).isEqualTo(1);
    }
}
