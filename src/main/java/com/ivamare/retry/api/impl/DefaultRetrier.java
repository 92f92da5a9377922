package com.ivamare.retry.api.impl;

import com.ivamare.retry.api.Retrier;
import com.ivamare.retry.exception.ChainFailedException;
import com.ivamare.retry.exception.FailureReason;
import com.ivamare.retry.exception.ParallelFailedException;
import com.ivamare.retry.exception.StepFailedException;
import com.ivamare.retry.listener.AttemptListener;
import com.ivamare.retry.listener.LoggingAttemptListener;
import com.ivamare.retry.model.Operation;
import com.ivamare.retry.model.Step;
import com.ivamare.retry.policy.RetryPolicy;
import com.ivamare.retry.support.Sleeper;
import com.ivamare.retry.support.ThreadSleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default retrier implementation.
 *
 * <p>Retrying happens on the thread running the step and waits with a blocking sleep.
 * Parallel runs put each step on its own worker thread, gated by a semaphore sized to
 * the policy's parallelism. A step the executor rejects runs on the calling thread.
 */
public class DefaultRetrier implements Retrier {

    private static final Logger log = LoggerFactory.getLogger(DefaultRetrier.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

    private final RetryPolicy policy;
    private final AttemptListener listener;
    private final Sleeper sleeper;
    private final ExecutorService executor;

    /**
     * Creates a DefaultRetrier logging failed attempts through SLF4J.
     *
     * @param policy Retry policy
     */
    public DefaultRetrier(RetryPolicy policy) {
        this(policy, new LoggingAttemptListener(), ThreadSleeper.INSTANCE, null);
    }

    /**
     * Creates a DefaultRetrier with injectable collaborators (for testing).
     *
     * @param policy Retry policy
     * @param listener Receiver of failed attempts when the policy is verbose
     * @param sleeper Waits between attempts
     */
    public DefaultRetrier(RetryPolicy policy, AttemptListener listener, Sleeper sleeper) {
        this(policy, listener, sleeper, null);
    }

    /**
     * Creates a DefaultRetrier.
     *
     * @param policy Retry policy
     * @param listener Receiver of failed attempts when the policy is verbose
     * @param sleeper Waits between attempts
     * @param executor Executor for parallel runs, or null for a pool per run
     */
    public DefaultRetrier(
            RetryPolicy policy,
            AttemptListener listener,
            Sleeper sleeper,
            ExecutorService executor) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.listener = Objects.requireNonNull(listener, "listener is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
        this.executor = executor;
    }

    @Override
    public RetryPolicy policy() {
        return policy;
    }

    // --- Single ---

    @Override
    public void single(String name, Operation operation) {
        Objects.requireNonNull(operation, "operation is required");
        call(name, () -> {
            operation.run();
            return null;
        });
    }

    @Override
    public <T> T call(String name, Callable<T> callable) {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(callable, "callable is required");

        Exception lastError = null;
        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            try {
                T result = callable.call();
                if (attempt > 0) {
                    log.debug("Step {} succeeded on attempt {}", name, attempt);
                }
                return result;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw failure(name, attempt + 1, FailureReason.INTERRUPTED, e);
            } catch (Exception e) {
                lastError = e;
            }

            if (policy.isFatal(lastError)) {
                throw failure(name, attempt + 1, FailureReason.FATAL, lastError);
            }

            if (policy.verbose()) {
                notifyListener(name, attempt, lastError);
            }

            if (policy.shouldRetry(attempt + 1)) {
                try {
                    sleeper.sleep(policy.delay(attempt + 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    StepFailedException failure = failure(name, attempt + 1, FailureReason.INTERRUPTED, lastError);
                    failure.addSuppressed(e);
                    throw failure;
                }
            }
        }

        throw failure(name, policy.maxAttempts(), FailureReason.EXHAUSTED, lastError);
    }

    // --- Chain ---

    @Override
    public void chain(List<Step> steps) {
        Objects.requireNonNull(steps, "steps are required");
        log.debug("Running chain of {} steps", steps.size());

        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            try {
                single(step.name(), step.operation());
            } catch (StepFailedException e) {
                log.debug("Chain stopped at step {} ({} of {})", step.name(), i + 1, steps.size());
                throw new ChainFailedException(i, e);
            }
        }
    }

    // --- Parallel ---

    @Override
    public void parallel(List<Step> steps) {
        Objects.requireNonNull(steps, "steps are required");
        if (steps.isEmpty()) {
            return;
        }

        List<Step> tasks = List.copyOf(steps);
        int concurrency = policy.concurrencyFor(tasks.size());
        boolean ownsPool = executor == null;
        ExecutorService pool = ownsPool ? newPool(concurrency) : executor;

        log.debug("Running {} steps in parallel, concurrency={}", tasks.size(), concurrency);

        Semaphore semaphore = new Semaphore(concurrency);
        Queue<StepFailedException> failures = new ConcurrentLinkedQueue<>();
        List<Future<?>> futures = new ArrayList<>(tasks.size());

        try {
            for (Step step : tasks) {
                semaphore.acquireUninterruptibly();
                FutureTask<Void> task = new FutureTask<>(() -> {
                    try {
                        single(step.name(), step.operation());
                    } catch (StepFailedException e) {
                        failures.add(e);
                    } finally {
                        semaphore.release();
                    }
                }, null);
                futures.add(task);
                try {
                    pool.execute(task);
                } catch (RejectedExecutionException e) {
                    log.warn("Executor rejected step {}, running it on the calling thread", step.name());
                    task.run();
                }
            }

            Throwable unexpected = awaitAll(futures);
            if (unexpected instanceof Error error) {
                throw error;
            }
            if (unexpected instanceof RuntimeException runtime) {
                throw runtime;
            }
        } finally {
            if (ownsPool) {
                pool.shutdown();
            }
        }

        if (!failures.isEmpty()) {
            log.debug("Parallel run finished with {} failed of {} steps", failures.size(), tasks.size());
            throw new ParallelFailedException(new ArrayList<>(failures));
        }
    }

    /**
     * Wait for every future without being cancellable, restoring the interrupt flag afterwards.
     *
     * @return the first error that escaped a task, or null
     */
    private static Throwable awaitAll(List<Future<?>> futures) {
        boolean interrupted = false;
        Throwable unexpected = null;
        try {
            for (Future<?> future : futures) {
                while (true) {
                    try {
                        future.get();
                        break;
                    } catch (InterruptedException e) {
                        interrupted = true;
                    } catch (ExecutionException e) {
                        if (unexpected == null) {
                            unexpected = e.getCause();
                        } else if (e.getCause() != unexpected) {
                            unexpected.addSuppressed(e.getCause());
                        }
                        break;
                    }
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        return unexpected;
    }

    private static ExecutorService newPool(int threads) {
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "retry-parallel-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    private void notifyListener(String name, int attempt, Throwable error) {
        try {
            listener.onAttemptFailed(name, attempt, error);
        } catch (RuntimeException e) {
            log.warn("Attempt listener failed for step {}: {}", name, e.getMessage(), e);
        }
    }

    private StepFailedException failure(String name, int attempts, FailureReason reason, Throwable cause) {
        log.debug("Step {} gave up after {} attempt(s), reason={}", name, attempts, reason);
        return new StepFailedException(name, attempts, reason, cause);
    }
}
