package com.locai.workflow.runtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Carries the cancellation token and deadlines of one run into every suspending call.
 * <p>
 * Model calls and tool dispatches go through {@link #await}, which runs them on the worker
 * executor and waits in short slices. When cancellation or a deadline is observed the call
 * is abandoned: it is not interrupted, its result is simply never used.
 */
@Slf4j
public final class RunContext {

    private static final long DEFAULT_POLL_INTERVAL_MS = 50L;

    private final String workflowId;
    private final CancellationToken token;
    private final ExecutorService executor;
    private final Clock clock;
    private final Instant deadline;
    private final long budgetMs;
    private final long pollIntervalMs;

    public RunContext(String workflowId, CancellationToken token, ExecutorService executor,
                      Clock clock, Duration timeout) {
        this(workflowId, token, executor, clock, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    RunContext(String workflowId, CancellationToken token, ExecutorService executor,
               Clock clock, Duration timeout, long pollIntervalMs) {
        this.workflowId = workflowId;
        this.token = token;
        this.executor = executor;
        this.clock = clock;
        this.deadline = clock.instant().plus(timeout);
        this.budgetMs = timeout.toMillis();
        this.pollIntervalMs = pollIntervalMs;
    }

    public String workflowId() {
        return workflowId;
    }

    public CancellationToken token() {
        return token;
    }

    public Instant now() {
        return clock.instant();
    }

    public Instant deadline() {
        return deadline;
    }

    public Instant stepDeadline(long stepTimeoutMs) {
        return now().plusMillis(stepTimeoutMs);
    }

    public void checkpoint() {
        checkpoint(null);
    }

    /**
     * Throws if the run was cancelled, the run deadline passed, or the given step deadline passed,
     * checked in that order.
     */
    public void checkpoint(@Nullable Instant stepDeadline) {
        if (token.isCancellationRequested()) {
            throw WorkflowInterruptedException.cancelled("Workflow cancelled: " + token.reason());
        }
        Instant now = clock.instant();
        if (!now.isBefore(deadline)) {
            throw WorkflowInterruptedException.timedOut("Workflow timed out after " + budgetMs + " ms");
        }
        if (stepDeadline != null && !now.isBefore(stepDeadline)) {
            throw new StepTimeoutException("Step budget exhausted");
        }
    }

    public <T> T await(String label, Callable<T> call) {
        return await(label, call, null);
    }

    public <T> T await(String label, Callable<T> call, @Nullable Instant stepDeadline) {
        checkpoint(stepDeadline);
        Future<T> future = executor.submit(call);
        try {
            while (true) {
                try {
                    return future.get(nextWaitMillis(stepDeadline), TimeUnit.MILLISECONDS);
                } catch (TimeoutException slice) {
                    abandonIfInterrupted(label, future, stepDeadline);
                }
            }
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(label + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            token.cancel("Worker thread interrupted");
            throw WorkflowInterruptedException.cancelled("Workflow cancelled while waiting for " + label);
        }
    }

    private void abandonIfInterrupted(String label, Future<?> future, @Nullable Instant stepDeadline) {
        try {
            checkpoint(stepDeadline);
        } catch (RuntimeException stop) {
            future.cancel(false);
            log.debug("Abandoned {} for workflow {}: {}", label, workflowId, stop.getMessage());
            throw stop;
        }
    }

    private long nextWaitMillis(@Nullable Instant stepDeadline) {
        Instant limit = deadline;
        if (stepDeadline != null && stepDeadline.isBefore(limit)) {
            limit = stepDeadline;
        }
        long remaining = Duration.between(clock.instant(), limit).toMillis();
        return Math.max(1L, Math.min(pollIntervalMs, remaining));
    }
}
