package com.locai.workflow.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RunContextTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testAwaitReturnsResult() {
        RunContext context = context(new CancellationToken(), Duration.ofSeconds(5));

        assertEquals("pong", context.await("ping", () -> "pong"));
    }

    @Test
    void testAwaitRethrowsRuntimeFailure() {
        RunContext context = context(new CancellationToken(), Duration.ofSeconds(5));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> context.await("boom", () -> {
                    throw new IllegalStateException("boom");
                }));
        assertEquals("boom", ex.getMessage());
    }

    @Test
    void testAwaitWrapsCheckedFailure() {
        RunContext context = context(new CancellationToken(), Duration.ofSeconds(5));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> context.await("read", () -> {
                    throw new java.io.IOException("disk gone");
                }));
        assertEquals("read failed: disk gone", ex.getMessage());
    }

    @Test
    void testCancellationAbandonsPendingCall() throws Exception {
        CancellationToken token = new CancellationToken();
        RunContext context = context(token, Duration.ofSeconds(30));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);

        executor.submit(() -> {
            assertTrue(started.await(5, TimeUnit.SECONDS));
            token.cancel("Cancelled by user");
            return null;
        });

        long begin = System.nanoTime();
        WorkflowInterruptedException ex = assertThrows(WorkflowInterruptedException.class,
                () -> context.await("slow model", () -> {
                    started.countDown();
                    never.await();
                    return "late";
                }));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertEquals(WorkflowInterruptedException.Kind.CANCELLED, ex.getKind());
        assertEquals("Workflow cancelled: Cancelled by user", ex.getMessage());
        assertTrue(elapsedMs < 5_000, "cancellation took " + elapsedMs + " ms");
        never.countDown();
    }

    @Test
    void testRunDeadlineInterruptsPendingCall() {
        RunContext context = context(new CancellationToken(), Duration.ofMillis(150));

        WorkflowInterruptedException ex = assertThrows(WorkflowInterruptedException.class,
                () -> context.await("slow model", () -> {
                    Thread.sleep(10_000);
                    return "late";
                }));

        assertEquals(WorkflowInterruptedException.Kind.TIMED_OUT, ex.getKind());
        assertEquals("Workflow timed out after 150 ms", ex.getMessage());
    }

    @Test
    void testStepDeadlineRaisesStepTimeout() {
        RunContext context = context(new CancellationToken(), Duration.ofSeconds(30));

        assertThrows(StepTimeoutException.class,
                () -> context.await("slow tool", () -> {
                    Thread.sleep(10_000);
                    return "late";
                }, context.stepDeadline(100)));
    }

    @Test
    void testCheckpointOrderPrefersCancellationOverDeadline() {
        Clock fixed = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        CancellationToken token = new CancellationToken();
        RunContext context = new RunContext("wf-1", token, executor, fixed, Duration.ZERO, 5L);
        token.cancel("stop");

        WorkflowInterruptedException ex = assertThrows(WorkflowInterruptedException.class,
                () -> context.checkpoint(fixed.instant()));
        assertEquals(WorkflowInterruptedException.Kind.CANCELLED, ex.getKind());
    }

    @Test
    void testCheckpointPassesWithinBudget() {
        RunContext context = context(new CancellationToken(), Duration.ofSeconds(5));

        assertDoesNotThrow(() -> context.checkpoint(context.stepDeadline(1_000)));
    }

    @Test
    void testTokenKeepsFirstReason() {
        CancellationToken token = new CancellationToken();

        assertTrue(token.cancel("first"));
        assertFalse(token.cancel("second"));
        assertTrue(token.isCancellationRequested());
        assertEquals("first", token.reason());
    }

    private RunContext context(CancellationToken token, Duration timeout) {
        return new RunContext("wf-1", token, executor, Clock.systemUTC(), timeout, 10L);
    }
}
