package com.locai.workflow.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowStateTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private final PlanStep first = new PlanStep("step-1", "Search", List.of(), List.of(), "Found");
    private final PlanStep second = new PlanStep("step-2", "Write", List.of(), List.of(), "Written");

    @Test
    void testCreateStartsIdle() {
        WorkflowState state = newState();

        assertEquals(WorkflowStatus.IDLE, state.getStatus());
        assertEquals(START, state.getStartedAt());
        assertTrue(state.getSteps().isEmpty());
        assertNull(state.getCompletedAt());
    }

    @Test
    void testIllegalTransitionIsRejected() {
        WorkflowState state = newState();

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> state.transitionTo(WorkflowStatus.DONE));
        assertEquals("Illegal workflow transition idle -> done for run wf-1", ex.getMessage());
        assertEquals(WorkflowStatus.IDLE, state.getStatus());
    }

    @Test
    void testCompleteRecordsDuration() {
        WorkflowState state = newState();
        state.transitionTo(WorkflowStatus.PLANNING);
        state.transitionTo(WorkflowStatus.EXECUTING);

        state.complete(WorkflowStatus.DONE, START.plusMillis(2_500));

        assertEquals(WorkflowStatus.DONE, state.getStatus());
        assertEquals(2_500L, state.getDurationMs());
        assertEquals(START.plusMillis(2_500), state.getCompletedAt());
    }

    @Test
    void testPrepareResumeDropsInterruptedStep() {
        WorkflowState state = newState();
        state.transitionTo(WorkflowStatus.PLANNING);
        state.setPlan(WorkflowPlan.initial("Goal", List.of(first, second), 5, START));
        state.transitionTo(WorkflowStatus.EXECUTING);
        WorkflowStep done = WorkflowStep.start(first, 0, START);
        done.finish(StepStatus.SUCCESS, null, START.plusSeconds(1));
        state.getSteps().add(done);
        state.getSteps().add(WorkflowStep.start(second, 1, START.plusSeconds(1)));
        state.transitionTo(WorkflowStatus.REFLECTING);

        state.prepareResume();

        assertEquals(WorkflowStatus.EXECUTING, state.getStatus());
        assertEquals(1, state.getSteps().size());
        assertTrue(state.findRunningStep().isEmpty());
    }

    @Test
    void testPrepareResumeWithoutPlanReturnsToPlanning() {
        WorkflowState state = newState();
        state.transitionTo(WorkflowStatus.PLANNING);

        state.prepareResume();

        assertEquals(WorkflowStatus.PLANNING, state.getStatus());
    }

    @Test
    void testPrepareResumeRejectsFinishedRun() {
        WorkflowState state = newState();
        state.complete(WorkflowStatus.CANCELLED, START);

        assertThrows(IllegalStateException.class, state::prepareResume);
    }

    @Test
    void testExecutedStepCountIgnoresSkippedSteps() {
        WorkflowState state = newState();
        WorkflowStep done = WorkflowStep.start(first, 0, START);
        done.finish(StepStatus.FAILED, "Tool failed", START);
        state.getSteps().add(done);
        state.getSteps().add(WorkflowStep.skipped(second, 1, START));

        assertEquals(1, state.executedStepCount());
        assertEquals(1, state.finishedSteps().size());
    }

    @Test
    void testToolResultsMatchRecordedCalls() {
        WorkflowStep step = WorkflowStep.start(first, 0, START);
        step.recordCall(new ToolCall("call-1", "web_search", Map.of("query", "x"), "step-1", 0, START));

        step.recordResult(ToolResult.succeeded("call-1", "3 hits"));

        assertThrows(IllegalStateException.class, () -> step.recordResult(ToolResult.succeeded("call-1", "again")));
        assertThrows(IllegalStateException.class, () -> step.recordResult(ToolResult.failed("call-9", "boom")));
        assertEquals(1, step.getToolResults().size());
    }

    @Test
    void testFailedResultGetsDefaultMessage() {
        ToolResult result = ToolResult.failed("call-1", " ");

        assertFalse(result.success());
        assertEquals("Tool execution failed", result.error());
    }

    private WorkflowState newState() {
        return WorkflowState.create("wf-1", "conv-1", "Write a summary",
                WorkflowConfig.defaults("test-model", List.of()), START);
    }
}
