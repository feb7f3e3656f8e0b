package com.locai.workflow.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Execution record for one attempted plan step.
 */
@Getter
@Setter
@NoArgsConstructor
public class WorkflowStep {

    private String planStepId;
    private int executionIndex;
    private String description;
    private StepStatus status;
    private List<ToolCall> toolCalls = new ArrayList<>();
    private List<ToolResult> toolResults = new ArrayList<>();
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private StepReflection reflection;
    private String error;
    private String output;

    public static WorkflowStep start(PlanStep planStep, int executionIndex, Instant now) {
        WorkflowStep step = new WorkflowStep();
        step.planStepId = planStep.id();
        step.executionIndex = executionIndex;
        step.description = planStep.description();
        step.status = StepStatus.RUNNING;
        step.startedAt = now;
        return step;
    }

    public static WorkflowStep skipped(PlanStep planStep, int executionIndex, Instant now) {
        WorkflowStep step = start(planStep, executionIndex, now);
        step.finish(StepStatus.SKIPPED, null, now);
        return step;
    }

    public void recordCall(ToolCall call) {
        toolCalls.add(call);
    }

    /**
     * Appends the result for a previously recorded call. A call gets at most one result.
     */
    public void recordResult(ToolResult result) {
        boolean known = toolCalls.stream().anyMatch(call -> call.id().equals(result.callId()));
        if (!known) {
            throw new IllegalStateException("No tool call with id " + result.callId() + " in step " + planStepId);
        }
        boolean duplicate = toolResults.stream().anyMatch(existing -> existing.callId().equals(result.callId()));
        if (duplicate) {
            throw new IllegalStateException("Tool call " + result.callId() + " already has a result");
        }
        toolResults.add(result);
    }

    public void finish(StepStatus finalStatus, String errorMessage, Instant now) {
        this.status = finalStatus;
        this.error = errorMessage;
        this.completedAt = now;
        this.durationMs = startedAt == null ? 0L : Duration.between(startedAt, now).toMillis();
    }

    public boolean hasStatus(StepStatus candidate) {
        return status == candidate;
    }
}
