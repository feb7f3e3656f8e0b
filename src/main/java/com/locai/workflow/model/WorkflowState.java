package com.locai.workflow.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Full state of one workflow run. Mutated in place by the orchestrator until a terminal
 * status is reached, after which it is persisted as-is.
 */
@Getter
@Setter
@NoArgsConstructor
public class WorkflowState {

    private String id;
    private String conversationId;
    private WorkflowStatus status;
    private String userMessage;
    private WorkflowPlan plan;
    private List<WorkflowStep> steps = new ArrayList<>();
    private int currentStepIndex;
    private int replanCount;
    private WorkflowConfig config;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private String finalAnswer;
    private String errorMessage;

    public static WorkflowState create(String id, String conversationId, String userMessage,
                                       WorkflowConfig config, Instant now) {
        WorkflowState state = new WorkflowState();
        state.id = id;
        state.conversationId = conversationId;
        state.userMessage = userMessage;
        state.config = config;
        state.status = WorkflowStatus.IDLE;
        state.startedAt = now;
        return state;
    }

    public void transitionTo(WorkflowStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal workflow transition " + status.wireName()
                    + " -> " + target.wireName() + " for run " + id);
        }
        this.status = target;
    }

    public void complete(WorkflowStatus terminal, Instant now) {
        transitionTo(terminal);
        this.completedAt = now;
        this.durationMs = Duration.between(startedAt, now).toMillis();
    }

    /**
     * Re-enters an orphaned run. The record of a step interrupted while running is dropped so the
     * step runs again; the run goes back to planning when it has no plan yet, otherwise to executing.
     */
    public void prepareResume() {
        if (status == null || !status.isActive()) {
            throw new IllegalStateException("Run " + id + " is not resumable in status " + status);
        }
        steps.removeIf(step -> step.hasStatus(StepStatus.RUNNING));
        status = plan == null ? WorkflowStatus.PLANNING : WorkflowStatus.EXECUTING;
    }

    public Optional<WorkflowStep> findRunningStep() {
        for (int i = steps.size() - 1; i >= 0; i--) {
            if (steps.get(i).hasStatus(StepStatus.RUNNING)) {
                return Optional.of(steps.get(i));
            }
        }
        return Optional.empty();
    }

    public List<WorkflowStep> finishedSteps() {
        return steps.stream()
                .filter(step -> step.getStatus() == StepStatus.SUCCESS || step.getStatus() == StepStatus.FAILED)
                .toList();
    }

    public int executedStepCount() {
        return (int) steps.stream().filter(step -> step.getStatus() != StepStatus.SKIPPED).count();
    }
}
