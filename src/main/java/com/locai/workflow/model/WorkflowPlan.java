package com.locai.workflow.model;

import java.time.Instant;
import java.util.List;

/**
 * An ordered step plan. Adjustments produce a new instance with {@code version + 1}.
 */
public record WorkflowPlan(
        String goal,
        List<PlanStep> steps,
        int maxSteps,
        Instant createdAt,
        int version
) {
    public WorkflowPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static WorkflowPlan initial(String goal, List<PlanStep> steps, int maxSteps, Instant createdAt) {
        return new WorkflowPlan(goal, steps, maxSteps, createdAt, 1);
    }

    public WorkflowPlan nextVersion(String newGoal, List<PlanStep> newSteps, Instant adjustedAt) {
        return new WorkflowPlan(newGoal, newSteps, maxSteps, adjustedAt, version + 1);
    }

    public WorkflowPlan truncatedTo(int limit) {
        if (steps.size() <= limit) {
            return this;
        }
        return new WorkflowPlan(goal, steps.subList(0, Math.max(limit, 0)), maxSteps, createdAt, version);
    }

    public int stepCount() {
        return steps.size();
    }
}
