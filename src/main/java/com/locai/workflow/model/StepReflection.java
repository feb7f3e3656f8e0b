package com.locai.workflow.model;

import org.springframework.lang.Nullable;

/**
 * Assessment of a finished step and the decision on how to proceed.
 * {@code reason} carries the plan-adjustment or abort reason when the model gave one.
 */
public record StepReflection(
        Assessment assessment,
        NextAction nextAction,
        @Nullable String comment,
        @Nullable String reason,
        boolean overridden
) {
    public static StepReflection implicitSuccess() {
        return new StepReflection(Assessment.SUCCESS, NextAction.CONTINUE, null, null, false);
    }

    public static StepReflection conservativeDefault(@Nullable String comment) {
        return new StepReflection(Assessment.PARTIAL, NextAction.CONTINUE, comment, null, false);
    }

    public StepReflection forceComplete() {
        return new StepReflection(assessment, NextAction.COMPLETE, comment, reason, true);
    }
}
