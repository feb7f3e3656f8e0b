package com.locai.workflow.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReflectionDraft(
        String assessment,
        String nextAction,
        String comment,
        PlanAdjustment planAdjustment,
        String abortReason,
        String reason
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlanAdjustment(String reason, String newGoal) {
    }
}
