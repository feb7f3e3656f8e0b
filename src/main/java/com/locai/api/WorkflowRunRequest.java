package com.locai.api;

import com.locai.workflow.model.ConversationTurn;
import com.locai.workflow.service.PlanDraft;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Starts a workflow run, or resumes an orphaned one when {@code workflowId} is given.
 */
public record WorkflowRunRequest(
        @NotBlank String message,
        String model,
        @Size(max = 100) String conversationId,
        List<String> enabledTools,
        @Min(1) @Max(50) Integer maxSteps,
        Boolean enablePlanning,
        Boolean enableReflection,
        String host,
        List<ConversationTurn> conversationHistory,
        String presetId,
        String workflowId,
        @Min(1000) Long timeoutMs,
        PlanDraft initialPlan
) {
}
