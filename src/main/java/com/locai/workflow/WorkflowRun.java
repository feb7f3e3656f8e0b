package com.locai.workflow;

import com.locai.workflow.model.ConversationContext;
import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.runtime.RunContext;
import com.locai.workflow.service.PlanDraft;
import org.springframework.lang.Nullable;

/**
 * Everything the orchestrator needs to drive one run.
 *
 * @param initialPlan plan supplied by the caller, used instead of asking the planner
 * @param resumed     {@code true} when {@code state} was reloaded from a snapshot
 */
public record WorkflowRun(
        WorkflowState state,
        ConversationContext context,
        @Nullable PlanDraft initialPlan,
        boolean resumed,
        RunContext runContext
) {
}
