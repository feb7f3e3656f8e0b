package com.locai.api;

import com.locai.workflow.model.WorkflowState;
import org.springframework.lang.Nullable;

/**
 * Result of the resume check for a conversation.
 *
 * @param resumable a stored non-terminal run exists that no live run owns
 * @param live      a run for the conversation is executing in this process
 */
public record ActiveWorkflowResponse(
        boolean resumable,
        boolean live,
        @Nullable String workflowId,
        @Nullable WorkflowState state
) {
}
