package com.locai.workflow;

/**
 * Another run of the same conversation has not reached a terminal status yet.
 */
public class WorkflowConflictException extends RuntimeException {

    private final String conversationId;
    private final String activeWorkflowId;

    public WorkflowConflictException(String conversationId, String activeWorkflowId) {
        super("Conversation " + conversationId + " already has an active workflow " + activeWorkflowId);
        this.conversationId = conversationId;
        this.activeWorkflowId = activeWorkflowId;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getActiveWorkflowId() {
        return activeWorkflowId;
    }
}
