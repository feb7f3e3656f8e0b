package com.locai.workflow.persistence;

import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.model.WorkflowSummary;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Append-only log of finished runs.
 */
public interface RunHistoryStore {

    /**
     * Stores a run that reached a terminal status.
     *
     * @throws IllegalArgumentException if the state is not terminal or its id is invalid
     */
    void append(WorkflowState state);

    /**
     * Summaries, newest first, optionally limited to one conversation.
     */
    List<WorkflowSummary> list(@Nullable String conversationId);

    Optional<WorkflowState> find(String workflowId);

    boolean delete(String workflowId);
}
