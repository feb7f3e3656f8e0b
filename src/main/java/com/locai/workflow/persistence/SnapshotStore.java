package com.locai.workflow.persistence;

import com.locai.workflow.model.WorkflowState;

import java.util.Optional;

/**
 * Durable latest-state cache keyed by conversation id. Last writer wins.
 */
public interface SnapshotStore {

    void save(WorkflowState state);

    Optional<WorkflowState> load(String conversationId);

    void clear(String conversationId);
}
