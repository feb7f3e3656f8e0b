package com.locai.workflow.persistence;

import com.locai.workflow.model.StepStatus;
import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.model.WorkflowStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Optional;

/**
 * Snapshot and history bookkeeping for the orchestrator. Storage failures are logged, never thrown,
 * so a broken database cannot keep a run from reaching its terminal event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowPersistenceService {

    private final SnapshotStore snapshotStore;
    private final RunHistoryStore runHistoryStore;
    private final Clock clock;

    public void saveSnapshot(WorkflowState state) {
        if (!StringUtils.hasText(state.getConversationId())) {
            return;
        }
        try {
            snapshotStore.save(state);
        } catch (RuntimeException ex) {
            log.warn("Failed to save snapshot for workflow {}: {}", state.getId(), ex.getMessage());
        }
    }

    /**
     * Returns the stored run of a conversation when it is still planning, executing or reflecting.
     * Any other stored state is cleared.
     */
    public Optional<WorkflowState> checkActiveWorkflow(String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            return Optional.empty();
        }
        Optional<WorkflowState> stored;
        try {
            stored = snapshotStore.load(conversationId);
        } catch (RuntimeException ex) {
            log.warn("Failed to load snapshot for conversation {}: {}", conversationId, ex.getMessage());
            return Optional.empty();
        }
        if (stored.isPresent() && stored.get().getStatus() != null && stored.get().getStatus().isActive()) {
            return stored;
        }
        if (stored.isPresent()) {
            log.debug("Clearing finished snapshot for conversation {}", conversationId);
        }
        clearSnapshot(conversationId);
        return Optional.empty();
    }

    /**
     * Appends a terminal run to the history, then clears its snapshot whether or not the append worked.
     */
    public void persistCompleted(WorkflowState state) {
        try {
            runHistoryStore.append(state);
            log.info("Workflow {} stored in history with status {}", state.getId(), state.getStatus().wireName());
        } catch (RuntimeException ex) {
            log.warn("Failed to append workflow {} to history: {}", state.getId(), ex.getMessage());
        } finally {
            if (StringUtils.hasText(state.getConversationId())) {
                clearSnapshot(state.getConversationId());
            }
        }
    }

    /**
     * Ends an orphaned run as {@code cancelled} and moves it into the history.
     *
     * @return the discarded state, empty when the conversation had no resumable run
     */
    public Optional<WorkflowState> discardActive(String conversationId) {
        Optional<WorkflowState> active = checkActiveWorkflow(conversationId);
        active.ifPresent(state -> {
            state.findRunningStep().ifPresent(step ->
                    step.finish(StepStatus.FAILED, "Run discarded", clock.instant()));
            state.setErrorMessage("Discarded by user");
            state.complete(WorkflowStatus.CANCELLED, clock.instant());
            persistCompleted(state);
        });
        return active;
    }

    private void clearSnapshot(String conversationId) {
        try {
            snapshotStore.clear(conversationId);
        } catch (RuntimeException ex) {
            log.warn("Failed to clear snapshot for conversation {}: {}", conversationId, ex.getMessage());
        }
    }
}
