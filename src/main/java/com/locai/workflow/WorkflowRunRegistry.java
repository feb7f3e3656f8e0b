package com.locai.workflow;

import com.locai.workflow.runtime.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs executing in this process, indexed by workflow id and by conversation.
 * At most one live run per conversation is admitted.
 */
@Component
@Slf4j
public class WorkflowRunRegistry {

    private final Map<String, LiveRun> runs = new ConcurrentHashMap<>();
    private final Map<String, String> runsByConversation = new ConcurrentHashMap<>();

    public record LiveRun(String workflowId, @Nullable String conversationId, CancellationToken token,
                          Instant registeredAt) {
    }

    /**
     * @throws WorkflowConflictException if the conversation already has a live run
     */
    public synchronized LiveRun register(String workflowId, @Nullable String conversationId) {
        if (StringUtils.hasText(conversationId)) {
            String existing = runsByConversation.get(conversationId);
            if (existing != null) {
                throw new WorkflowConflictException(conversationId, existing);
            }
            runsByConversation.put(conversationId, workflowId);
        }
        LiveRun run = new LiveRun(workflowId, conversationId, new CancellationToken(), Instant.now());
        runs.put(workflowId, run);
        log.debug("Registered workflow {} (conversation={})", workflowId, conversationId);
        return run;
    }

    public synchronized void unregister(String workflowId) {
        LiveRun run = runs.remove(workflowId);
        if (run != null && run.conversationId() != null) {
            runsByConversation.remove(run.conversationId(), workflowId);
        }
    }

    /**
     * Signals cancellation to a live run.
     *
     * @return {@code false} when no live run has this id
     */
    public boolean cancel(String workflowId, String reason) {
        LiveRun run = runs.get(workflowId);
        if (run == null) {
            return false;
        }
        if (run.token().cancel(reason)) {
            log.info("Cancellation requested for workflow {}: {}", workflowId, reason);
        }
        return true;
    }

    public boolean isLive(String workflowId) {
        return runs.containsKey(workflowId);
    }

    public Optional<String> liveWorkflowFor(@Nullable String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(runsByConversation.get(conversationId));
    }
}
