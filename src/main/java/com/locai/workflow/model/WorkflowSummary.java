package com.locai.workflow.model;

import java.time.Instant;

public record WorkflowSummary(
        String id,
        String goal,
        String conversationId,
        WorkflowStatus status,
        int stepCount,
        Instant createdAt,
        Instant completedAt,
        Long durationMs
) {
}
