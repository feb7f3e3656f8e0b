package com.locai.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "workflow_run", indexes = @Index(name = "idx_workflow_run_conversation", columnList = "conversation_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkflowRunRecord {

    @Id
    @Column(name = "id", length = 100)
    private String id;

    @Column(name = "conversation_id", length = 100)
    private String conversationId;

    @Column(name = "goal", columnDefinition = "TEXT")
    private String goal;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "step_count", nullable = false)
    private int stepCount;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "state_json", nullable = false, columnDefinition = "TEXT")
    private String stateJson;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
