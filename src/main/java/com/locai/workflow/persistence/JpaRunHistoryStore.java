package com.locai.workflow.persistence;

import com.locai.entity.WorkflowRunRecord;
import com.locai.repository.WorkflowRunRepository;
import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.model.WorkflowStatus;
import com.locai.workflow.model.WorkflowSummary;
import com.locai.workflow.service.JsonProcessingService;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaRunHistoryStore implements RunHistoryStore {

    private static final int MAX_ID_LENGTH = 100;

    private final WorkflowRunRepository runRepository;
    private final JsonProcessingService jsonProcessingService;

    @Override
    @Transactional
    public void append(WorkflowState state) {
        validateId(state.getId());
        if (state.getStatus() == null || !state.getStatus().isTerminal()) {
            throw new IllegalArgumentException("Only finished runs can be added to the history, got status "
                    + state.getStatus());
        }
        runRepository.save(WorkflowRunRecord.builder()
                .id(state.getId())
                .conversationId(state.getConversationId())
                .goal(state.getPlan() != null ? state.getPlan().goal() : state.getUserMessage())
                .status(state.getStatus().wireName())
                .stepCount(state.executedStepCount())
                .startedAt(toOffset(state.getStartedAt()))
                .completedAt(toOffset(state.getCompletedAt()))
                .durationMs(state.getDurationMs())
                .stateJson(jsonProcessingService.toJson(state))
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public List<WorkflowSummary> list(@Nullable String conversationId) {
        List<WorkflowRunRecord> records = StringUtils.hasText(conversationId)
                ? runRepository.findByConversationIdOrderByCreatedAtDesc(conversationId)
                : runRepository.findAllByOrderByCreatedAtDesc();
        return records.stream().map(this::toSummary).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkflowState> find(String workflowId) {
        validateId(workflowId);
        return runRepository.findById(workflowId)
                .map(record -> jsonProcessingService.fromJson(record.getStateJson(), WorkflowState.class));
    }

    @Override
    @Transactional
    public boolean delete(String workflowId) {
        validateId(workflowId);
        if (!runRepository.existsById(workflowId)) {
            return false;
        }
        runRepository.deleteById(workflowId);
        return true;
    }

    private WorkflowSummary toSummary(WorkflowRunRecord record) {
        return new WorkflowSummary(
                record.getId(),
                record.getGoal(),
                record.getConversationId(),
                WorkflowStatus.fromWire(record.getStatus()),
                record.getStepCount(),
                record.getCreatedAt() != null ? record.getCreatedAt().toInstant() : null,
                record.getCompletedAt() != null ? record.getCompletedAt().toInstant() : null,
                record.getDurationMs());
    }

    static void validateId(@Nullable String workflowId) {
        if (!StringUtils.hasText(workflowId) || workflowId.length() > MAX_ID_LENGTH
                || workflowId.contains("/") || workflowId.contains("\\")) {
            throw new IllegalArgumentException("Invalid workflow id");
        }
    }

    private static @Nullable OffsetDateTime toOffset(@Nullable Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }
}
