package com.locai.workflow.persistence;

import com.locai.entity.WorkflowSnapshotRecord;
import com.locai.repository.WorkflowSnapshotRepository;
import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.service.JsonProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaSnapshotStore implements SnapshotStore {

    private final WorkflowSnapshotRepository snapshotRepository;
    private final JsonProcessingService jsonProcessingService;

    @Override
    @Transactional
    public void save(WorkflowState state) {
        if (!StringUtils.hasText(state.getConversationId())) {
            return;
        }
        snapshotRepository.save(WorkflowSnapshotRecord.builder()
                .conversationId(state.getConversationId())
                .workflowId(state.getId())
                .status(state.getStatus().wireName())
                .stateJson(jsonProcessingService.toJson(state))
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkflowState> load(String conversationId) {
        return snapshotRepository.findById(conversationId)
                .map(record -> {
                    WorkflowState state = jsonProcessingService.fromJson(record.getStateJson(), WorkflowState.class);
                    if (state == null) {
                        log.warn("Snapshot for conversation {} is unreadable", conversationId);
                    }
                    return state;
                });
    }

    @Override
    @Transactional
    public void clear(String conversationId) {
        if (snapshotRepository.existsById(conversationId)) {
            snapshotRepository.deleteById(conversationId);
        }
    }
}
