package com.locai.workflow.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locai.entity.WorkflowSnapshotRecord;
import com.locai.repository.WorkflowSnapshotRepository;
import com.locai.workflow.model.PlanStep;
import com.locai.workflow.model.WorkflowConfig;
import com.locai.workflow.model.WorkflowPlan;
import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.model.WorkflowStatus;
import com.locai.workflow.model.WorkflowStep;
import com.locai.workflow.service.JsonProcessingService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JpaSnapshotStoreTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private final WorkflowSnapshotRepository repository = mock(WorkflowSnapshotRepository.class);
    private final JsonProcessingService jsonProcessingService = new JsonProcessingService(new ObjectMapper()
            .findAndRegisterModules()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    private final JpaSnapshotStore store = new JpaSnapshotStore(repository, jsonProcessingService);

    @Test
    void testSaveStoresRunningStateUnderConversation() {
        WorkflowState state = runningState("conv-1");

        store.save(state);

        ArgumentCaptor<WorkflowSnapshotRecord> captor = ArgumentCaptor.forClass(WorkflowSnapshotRecord.class);
        verify(repository).save(captor.capture());
        WorkflowSnapshotRecord record = captor.getValue();
        assertEquals("conv-1", record.getConversationId());
        assertEquals("wf-1", record.getWorkflowId());
        assertEquals("executing", record.getStatus());
        WorkflowState restored = jsonProcessingService.fromJson(record.getStateJson(), WorkflowState.class);
        assertNotNull(restored);
        assertEquals(1, restored.getPlan().stepCount());
        assertEquals("step-1", restored.getSteps().get(0).getPlanStepId());
    }

    @Test
    void testSaveWithoutConversationIsSkipped() {
        store.save(runningState(null));

        verifyNoInteractions(repository);
    }

    @Test
    void testLoadRestoresStoredState() {
        WorkflowState state = runningState("conv-1");
        when(repository.findById("conv-1")).thenReturn(Optional.of(WorkflowSnapshotRecord.builder()
                .conversationId("conv-1").workflowId("wf-1").status("executing")
                .stateJson(jsonProcessingService.toJson(state)).build()));

        Optional<WorkflowState> loaded = store.load("conv-1");

        assertTrue(loaded.isPresent());
        assertEquals("wf-1", loaded.get().getId());
        assertEquals(WorkflowStatus.EXECUTING, loaded.get().getStatus());
    }

    @Test
    void testUnreadableSnapshotLoadsAsEmpty() {
        when(repository.findById("conv-2")).thenReturn(Optional.of(WorkflowSnapshotRecord.builder()
                .conversationId("conv-2").workflowId("wf-2").status("executing").stateJson("{not json").build()));

        assertEquals(Optional.empty(), store.load("conv-2"));
        assertEquals(Optional.empty(), store.load("conv-3"));
    }

    @Test
    void testClearDeletesOnlyExistingSnapshot() {
        when(repository.existsById("conv-1")).thenReturn(true);
        when(repository.existsById("conv-2")).thenReturn(false);

        store.clear("conv-1");
        store.clear("conv-2");

        verify(repository).deleteById("conv-1");
        verify(repository, never()).deleteById("conv-2");
    }

    private static WorkflowState runningState(String conversationId) {
        WorkflowState state = WorkflowState.create("wf-1", conversationId, "Summarize the notes",
                WorkflowConfig.defaults("test-model", List.of()), START);
        PlanStep step = new PlanStep("step-1", "Read the notes", List.of(), List.of(), "Notes read");
        state.setPlan(WorkflowPlan.initial("Summarize the notes", List.of(step), 5, START));
        state.getSteps().add(WorkflowStep.start(step, 0, START.plusSeconds(1)));
        state.setStatus(WorkflowStatus.EXECUTING);
        return state;
    }
}
