package com.locai.workflow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowRunRegistryTest {

    private final WorkflowRunRegistry registry = new WorkflowRunRegistry();

    @Test
    void testOneLiveRunPerConversation() {
        registry.register("wf-1", "conv-1");

        WorkflowConflictException ex = assertThrows(WorkflowConflictException.class,
                () -> registry.register("wf-2", "conv-1"));
        assertEquals("wf-1", ex.getActiveWorkflowId());
        assertEquals("wf-1", registry.liveWorkflowFor("conv-1").orElseThrow());
        assertFalse(registry.isLive("wf-2"));
    }

    @Test
    void testRunsWithoutConversationDoNotConflict() {
        registry.register("wf-1", null);
        registry.register("wf-2", null);

        assertTrue(registry.isLive("wf-1"));
        assertTrue(registry.isLive("wf-2"));
        assertTrue(registry.liveWorkflowFor(null).isEmpty());
    }

    @Test
    void testUnregisterFreesConversation() {
        registry.register("wf-1", "conv-1");

        registry.unregister("wf-1");

        assertFalse(registry.isLive("wf-1"));
        assertTrue(registry.liveWorkflowFor("conv-1").isEmpty());
        assertDoesNotThrow(() -> registry.register("wf-2", "conv-1"));
    }

    @Test
    void testCancelSignalsToken() {
        WorkflowRunRegistry.LiveRun run = registry.register("wf-1", "conv-1");

        assertTrue(registry.cancel("wf-1", "Cancelled by user"));
        assertTrue(registry.cancel("wf-1", "again"));

        assertTrue(run.token().isCancellationRequested());
        assertEquals("Cancelled by user", run.token().reason());
        assertFalse(registry.cancel("wf-404", "Cancelled by user"));
    }
}
