package com.locai.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locai.workflow.model.Assessment;
import com.locai.workflow.model.NextAction;
import com.locai.workflow.model.PlanStep;
import com.locai.workflow.model.StepStatus;
import com.locai.workflow.model.WorkflowPlan;
import com.locai.workflow.model.WorkflowStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowEventCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final WorkflowEventCodec codec = new WorkflowEventCodec(objectMapper);

    @Test
    void testEncodeWritesTypeTagAndWireNames() throws Exception {
        String line = codec.encode(new WorkflowEvent.StepEnd("step-1", 0, StepStatus.FAILED, 120L, "Tool failed"));

        assertFalse(line.contains("\n"));
        JsonNode node = objectMapper.readTree(line);
        assertEquals("step_end", node.get("type").asText());
        assertEquals("failed", node.get("status").asText());
        assertEquals("Tool failed", node.get("error").asText());
    }

    @Test
    void testNullFieldsAreOmitted() throws Exception {
        JsonNode node = objectMapper.readTree(codec.encode(new WorkflowEvent.ErrorEvent("boom", false, null)));

        assertFalse(node.has("stepId"));
        assertFalse(node.get("recoverable").asBoolean());
    }

    @Test
    void testPlanEventKeepsAdjustmentFlag() throws Exception {
        WorkflowPlan plan = WorkflowPlan.initial("Goal", List.of(
                new PlanStep("step-1", "Search", List.of("web_search"), List.of(), "Found")), 5,
                Instant.parse("2026-03-01T10:00:00Z"));

        String line = codec.encode(new WorkflowEvent.Plan(plan, true, "New sources needed", null));
        WorkflowEvent decoded = codec.decode(line);

        assertTrue(objectMapper.readTree(line).get("isAdjustment").asBoolean());
        WorkflowEvent.Plan planEvent = assertInstanceOf(WorkflowEvent.Plan.class, decoded);
        assertTrue(planEvent.isAdjustment());
        assertEquals("New sources needed", planEvent.adjustmentReason());
        assertEquals("step-1", planEvent.plan().steps().get(0).id());
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), planEvent.plan().createdAt());
    }

    @Test
    void testDecodeReflectionAndEnd() {
        WorkflowEvent reflection = codec.decode("{\"type\":\"reflection\",\"stepId\":\"step-1\","
                + "\"assessment\":\"partial\",\"nextAction\":\"adjust_plan\",\"overridden\":false}");
        WorkflowEvent end = codec.decode("{\"type\":\"workflow_end\",\"workflowId\":\"wf-1\",\"status\":\"timeout\","
                + "\"totalSteps\":2,\"durationMs\":900}");

        WorkflowEvent.Reflection reflectionEvent = assertInstanceOf(WorkflowEvent.Reflection.class, reflection);
        assertEquals(Assessment.PARTIAL, reflectionEvent.assessment());
        assertEquals(NextAction.ADJUST_PLAN, reflectionEvent.nextAction());
        assertEquals(WorkflowStatus.TIMEOUT, ((WorkflowEvent.WorkflowEnd) end).status());
    }

    @Test
    void testMalformedLinesAreRejected() {
        assertThrows(MalformedEventException.class, () -> codec.decode(""));
        assertThrows(MalformedEventException.class, () -> codec.decode("{not json"));
        assertThrows(MalformedEventException.class, () -> codec.decode("[1,2]"));
        assertThrows(MalformedEventException.class, () -> codec.decode("{\"stepId\":\"step-1\"}"));
        MalformedEventException unknown = assertThrows(MalformedEventException.class,
                () -> codec.decode("{\"type\":\"heartbeat\"}"));
        assertEquals("Unknown event type: heartbeat", unknown.getMessage());
        assertThrows(MalformedEventException.class,
                () -> codec.decode("{\"type\":\"workflow_end\",\"status\":\"exploded\"}"));
    }
}
