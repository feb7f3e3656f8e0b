package com.locai.workflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locai.config.WorkflowProperties;
import com.locai.stream.WorkflowEvent;
import com.locai.workflow.llm.ModelMessage;
import com.locai.workflow.llm.ModelRequest;
import com.locai.workflow.llm.ModelToolCall;
import com.locai.workflow.llm.ScriptedModelClient;
import com.locai.workflow.model.PlanStep;
import com.locai.workflow.model.StepStatus;
import com.locai.workflow.model.ToolCall;
import com.locai.workflow.model.ToolResult;
import com.locai.workflow.model.WorkflowConfig;
import com.locai.workflow.model.WorkflowPlan;
import com.locai.workflow.model.WorkflowStep;
import com.locai.workflow.runtime.CancellationToken;
import com.locai.workflow.runtime.RunContext;
import com.locai.workflow.tools.TextToolCallParser;
import com.locai.workflow.tools.ToolDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StepExecutorTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ScriptedModelClient model = new ScriptedModelClient();
    private final ToolDispatcher toolDispatcher = mock(ToolDispatcher.class);
    private final List<WorkflowEvent> events = new ArrayList<>();
    private final PlanStep planStep = new PlanStep("step-1", "Save the summary", List.of("write_file"),
            List.of(), "File exists");
    private final WorkflowPlan plan = WorkflowPlan.initial("Summarize", List.of(planStep), 5, Instant.now());
    private final WorkflowConfig config = WorkflowConfig.defaults("test-model", List.of("write_file"));

    private StepExecutor stepExecutor;

    @BeforeEach
    void setUp() {
        WorkflowProperties properties = new WorkflowProperties();
        properties.setMaxTurnsPerStep(3);
        when(toolDispatcher.callbacksFor(anyCollection())).thenReturn(List.of());
        when(toolDispatcher.dispatch(anyString(), anyString(), anyMap(), anyCollection()))
                .thenAnswer(invocation -> ToolResult.succeeded(invocation.getArgument(0), "written"));
        stepExecutor = new StepExecutor(model, toolDispatcher, new TextToolCallParser(new ObjectMapper()),
                new WorkflowPromptService(), properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testPlainAnswerFinishesStepWithoutTools() {
        model.on("step", "Nothing to do, the summary already exists.");

        WorkflowStep step = execute();

        assertEquals(StepStatus.SUCCESS, step.getStatus());
        assertEquals("Nothing to do, the summary already exists.", step.getOutput());
        assertTrue(step.getToolCalls().isEmpty());
        assertNotNull(step.getCompletedAt());
    }

    @Test
    void testToolCallsOfOneTurnRunInOrderWithOneResultEach() {
        model.onToolCalls("step",
                        new ModelToolCall("a", "write_file", Map.of("path", "a.txt", "content", "x")),
                        new ModelToolCall("b", "write_file", Map.of("path", "b.txt", "content", "y")))
                .on("step", "Both files written.");

        WorkflowStep step = execute();

        assertEquals(StepStatus.SUCCESS, step.getStatus());
        List<ToolCall> calls = step.getToolCalls();
        assertEquals(2, calls.size());
        assertEquals(0, calls.get(0).callIndex());
        assertEquals(1, calls.get(1).callIndex());
        assertTrue(calls.get(0).id().startsWith("call_"));
        assertNotEquals(calls.get(0).id(), calls.get(1).id());
        assertEquals(List.of(calls.get(0).id(), calls.get(1).id()),
                step.getToolResults().stream().map(ToolResult::callId).toList());
        assertInstanceOf(WorkflowEvent.ToolCallEvent.class, events.get(0));
        assertInstanceOf(WorkflowEvent.ToolResultEvent.class, events.get(1));
        assertInstanceOf(WorkflowEvent.ToolCallEvent.class, events.get(2));
        assertInstanceOf(WorkflowEvent.ToolResultEvent.class, events.get(3));
    }

    @Test
    void testToolCallWrittenAsTextIsRecoveredAndFedBackAsUserMessage() {
        model.on("step", "I will call {\"name\":\"write_file\",\"arguments\":{\"path\":\"notes.md\",\"content\":\"hi\"}}")
                .on("step", "Saved notes.md.");

        WorkflowStep step = execute();

        assertEquals(StepStatus.SUCCESS, step.getStatus());
        assertEquals("write_file", step.getToolCalls().get(0).name());
        assertEquals("notes.md", step.getToolCalls().get(0).arguments().get("path"));
        ModelRequest second = model.requests().get(1);
        ModelMessage fedBack = second.messages().get(second.messages().size() - 1);
        assertEquals(ModelMessage.Role.USER, fedBack.role());
        assertTrue(fedBack.content().contains("written"));
    }

    @Test
    void testTurnLimitFailsStep() {
        model.onToolCalls("step", new ModelToolCall("a", "write_file", Map.of("path", "loop.txt")));

        WorkflowStep step = execute();

        assertEquals(StepStatus.FAILED, step.getStatus());
        assertEquals("Step did not finish within 3 turns", step.getError());
        assertEquals(3, step.getToolCalls().size());
    }

    @Test
    void testModelFailureFailsStepWithRecoverableError() {
        model.on("step", request -> {
            throw new IllegalStateException("context length exceeded");
        });

        WorkflowStep step = execute();

        assertEquals(StepStatus.FAILED, step.getStatus());
        assertEquals("Model call failed: context length exceeded", step.getError());
        WorkflowEvent.ErrorEvent error = assertInstanceOf(WorkflowEvent.ErrorEvent.class, events.get(0));
        assertTrue(error.recoverable());
        assertEquals("step-1", error.stepId());
    }

    @Test
    void testUnknownToolResultIsFedBackNotThrown() {
        when(toolDispatcher.dispatch(anyString(), eq("delete_everything"), anyMap(), anyCollection()))
                .thenAnswer(invocation -> ToolResult.failed(invocation.getArgument(0), "Unknown tool: delete_everything"));
        model.onToolCalls("step", new ModelToolCall("a", "delete_everything", Map.of()))
                .on("step", "I cannot do that.");

        WorkflowStep step = execute();

        assertEquals(StepStatus.SUCCESS, step.getStatus());
        assertFalse(step.getToolResults().get(0).success());
        assertEquals("Unknown tool: delete_everything", step.getToolResults().get(0).error());
    }

    private WorkflowStep execute() {
        RunContext runContext = new RunContext("wf-1", new CancellationToken(), executor, Clock.systemUTC(),
                Duration.ofSeconds(10));
        ModelInvocation invocation = new ModelInvocation("test-model", null, List.of(), runContext);
        WorkflowStep record = WorkflowStep.start(planStep, 0, runContext.now());
        return stepExecutor.executeStep(planStep, record, plan, List.of(), config, invocation, events::add);
    }
}
