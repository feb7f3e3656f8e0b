package com.locai.workflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locai.workflow.llm.ModelRequest;
import com.locai.workflow.llm.ScriptedModelClient;
import com.locai.workflow.model.PlanStep;
import com.locai.workflow.model.StepStatus;
import com.locai.workflow.model.WorkflowPlan;
import com.locai.workflow.model.WorkflowStep;
import com.locai.workflow.runtime.CancellationToken;
import com.locai.workflow.runtime.RunContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowPlannerTest {

    private static final List<String> TOOLS = List.of("web_search", "write_file");

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final ScriptedModelClient model = new ScriptedModelClient();
    private final WorkflowPlanner planner = new WorkflowPlanner(model,
            new JsonProcessingService(new ObjectMapper()), new WorkflowPromptService());
    private final ModelInvocation invocation = new ModelInvocation("test-model", null, List.of(),
            new RunContext("wf-1", new CancellationToken(), executor, Clock.systemUTC(), Duration.ofSeconds(10)));

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testPlanNormalizesSteps() {
        model.on("plan", """
                {"goal":"Publish a summary","steps":[
                  {"id":"a","description":"Search","expectedTools":["WEB_SEARCH","teleport"]},
                  {"description":"Write","dependsOn":["a","missing"]},
                  {"id":"a","description":"Duplicate id"}]}
                """);

        WorkflowPlan plan = planner.plan("Summarize the news", TOOLS, 5, invocation);

        assertEquals("Publish a summary", plan.goal());
        assertEquals(1, plan.version());
        assertEquals(5, plan.maxSteps());
        assertEquals(List.of("a", "step-2", "step-3"), plan.steps().stream().map(PlanStep::id).toList());
        assertEquals(List.of("web_search"), plan.steps().get(0).expectedTools());
        assertEquals(List.of("a"), plan.steps().get(1).dependsOn());
        assertEquals(WorkflowConstants.DEFAULT_SUCCESS_CRITERIA, plan.steps().get(1).successCriteria());
    }

    @Test
    void testPlanPromptListsToolsAndTask() {
        model.on("plan", "{\"steps\":[]}");

        WorkflowPlan plan = planner.plan("Summarize the news", TOOLS, 4, invocation);

        assertEquals("Summarize the news", plan.goal());
        assertEquals(0, plan.stepCount());
        ModelRequest request = model.requests().get(0);
        String prompt = request.messages().get(request.messages().size() - 1).content();
        assertTrue(prompt.contains("web_search"));
        assertTrue(prompt.contains("Summarize the news"));
        assertTrue(request.tools().isEmpty());
    }

    @Test
    void testInvalidPlanIsAPlanningFailure() {
        model.on("plan", "Sure! First I will search, then write.");

        PlanningException ex = assertThrows(PlanningException.class,
                () -> planner.plan("Summarize the news", TOOLS, 4, invocation));
        assertEquals("Planner returned no valid plan", ex.getMessage());
    }

    @Test
    void testModelFailureIsAPlanningFailure() {
        model.on("plan", request -> {
            throw new IllegalStateException("connection refused");
        });

        PlanningException ex = assertThrows(PlanningException.class,
                () -> planner.plan("Summarize the news", TOOLS, 4, invocation));
        assertTrue(ex.getMessage().contains("connection refused"));
    }

    @Test
    void testAdjustPlanKeepsExecutedPrefixAndBumpsVersion() {
        Instant now = Instant.now();
        WorkflowPlan current = WorkflowPlan.initial("Publish", List.of(
                new PlanStep("step-1", "Search", List.of(), List.of(), "found"),
                new PlanStep("step-2", "Write", List.of(), List.of(), "written"),
                new PlanStep("step-3", "Save", List.of(), List.of(), "saved")), 5, now);
        WorkflowStep executed = WorkflowStep.start(current.steps().get(0), 0, now);
        executed.finish(StepStatus.FAILED, "no results", now);
        model.on("plan-adjustment", """
                {"steps":[{"id":"step-1","description":"Search with other keywords"},
                          {"description":"Write"}]}
                """);

        WorkflowPlan adjusted = planner.adjustPlan(current, List.of(executed), "search failed",
                "Publish the news", TOOLS, invocation);

        assertEquals(2, adjusted.version());
        assertEquals("Publish", adjusted.goal());
        assertSame(current.steps().get(0), adjusted.steps().get(0));
        assertEquals(3, adjusted.stepCount());
        assertEquals("step-2", adjusted.steps().get(1).id());
        assertEquals("Search with other keywords", adjusted.steps().get(1).description());
        assertEquals("step-3", adjusted.steps().get(2).id());
    }

    @Test
    void testSanitizeRenamesReservedIds() {
        List<PlanStep> steps = planner.sanitizeSteps(
                List.of(new PlanDraft.StepDraft("step-2", "Again", null, null, null)),
                TOOLS, Set.of("step-2"), 1);

        assertEquals("step-2-2", steps.get(0).id());
    }

    @Test
    void testSanitizeMapsBareToolNamesToNamespacedTools() {
        List<PlanStep> steps = planner.sanitizeSteps(
                List.of(new PlanDraft.StepDraft("a", "Save", List.of("Write_File"), null, null)),
                List.of("fs.write_file"), Set.of(), 0);

        assertEquals(List.of("fs.write_file"), steps.get(0).expectedTools());
    }
}
