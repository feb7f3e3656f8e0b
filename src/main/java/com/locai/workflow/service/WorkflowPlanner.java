package com.locai.workflow.service;

import com.locai.workflow.llm.ModelClient;
import com.locai.workflow.llm.ModelReply;
import com.locai.workflow.model.PlanStep;
import com.locai.workflow.model.WorkflowPlan;
import com.locai.workflow.model.WorkflowStep;
import com.locai.workflow.runtime.StepTimeoutException;
import com.locai.workflow.runtime.WorkflowInterruptedException;
import com.locai.workflow.tools.FilteringToolCallbackProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.locai.workflow.service.WorkflowConstants.*;

/**
 * Turns a task into an ordered step plan and revises plans mid-run. One model call per invocation;
 * a response without a parseable plan is a {@link PlanningException}, never a guessed plan.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowPlanner {

    private final ModelClient modelClient;
    private final JsonProcessingService jsonProcessingService;
    private final WorkflowPromptService promptService;

    public WorkflowPlan plan(String goal, Collection<String> availableTools, int maxSteps, ModelInvocation invocation) {
        String prompt = promptService.planningPrompt(goal, availableTools, maxSteps);
        String response = callModel(PURPOSE_PLAN, prompt, invocation);
        PlanDraft draft = jsonProcessingService.parseJsonResponse(PURPOSE_PLAN, response, PlanDraft.class);
        if (draft == null || draft.steps() == null) {
            throw new PlanningException("Planner returned no valid plan");
        }
        List<PlanStep> steps = sanitizeSteps(draft.steps(), availableTools, Set.of(), 0);
        String planGoal = StringUtils.hasText(draft.goal()) ? draft.goal().trim() : goal;
        log.info("Plan created with {} step(s) for goal: {}", steps.size(), JsonProcessingService.truncate(planGoal, 120));
        return WorkflowPlan.initial(planGoal, steps, maxSteps, invocation.runContext().now());
    }

    /**
     * Produces the next plan version. Steps already executed stay as the unchanged prefix of the new plan;
     * only the not-yet-executed part is replaced.
     *
     * @param completedSteps execution records of every step processed so far, in plan order
     */
    public WorkflowPlan adjustPlan(WorkflowPlan currentPlan, List<WorkflowStep> completedSteps, String reason,
                                   String task, Collection<String> availableTools, ModelInvocation invocation) {
        int executed = Math.min(completedSteps.size(), currentPlan.stepCount());
        List<PlanStep> prefix = currentPlan.steps().subList(0, executed);
        List<PlanStep> remaining = currentPlan.steps().subList(executed, currentPlan.stepCount());
        int budget = Math.max(currentPlan.maxSteps() - executed, 0);
        String prompt = promptService.adjustmentPrompt(task, currentPlan, completedSteps, remaining, reason, budget,
                availableTools);
        String response = callModel(PURPOSE_PLAN_ADJUSTMENT, prompt, invocation);
        PlanDraft draft = jsonProcessingService.parseJsonResponse(PURPOSE_PLAN_ADJUSTMENT, response, PlanDraft.class);
        if (draft == null || draft.steps() == null) {
            throw new PlanningException("Planner returned no valid plan adjustment");
        }
        Set<String> reserved = prefix.stream().map(PlanStep::id).collect(Collectors.toSet());
        List<PlanStep> replacement = sanitizeSteps(draft.steps(), availableTools, reserved, executed);
        List<PlanStep> steps = new ArrayList<>(prefix);
        steps.addAll(replacement);
        String goal = StringUtils.hasText(draft.goal()) ? draft.goal().trim() : currentPlan.goal();
        log.info("Plan adjusted to version {}: {} remaining step(s). Reason: {}", currentPlan.version() + 1,
                replacement.size(), JsonProcessingService.truncate(reason, 160));
        return currentPlan.nextVersion(goal, steps, invocation.runContext().now());
    }

    /**
     * Normalizes a plan supplied by the caller instead of asking the model.
     */
    public WorkflowPlan normalizeExternalPlan(PlanDraft draft, String task, Collection<String> availableTools,
                                              int maxSteps, ModelInvocation invocation) {
        if (draft == null || draft.steps() == null) {
            throw new PlanningException("Supplied plan has no steps array");
        }
        List<PlanStep> steps = sanitizeSteps(draft.steps(), availableTools, Set.of(), 0);
        String goal = StringUtils.hasText(draft.goal()) ? draft.goal().trim() : task;
        return WorkflowPlan.initial(goal, steps, maxSteps, invocation.runContext().now());
    }

    private String callModel(String purpose, String prompt, ModelInvocation invocation) {
        try {
            ModelReply reply = invocation.runContext().await(purpose,
                    () -> modelClient.chat(invocation.request(purpose, prompt)));
            return reply.content();
        } catch (WorkflowInterruptedException | StepTimeoutException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new PlanningException("Planner call failed: " + ex.getMessage(), ex);
        }
    }

    List<PlanStep> sanitizeSteps(List<PlanDraft.StepDraft> drafts, Collection<String> availableTools,
                                 Set<String> reservedIds, int indexOffset) {
        Set<String> used = new HashSet<>(reservedIds);
        List<PlanStep> steps = new ArrayList<>();
        for (PlanDraft.StepDraft draft : drafts) {
            if (draft == null) {
                continue;
            }
            int number = indexOffset + steps.size() + 1;
            String id = uniqueId(StringUtils.hasText(draft.id()) ? draft.id().trim() : STEP_PREFIX + number, number, used);
            String description = StringUtils.hasText(draft.description()) ? draft.description().trim() : "Step " + number;
            List<String> expectedTools = filterTools(draft.expectedTools(), availableTools);
            List<String> dependsOn = draft.dependsOn() == null ? List.of() : draft.dependsOn().stream()
                    .filter(dep -> dep != null && used.contains(dep.trim()) && !dep.trim().equals(id))
                    .map(String::trim)
                    .distinct()
                    .toList();
            String criteria = StringUtils.hasText(draft.successCriteria())
                    ? draft.successCriteria().trim()
                    : DEFAULT_SUCCESS_CRITERIA;
            used.add(id);
            steps.add(new PlanStep(id, description, expectedTools, dependsOn, criteria));
        }
        return steps;
    }

    private String uniqueId(String candidate, int number, Set<String> used) {
        if (!used.contains(candidate)) {
            return candidate;
        }
        String fallback = STEP_PREFIX + number;
        int suffix = 2;
        while (used.contains(fallback)) {
            fallback = STEP_PREFIX + number + "-" + suffix++;
        }
        return fallback;
    }

    private List<String> filterTools(@Nullable List<String> requested, Collection<String> availableTools) {
        if (requested == null) {
            return List.of();
        }
        Set<String> filtered = new LinkedHashSet<>();
        for (String tool : requested) {
            FilteringToolCallbackProvider.resolve(tool, availableTools).ifPresent(filtered::add);
        }
        return List.copyOf(filtered);
    }
}
