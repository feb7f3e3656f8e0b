package com.locai.workflow.service;

import com.locai.workflow.llm.ModelClient;
import com.locai.workflow.llm.ModelReply;
import com.locai.workflow.model.Assessment;
import com.locai.workflow.model.NextAction;
import com.locai.workflow.model.PlanStep;
import com.locai.workflow.model.StepReflection;
import com.locai.workflow.model.WorkflowPlan;
import com.locai.workflow.model.WorkflowStep;
import com.locai.workflow.runtime.WorkflowInterruptedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

import static com.locai.workflow.service.WorkflowConstants.PURPOSE_REFLECTION;

/**
 * Assesses a finished step. A failed call or an unreadable answer degrades to
 * {@code partial/continue} instead of ending the run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StepReflector {

    private final ModelClient modelClient;
    private final JsonProcessingService jsonProcessingService;
    private final WorkflowPromptService promptService;

    public StepReflection reflect(WorkflowStep step, WorkflowPlan plan, ModelInvocation invocation) {
        int position = indexOf(plan, step.getPlanStepId());
        PlanStep planStep = position >= 0 ? plan.steps().get(position)
                : new PlanStep(step.getPlanStepId(), step.getDescription(), List.of(), List.of(),
                WorkflowConstants.DEFAULT_SUCCESS_CRITERIA);
        List<PlanStep> remaining = position >= 0
                ? plan.steps().subList(position + 1, plan.stepCount())
                : List.of();
        String prompt = promptService.reflectionPrompt(step, planStep, remaining);

        String response;
        try {
            ModelReply reply = invocation.runContext().await(PURPOSE_REFLECTION,
                    () -> modelClient.chat(invocation.request(PURPOSE_REFLECTION, prompt)));
            response = reply.content();
        } catch (WorkflowInterruptedException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Reflection call failed for step {}: {}", step.getPlanStepId(), ex.getMessage());
            return StepReflection.conservativeDefault("Reflection unavailable: " + ex.getMessage());
        }

        ReflectionDraft draft = jsonProcessingService.parseJsonResponse(PURPOSE_REFLECTION, response,
                ReflectionDraft.class);
        if (draft == null) {
            return StepReflection.conservativeDefault(null);
        }
        Assessment assessment = Assessment.parse(draft.assessment());
        NextAction nextAction = NextAction.parse(draft.nextAction());
        if (assessment == null || nextAction == null) {
            log.warn("Reflection for step {} had unknown values (assessment={}, nextAction={})",
                    step.getPlanStepId(), draft.assessment(), draft.nextAction());
        }
        NextAction action = nextAction != null ? nextAction : NextAction.CONTINUE;
        return new StepReflection(
                assessment != null ? assessment : Assessment.PARTIAL,
                action,
                blankToNull(draft.comment()),
                reasonFor(action, draft),
                false);
    }

    private @Nullable String reasonFor(NextAction action, ReflectionDraft draft) {
        if (action == NextAction.ADJUST_PLAN) {
            String adjustment = draft.planAdjustment() != null ? draft.planAdjustment().reason() : null;
            return firstText(adjustment, draft.reason(), draft.comment(), "The plan no longer fits the results");
        }
        if (action == NextAction.ABORT) {
            return firstText(draft.abortReason(), draft.reason(), draft.comment(), "Aborted after step assessment");
        }
        return null;
    }

    private static int indexOf(WorkflowPlan plan, String stepId) {
        for (int i = 0; i < plan.stepCount(); i++) {
            if (plan.steps().get(i).id().equals(stepId)) {
                return i;
            }
        }
        return -1;
    }

    private static String firstText(String... candidates) {
        for (String candidate : candidates) {
            if (StringUtils.hasText(candidate)) {
                return candidate.trim();
            }
        }
        return "";
    }

    private static @Nullable String blankToNull(@Nullable String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
