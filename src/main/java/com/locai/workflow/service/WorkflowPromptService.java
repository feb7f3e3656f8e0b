package com.locai.workflow.service;

import com.locai.workflow.llm.ModelMessage;
import com.locai.workflow.model.ConversationContext;
import com.locai.workflow.model.ConversationTurn;
import com.locai.workflow.model.PlanStep;
import com.locai.workflow.model.StepStatus;
import com.locai.workflow.model.ToolCall;
import com.locai.workflow.model.ToolResult;
import com.locai.workflow.model.WorkflowPlan;
import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.model.WorkflowStep;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static com.locai.workflow.service.WorkflowConstants.*;

@Service
public class WorkflowPromptService {

    /**
     * System prompt layering: default agent prompt, then the preset prompt, then the replayed history.
     */
    public List<ModelMessage> baseMessages(Collection<String> enabledTools, ConversationContext context) {
        List<ModelMessage> messages = new ArrayList<>();
        String system = DEFAULT_AGENT_PROMPT.formatted(toolList(enabledTools));
        if (StringUtils.hasText(context.presetPrompt())) {
            system = system + "\n" + context.presetPrompt().trim();
        }
        messages.add(ModelMessage.system(system));
        for (ConversationTurn turn : context.history()) {
            if (turn == null || !StringUtils.hasText(turn.content())) {
                continue;
            }
            String role = turn.role() == null ? "" : turn.role().toLowerCase(Locale.ROOT);
            messages.add("assistant".equals(role)
                    ? ModelMessage.assistant(turn.content())
                    : ModelMessage.user(turn.content()));
        }
        return messages;
    }

    public String planningPrompt(String task, Collection<String> availableTools, int maxSteps) {
        return PLANNING_PROMPT.formatted(maxSteps, maxSteps, toolList(availableTools), task);
    }

    public String adjustmentPrompt(String task, WorkflowPlan current, List<WorkflowStep> completed,
                                   List<PlanStep> remaining, String reason, int budget,
                                   Collection<String> availableTools) {
        String done = completed.isEmpty() ? "  (none)" : completed.stream()
                .map(step -> "  - " + step.getPlanStepId() + " [" + step.getStatus().wireName() + "]: "
                        + step.getDescription() + outputSuffix(step))
                .collect(Collectors.joining("\n"));
        return PLAN_ADJUSTMENT_PROMPT.formatted(budget, budget, task, current.goal(), done,
                planStepList(remaining), reason, toolList(availableTools));
    }

    public String stepPrompt(WorkflowPlan plan, PlanStep step, int stepIndex, List<WorkflowStep> previous) {
        String earlier = previous.isEmpty() ? "  (none)" : previous.stream()
                .filter(prior -> prior.getStatus() != StepStatus.SKIPPED)
                .map(prior -> "  - " + prior.getDescription() + " [" + prior.getStatus().wireName() + "]"
                        + outputSuffix(prior))
                .collect(Collectors.joining("\n"));
        String tools = step.expectedTools().isEmpty() ? "(any)" : String.join(", ", step.expectedTools());
        return STEP_PROMPT.formatted(plan.goal(), stepIndex + 1, plan.stepCount(), step.description(),
                step.successCriteria(), tools, earlier);
    }

    public String reflectionPrompt(WorkflowStep step, PlanStep planStep, List<PlanStep> remaining) {
        String results = step.getToolResults().isEmpty() ? "  (no tools used)" : step.getToolResults().stream()
                .map(result -> "  - " + (result.success() ? "[ok] " : "[failed] ") + toolNameFor(step, result)
                        + ": " + JsonProcessingService.truncate(result.success() ? result.content() : result.error(),
                        MAX_RESULT_SNIPPET))
                .collect(Collectors.joining("\n"));
        String output = StringUtils.hasText(step.getOutput()) ? step.getOutput().trim() : "(no output)";
        String status = step.getStatus().wireName() + (step.getError() != null ? " (" + step.getError() + ")" : "");
        return REFLECTION_PROMPT.formatted(step.getDescription(), planStep.successCriteria(), status, results,
                output, remaining.isEmpty() ? "  (no further steps)" : planStepList(remaining));
    }

    public String finalAnswerPrompt(WorkflowState state) {
        String results = state.getSteps().stream()
                .filter(step -> step.getStatus() != StepStatus.SKIPPED)
                .map(this::stepSummary)
                .collect(Collectors.joining("\n\n"));
        return FINAL_ANSWER_PROMPT.formatted(state.getUserMessage(), results.isEmpty() ? "(no steps executed)" : results);
    }

    public String toolResultText(ToolCall call, ToolResult result) {
        return TOOL_RESULT_TEXT_TEMPLATE.formatted(call.name(), result.success() ? "ok" : "failed",
                toolResultContent(result));
    }

    public String toolResultContent(ToolResult result) {
        return result.success() ? result.content() : "Error: " + result.error();
    }

    /**
     * Answer assembled from the step outputs when the final model call is unavailable.
     */
    public String fallbackAnswer(WorkflowState state) {
        String outputs = state.getSteps().stream()
                .filter(step -> StringUtils.hasText(step.getOutput()))
                .map(step -> step.getOutput().trim())
                .collect(Collectors.joining("\n\n"));
        return outputs.isEmpty() ? "The workflow finished without producing an answer." : outputs;
    }

    private String stepSummary(WorkflowStep step) {
        StringBuilder summary = new StringBuilder("### ").append(step.getDescription())
                .append(" [").append(step.getStatus().wireName()).append("]\n");
        if (StringUtils.hasText(step.getOutput())) {
            summary.append(step.getOutput().trim()).append('\n');
        }
        for (ToolResult result : step.getToolResults()) {
            if (result.success()) {
                summary.append("- ").append(toolNameFor(step, result)).append(": ")
                        .append(JsonProcessingService.truncate(result.content(), MAX_FINAL_ANSWER_SNIPPET))
                        .append('\n');
            }
        }
        if (step.getError() != null) {
            summary.append("Error: ").append(step.getError()).append('\n');
        }
        return summary.toString().trim();
    }

    private String toolNameFor(WorkflowStep step, ToolResult result) {
        return step.getToolCalls().stream()
                .filter(call -> call.id().equals(result.callId()))
                .map(ToolCall::name)
                .findFirst()
                .orElse(result.callId());
    }

    private String outputSuffix(WorkflowStep step) {
        return StringUtils.hasText(step.getOutput())
                ? " -> " + JsonProcessingService.truncate(step.getOutput(), MAX_FINAL_ANSWER_SNIPPET)
                : "";
    }

    private String planStepList(List<PlanStep> steps) {
        if (steps.isEmpty()) {
            return "  (none)";
        }
        return steps.stream()
                .map(step -> "  - " + step.id() + ": " + step.description())
                .collect(Collectors.joining("\n"));
    }

    private String toolList(Collection<String> tools) {
        return tools == null || tools.isEmpty() ? "(none)" : String.join(", ", tools);
    }
}
