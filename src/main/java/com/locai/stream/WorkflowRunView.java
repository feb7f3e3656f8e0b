package com.locai.stream;

import com.locai.workflow.model.StepReflection;
import com.locai.workflow.model.StepStatus;
import com.locai.workflow.model.ToolCall;
import com.locai.workflow.model.ToolResult;
import com.locai.workflow.model.WorkflowPlan;
import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.model.WorkflowStatus;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Cumulative view of a run rebuilt purely by folding events in arrival order.
 * No event kind is assumed to occur once, apart from start and end.
 */
@Getter
public class WorkflowRunView implements Consumer<WorkflowEvent> {

    private String workflowId;
    private WorkflowStatus status = WorkflowStatus.IDLE;
    private WorkflowPlan plan;
    private int planAdjustments;
    private final Map<String, StepView> steps = new LinkedHashMap<>();
    @Getter(AccessLevel.NONE)
    private final StringBuilder streamedAnswer = new StringBuilder();
    private String finalAnswer;
    private final List<String> errors = new ArrayList<>();
    private Long durationMs;
    private WorkflowState lastSnapshot;

    @Getter
    public static class StepView {
        private final String stepId;
        private final int stepIndex;
        private final String description;
        private StepStatus status = StepStatus.RUNNING;
        private final List<ToolCall> toolCalls = new ArrayList<>();
        private final List<ToolResult> toolResults = new ArrayList<>();
        private StepReflection reflection;
        private Long durationMs;

        StepView(String stepId, int stepIndex, String description) {
            this.stepId = stepId;
            this.stepIndex = stepIndex;
            this.description = description;
        }
    }

    @Override
    public void accept(WorkflowEvent event) {
        if (event instanceof WorkflowEvent.WorkflowStart start) {
            workflowId = start.workflowId();
            status = WorkflowStatus.PLANNING;
        } else if (event instanceof WorkflowEvent.Plan planEvent) {
            plan = planEvent.plan();
            if (planEvent.isAdjustment()) {
                planAdjustments++;
            }
        } else if (event instanceof WorkflowEvent.StepStart stepStart) {
            status = WorkflowStatus.EXECUTING;
            steps.put(stepStart.stepId(), new StepView(stepStart.stepId(), stepStart.stepIndex(),
                    stepStart.description()));
        } else if (event instanceof WorkflowEvent.ToolCallEvent toolCall) {
            step(toolCall.stepId()).toolCalls.add(toolCall.call());
        } else if (event instanceof WorkflowEvent.ToolResultEvent toolResult) {
            step(toolResult.stepId()).toolResults.add(toolResult.result());
        } else if (event instanceof WorkflowEvent.StepEnd stepEnd) {
            StepView view = step(stepEnd.stepId());
            view.status = stepEnd.status();
            view.durationMs = stepEnd.durationMs();
        } else if (event instanceof WorkflowEvent.Reflection reflection) {
            status = WorkflowStatus.REFLECTING;
            step(reflection.stepId()).reflection = new StepReflection(reflection.assessment(),
                    reflection.nextAction(), reflection.comment(), null, reflection.overridden());
        } else if (event instanceof WorkflowEvent.Message message) {
            status = WorkflowStatus.EXECUTING;
            streamedAnswer.append(message.content());
            if (message.done()) {
                finalAnswer = streamedAnswer.toString();
            }
        } else if (event instanceof WorkflowEvent.ErrorEvent error) {
            errors.add(error.message());
        } else if (event instanceof WorkflowEvent.Cancelled) {
            status = WorkflowStatus.CANCELLED;
        } else if (event instanceof WorkflowEvent.StateSnapshot snapshot) {
            lastSnapshot = snapshot.state();
        } else if (event instanceof WorkflowEvent.WorkflowEnd end) {
            status = end.status();
            durationMs = end.durationMs();
        }
    }

    public String streamedAnswer() {
        return streamedAnswer.toString();
    }

    private StepView step(String stepId) {
        return steps.computeIfAbsent(stepId, id -> new StepView(id, steps.size(), ""));
    }
}
