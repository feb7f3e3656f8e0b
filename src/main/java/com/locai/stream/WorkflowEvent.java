package com.locai.stream;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.locai.workflow.model.Assessment;
import com.locai.workflow.model.NextAction;
import com.locai.workflow.model.StepStatus;
import com.locai.workflow.model.ToolCall;
import com.locai.workflow.model.ToolResult;
import com.locai.workflow.model.WorkflowConfig;
import com.locai.workflow.model.WorkflowPlan;
import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.model.WorkflowStatus;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * One record of the workflow event stream. Each kind carries its wire {@link #type()} tag;
 * {@link WorkflowEventCodec} writes the tag next to the payload and switches on it when reading.
 */
public sealed interface WorkflowEvent {

    String WORKFLOW_START = "workflow_start";
    String PLAN = "plan";
    String STEP_START = "step_start";
    String TOOL_CALL = "tool_call";
    String TOOL_RESULT = "tool_result";
    String STEP_END = "step_end";
    String REFLECTION = "reflection";
    String MESSAGE = "message";
    String WORKFLOW_END = "workflow_end";
    String ERROR = "error";
    String CANCELLED = "cancelled";
    String STATE_SNAPSHOT = "state_snapshot";

    String type();

    record WorkflowStart(String workflowId, @Nullable String conversationId, Instant timestamp,
                         WorkflowConfig config) implements WorkflowEvent {
        @Override
        public String type() {
            return WORKFLOW_START;
        }
    }

    /**
     * @param truncatedFrom original step count when the plan was cut down to the step budget
     */
    record Plan(WorkflowPlan plan,
                @JsonProperty("isAdjustment") boolean isAdjustment,
                @Nullable String adjustmentReason,
                @Nullable Integer truncatedFrom) implements WorkflowEvent {
        @Override
        public String type() {
            return PLAN;
        }
    }

    record StepStart(String stepId, int stepIndex, int totalSteps, String description,
                     List<String> expectedTools) implements WorkflowEvent {
        @Override
        public String type() {
            return STEP_START;
        }
    }

    record ToolCallEvent(String stepId, int turn, ToolCall call) implements WorkflowEvent {
        @Override
        public String type() {
            return TOOL_CALL;
        }
    }

    record ToolResultEvent(String stepId, ToolResult result) implements WorkflowEvent {
        @Override
        public String type() {
            return TOOL_RESULT;
        }
    }

    record StepEnd(String stepId, int stepIndex, StepStatus status, long durationMs,
                   @Nullable String error) implements WorkflowEvent {
        @Override
        public String type() {
            return STEP_END;
        }
    }

    /**
     * @param overridden {@code true} when the replan bound replaced the model's decision
     */
    record Reflection(String stepId, Assessment assessment, NextAction nextAction, @Nullable String comment,
                      boolean overridden) implements WorkflowEvent {
        @Override
        public String type() {
            return REFLECTION;
        }
    }

    /**
     * A delta of the streamed final answer; the closing record has {@code done=true} and no content.
     */
    record Message(String content, boolean done) implements WorkflowEvent {
        @Override
        public String type() {
            return MESSAGE;
        }
    }

    record WorkflowEnd(String workflowId, WorkflowStatus status, int totalSteps, long durationMs)
            implements WorkflowEvent {
        @Override
        public String type() {
            return WORKFLOW_END;
        }
    }

    record ErrorEvent(String message, boolean recoverable, @Nullable String stepId) implements WorkflowEvent {
        @Override
        public String type() {
            return ERROR;
        }
    }

    record Cancelled(String workflowId, int completedSteps) implements WorkflowEvent {
        @Override
        public String type() {
            return CANCELLED;
        }
    }

    record StateSnapshot(WorkflowState state) implements WorkflowEvent {
        @Override
        public String type() {
            return STATE_SNAPSHOT;
        }
    }
}
