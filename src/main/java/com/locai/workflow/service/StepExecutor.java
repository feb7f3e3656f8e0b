package com.locai.workflow.service;

import com.locai.config.WorkflowProperties;
import com.locai.stream.WorkflowEvent;
import com.locai.stream.WorkflowEventEmitter;
import com.locai.workflow.llm.ModelClient;
import com.locai.workflow.llm.ModelMessage;
import com.locai.workflow.llm.ModelReply;
import com.locai.workflow.llm.ModelRequest;
import com.locai.workflow.llm.ModelToolCall;
import com.locai.workflow.model.PlanStep;
import com.locai.workflow.model.StepStatus;
import com.locai.workflow.model.ToolCall;
import com.locai.workflow.model.ToolResult;
import com.locai.workflow.model.WorkflowConfig;
import com.locai.workflow.model.WorkflowPlan;
import com.locai.workflow.model.WorkflowStep;
import com.locai.workflow.runtime.RunContext;
import com.locai.workflow.runtime.StepTimeoutException;
import com.locai.workflow.runtime.WorkflowInterruptedException;
import com.locai.workflow.tools.TextToolCallParser;
import com.locai.workflow.tools.ToolDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.locai.workflow.service.WorkflowConstants.PURPOSE_STEP;

/**
 * Runs the tool-calling loop of a single plan step. Tool calls of one turn are dispatched one after
 * another and every result, failed or not, is fed back to the model.
 */
@Service
@Slf4j
public class StepExecutor {

    private final ModelClient modelClient;
    private final ToolDispatcher toolDispatcher;
    private final TextToolCallParser textToolCallParser;
    private final WorkflowPromptService promptService;
    private final int maxTurns;

    public StepExecutor(ModelClient modelClient,
                        ToolDispatcher toolDispatcher,
                        TextToolCallParser textToolCallParser,
                        WorkflowPromptService promptService,
                        WorkflowProperties properties) {
        this.modelClient = modelClient;
        this.toolDispatcher = toolDispatcher;
        this.textToolCallParser = textToolCallParser;
        this.promptService = promptService;
        this.maxTurns = Math.max(1, properties.getMaxTurnsPerStep());
    }

    /**
     * Executes {@code planStep}, filling in {@code record} which must already be {@code running}.
     * Cancellation and the run deadline propagate as {@link WorkflowInterruptedException} and leave the
     * record running; the caller finalizes it.
     *
     * @return {@code record}, finished as success or failed
     */
    public WorkflowStep executeStep(PlanStep planStep, WorkflowStep record, WorkflowPlan plan,
                                    List<WorkflowStep> previousSteps, WorkflowConfig config,
                                    ModelInvocation invocation, WorkflowEventEmitter emitter) {
        RunContext runContext = invocation.runContext();
        Instant stepDeadline = runContext.stepDeadline(config.stepTimeoutMs());
        List<ToolCallback> tools = toolDispatcher.callbacksFor(config.enabledTools());
        List<ModelMessage> conversation = new ArrayList<>(invocation.baseMessages());
        conversation.add(ModelMessage.user(promptService.stepPrompt(plan, planStep, record.getExecutionIndex(),
                previousSteps)));
        int callIndex = 0;
        try {
            for (int turn = 1; turn <= maxTurns; turn++) {
                ModelRequest request = invocation.request(PURPOSE_STEP, List.copyOf(conversation), tools);
                ModelReply reply = runContext.await(PURPOSE_STEP, () -> modelClient.chat(request), stepDeadline);

                boolean structured = reply.hasToolCalls();
                List<ModelToolCall> requested = structured
                        ? reply.toolCalls()
                        : textToolCallParser.parse(reply.content(), config.enabledTools());
                if (requested.isEmpty()) {
                    record.setOutput(reply.content());
                    record.finish(StepStatus.SUCCESS, null, runContext.now());
                    return record;
                }

                List<ModelToolCall> identified = requested.stream()
                        .map(call -> new ModelToolCall(newCallId(), call.name(), call.arguments()))
                        .toList();
                conversation.add(structured
                        ? ModelMessage.assistant(reply.content(), identified)
                        : ModelMessage.assistant(reply.content()));

                for (ModelToolCall requestedCall : identified) {
                    runContext.checkpoint(stepDeadline);
                    ToolCall call = new ToolCall(requestedCall.id(), requestedCall.name(), requestedCall.arguments(),
                            planStep.id(), callIndex++, runContext.now());
                    record.recordCall(call);
                    emitter.emit(new WorkflowEvent.ToolCallEvent(planStep.id(), turn, call));

                    ToolResult result = dispatch(call, config, runContext, stepDeadline);
                    record.recordResult(result);
                    emitter.emit(new WorkflowEvent.ToolResultEvent(planStep.id(), result));
                    conversation.add(structured
                            ? ModelMessage.toolResult(call.id(), call.name(), promptService.toolResultContent(result))
                            : ModelMessage.user(promptService.toolResultText(call, result)));
                }
            }
            log.warn("Step {} reached the turn limit of {}", planStep.id(), maxTurns);
            record.finish(StepStatus.FAILED, "Step did not finish within " + maxTurns + " turns", runContext.now());
        } catch (StepTimeoutException ex) {
            log.warn("Step {} timed out after {} ms", planStep.id(), config.stepTimeoutMs());
            record.finish(StepStatus.FAILED, "Step timed out after " + config.stepTimeoutMs() + " ms",
                    runContext.now());
        } catch (WorkflowInterruptedException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            String message = "Model call failed: " + describe(ex);
            log.warn("Step {} failed: {}", planStep.id(), message);
            record.finish(StepStatus.FAILED, message, runContext.now());
            emitter.emit(new WorkflowEvent.ErrorEvent(message, true, planStep.id()));
        }
        return record;
    }

    private ToolResult dispatch(ToolCall call, WorkflowConfig config, RunContext runContext, Instant stepDeadline) {
        try {
            return runContext.await("tool " + call.name(),
                    () -> toolDispatcher.dispatch(call.id(), call.name(), call.arguments(), config.enabledTools()),
                    stepDeadline);
        } catch (WorkflowInterruptedException | StepTimeoutException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Tool dispatch failed: name={}, error={}", call.name(), describe(ex));
            return ToolResult.failed(call.id(), describe(ex));
        }
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private static String newCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
