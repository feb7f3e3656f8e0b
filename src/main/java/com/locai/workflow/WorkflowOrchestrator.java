package com.locai.workflow;

import com.locai.stream.WorkflowEvent;
import com.locai.stream.WorkflowEventEmitter;
import com.locai.workflow.model.NextAction;
import com.locai.workflow.model.PlanStep;
import com.locai.workflow.model.StepReflection;
import com.locai.workflow.model.StepStatus;
import com.locai.workflow.model.WorkflowConfig;
import com.locai.workflow.model.WorkflowPlan;
import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.model.WorkflowStatus;
import com.locai.workflow.model.WorkflowStep;
import com.locai.workflow.persistence.WorkflowPersistenceService;
import com.locai.workflow.runtime.RunContext;
import com.locai.workflow.runtime.WorkflowInterruptedException;
import com.locai.workflow.service.FinalAnswerSynthesizer;
import com.locai.workflow.service.JsonProcessingService;
import com.locai.workflow.service.ModelInvocation;
import com.locai.workflow.service.StepExecutor;
import com.locai.workflow.service.StepReflector;
import com.locai.workflow.service.WorkflowPlanner;
import com.locai.workflow.service.WorkflowPromptService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static com.locai.workflow.service.WorkflowConstants.DEFAULT_SUCCESS_CRITERIA;
import static com.locai.workflow.service.WorkflowConstants.IMPLICIT_STEP_ID;

/**
 * Drives one run through planning, step execution and reflection until it reaches a terminal status.
 * <p>
 * Steps run strictly one after another on the calling thread. Whatever happens inside, the run ends
 * with its terminal events in this order: {@code error} or {@code cancelled}, {@code state_snapshot},
 * {@code workflow_end}. The terminal state is then handed to the history store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowOrchestrator {

    private final WorkflowPlanner planner;
    private final StepExecutor stepExecutor;
    private final StepReflector reflector;
    private final FinalAnswerSynthesizer finalAnswerSynthesizer;
    private final WorkflowPromptService promptService;
    private final WorkflowPersistenceService persistenceService;
    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong stepCount = new AtomicLong();

    /**
     * Number of plan steps started by this orchestrator since startup, across all runs.
     */
    public long stepsStarted() {
        return stepCount.get();
    }

    public WorkflowState run(WorkflowRun run, WorkflowEventEmitter emitter) {
        WorkflowState state = run.state();
        RunContext runContext = run.runContext();
        WorkflowConfig config = state.getConfig();
        ModelInvocation invocation = new ModelInvocation(config.model(), config.host(),
                promptService.baseMessages(config.enabledTools(), run.context()), runContext);

        log.info("Workflow {} {} (conversation={}, model={}, tools={}). Total runs={}.", state.getId(),
                run.resumed() ? "resumed" : "started", state.getConversationId(), config.model(),
                config.enabledTools().size(), runCount.incrementAndGet());
        emitter.emit(new WorkflowEvent.WorkflowStart(state.getId(), state.getConversationId(),
                runContext.now(), config));
        if (run.resumed()) {
            emitter.emit(new WorkflowEvent.StateSnapshot(state));
        }

        try {
            if (state.getStatus() == WorkflowStatus.IDLE) {
                state.transitionTo(WorkflowStatus.PLANNING);
            }
            if (state.getStatus() == WorkflowStatus.PLANNING) {
                establishPlan(run, invocation, emitter);
                state.transitionTo(WorkflowStatus.EXECUTING);
                syncPoint(state, emitter);
            }
            executePlan(state, invocation, emitter);

            runContext.checkpoint();
            String answer = finalAnswerSynthesizer.synthesize(state, invocation, emitter);
            state.setFinalAnswer(answer);
            state.complete(WorkflowStatus.DONE, runContext.now());
        } catch (WorkflowInterruptedException ex) {
            handleInterruption(state, ex, runContext.now(), emitter);
        } catch (RuntimeException ex) {
            handleFailure(state, ex, runContext.now(), emitter);
        }

        emitter.emit(new WorkflowEvent.StateSnapshot(state));
        persistenceService.persistCompleted(state);
        emitter.emit(new WorkflowEvent.WorkflowEnd(state.getId(), state.getStatus(), state.executedStepCount(),
                state.getDurationMs() != null ? state.getDurationMs() : 0L));
        log.info("Workflow {} finished with status {} after {} step(s) in {} ms.", state.getId(),
                state.getStatus().wireName(), state.executedStepCount(), state.getDurationMs());
        return state;
    }

    private void establishPlan(WorkflowRun run, ModelInvocation invocation, WorkflowEventEmitter emitter) {
        WorkflowState state = run.state();
        WorkflowConfig config = state.getConfig();
        Instant now = invocation.runContext().now();

        if (!config.enablePlanning() && run.initialPlan() == null) {
            PlanStep implicit = new PlanStep(IMPLICIT_STEP_ID, state.getUserMessage(), List.of(), List.of(),
                    DEFAULT_SUCCESS_CRITERIA);
            state.setPlan(WorkflowPlan.initial(state.getUserMessage(), List.of(implicit), config.maxSteps(), now));
            log.debug("Planning disabled for workflow {}, running the task as one step", state.getId());
            return;
        }

        WorkflowPlan plan = run.initialPlan() != null
                ? planner.normalizeExternalPlan(run.initialPlan(), state.getUserMessage(), config.enabledTools(),
                config.maxSteps(), invocation)
                : planner.plan(state.getUserMessage(), config.enabledTools(), config.maxSteps(), invocation);
        Integer truncatedFrom = null;
        if (plan.stepCount() > config.maxSteps()) {
            truncatedFrom = plan.stepCount();
            plan = plan.truncatedTo(config.maxSteps());
            log.info("Plan for workflow {} truncated from {} to {} step(s)", state.getId(), truncatedFrom,
                    config.maxSteps());
        }
        state.setPlan(plan);
        emitter.emit(new WorkflowEvent.Plan(plan, false, null, truncatedFrom));
    }

    private void executePlan(WorkflowState state, ModelInvocation invocation, WorkflowEventEmitter emitter) {
        RunContext runContext = invocation.runContext();
        WorkflowConfig config = state.getConfig();

        while (state.getCurrentStepIndex() < state.getPlan().stepCount()) {
            runContext.checkpoint();
            if (state.executedStepCount() >= config.maxSteps()) {
                log.info("Workflow {} reached its step budget of {}", state.getId(), config.maxSteps());
                skipRemaining(state, runContext.now());
                return;
            }
            WorkflowPlan plan = state.getPlan();
            int index = state.getCurrentStepIndex();
            PlanStep planStep = plan.steps().get(index);
            List<WorkflowStep> previous = state.finishedSteps();

            WorkflowStep record = WorkflowStep.start(planStep, state.getSteps().size(), runContext.now());
            state.getSteps().add(record);
            long totalSteps = stepCount.incrementAndGet();
            emitter.emit(new WorkflowEvent.StepStart(planStep.id(), index, plan.stepCount(),
                    planStep.description(), planStep.expectedTools()));

            stepExecutor.executeStep(planStep, record, plan, previous, config, invocation, emitter);
            state.setCurrentStepIndex(index + 1);
            emitter.emit(new WorkflowEvent.StepEnd(planStep.id(), index, record.getStatus(),
                    durationOf(record), record.getError()));
            log.info("Step {} of workflow {} ended {} in {} ms. Total steps={}.", planStep.id(), state.getId(),
                    record.getStatus().wireName(), durationOf(record), totalSteps);

            StepReflection reflection = assess(state, record, invocation, emitter);
            boolean finished = applyDecision(state, reflection, invocation, emitter);
            syncPoint(state, emitter);
            if (finished) {
                return;
            }
        }
    }

    private StepReflection assess(WorkflowState state, WorkflowStep record, ModelInvocation invocation,
                                  WorkflowEventEmitter emitter) {
        WorkflowConfig config = state.getConfig();
        if (!config.enableReflection()) {
            StepReflection implicit = StepReflection.implicitSuccess();
            record.setReflection(implicit);
            return implicit;
        }
        state.transitionTo(WorkflowStatus.REFLECTING);
        StepReflection reflection = reflector.reflect(record, state.getPlan(), invocation);
        if (reflection.nextAction() == NextAction.ADJUST_PLAN && state.getReplanCount() >= config.maxRePlans()) {
            log.info("Workflow {} used all {} plan adjustment(s), completing instead", state.getId(),
                    config.maxRePlans());
            reflection = reflection.forceComplete();
        }
        record.setReflection(reflection);
        emitter.emit(new WorkflowEvent.Reflection(record.getPlanStepId(), reflection.assessment(),
                reflection.nextAction(), reflection.comment(), reflection.overridden()));
        return reflection;
    }

    /**
     * @return {@code true} when no further plan steps should run
     */
    private boolean applyDecision(WorkflowState state, StepReflection reflection, ModelInvocation invocation,
                                  WorkflowEventEmitter emitter) {
        switch (reflection.nextAction()) {
            case ADJUST_PLAN -> {
                state.transitionTo(WorkflowStatus.PLANNING);
                state.setReplanCount(state.getReplanCount() + 1);
                adjustPlan(state, reflection.reason(), invocation, emitter);
                state.transitionTo(WorkflowStatus.EXECUTING);
                return false;
            }
            case COMPLETE -> {
                resumeExecuting(state);
                skipRemaining(state, invocation.runContext().now());
                return true;
            }
            case ABORT -> throw new WorkflowAbortedException(reflection.reason() != null && !reflection.reason().isBlank()
                    ? reflection.reason()
                    : "no reason given");
            default -> {
                resumeExecuting(state);
                return false;
            }
        }
    }

    private void adjustPlan(WorkflowState state, @Nullable String reason, ModelInvocation invocation,
                            WorkflowEventEmitter emitter) {
        WorkflowConfig config = state.getConfig();
        String adjustmentReason = reason != null ? reason : "";
        WorkflowPlan adjusted = planner.adjustPlan(state.getPlan(), state.finishedSteps(), adjustmentReason,
                state.getUserMessage(), config.enabledTools(), invocation);
        Integer truncatedFrom = null;
        if (adjusted.stepCount() > config.maxSteps()) {
            truncatedFrom = adjusted.stepCount();
            adjusted = adjusted.truncatedTo(config.maxSteps());
        }
        state.setPlan(adjusted);
        state.setCurrentStepIndex(Math.min(state.getCurrentStepIndex(), adjusted.stepCount()));
        emitter.emit(new WorkflowEvent.Plan(adjusted, true, adjustmentReason, truncatedFrom));
    }

    private void resumeExecuting(WorkflowState state) {
        if (state.getStatus() == WorkflowStatus.REFLECTING) {
            state.transitionTo(WorkflowStatus.EXECUTING);
        }
    }

    private void skipRemaining(WorkflowState state, Instant now) {
        List<PlanStep> planSteps = state.getPlan().steps();
        for (int i = state.getCurrentStepIndex(); i < planSteps.size(); i++) {
            state.getSteps().add(WorkflowStep.skipped(planSteps.get(i), state.getSteps().size(), now));
        }
        state.setCurrentStepIndex(planSteps.size());
    }

    private void syncPoint(WorkflowState state, WorkflowEventEmitter emitter) {
        emitter.emit(new WorkflowEvent.StateSnapshot(state));
        persistenceService.saveSnapshot(state);
    }

    private void handleInterruption(WorkflowState state, WorkflowInterruptedException ex, Instant now,
                                    WorkflowEventEmitter emitter) {
        int completed = state.finishedSteps().size();
        Optional<WorkflowStep> interrupted = closeRunningStep(state, ex.getMessage(), now, emitter);
        state.setErrorMessage(ex.getMessage());
        if (ex.getKind() == WorkflowInterruptedException.Kind.CANCELLED) {
            log.info("Workflow {} cancelled: {}", state.getId(), ex.getMessage());
            emitter.emit(new WorkflowEvent.Cancelled(state.getId(), completed));
            state.complete(WorkflowStatus.CANCELLED, now);
        } else {
            log.warn("Workflow {} timed out: {}", state.getId(), ex.getMessage());
            emitter.emit(new WorkflowEvent.ErrorEvent(ex.getMessage(), false,
                    interrupted.map(WorkflowStep::getPlanStepId).orElse(null)));
            state.complete(WorkflowStatus.TIMEOUT, now);
        }
    }

    private void handleFailure(WorkflowState state, RuntimeException ex, Instant now, WorkflowEventEmitter emitter) {
        if (state.getStatus().isTerminal()) {
            log.error("Workflow {} failed after reaching {}", state.getId(), state.getStatus().wireName(), ex);
            return;
        }
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        if (ex instanceof WorkflowAbortedException) {
            log.info("Workflow {} aborted by reflection: {}", state.getId(), message);
        } else {
            log.error("Workflow {} failed: {}", state.getId(), JsonProcessingService.truncate(message, 300), ex);
        }
        Optional<WorkflowStep> interrupted = closeRunningStep(state, message, now, emitter);
        state.setErrorMessage(message);
        emitter.emit(new WorkflowEvent.ErrorEvent(message, false,
                interrupted.map(WorkflowStep::getPlanStepId).orElse(null)));
        state.complete(WorkflowStatus.ERROR, now);
    }

    private Optional<WorkflowStep> closeRunningStep(WorkflowState state, String reason, Instant now,
                                                    WorkflowEventEmitter emitter) {
        Optional<WorkflowStep> running = state.findRunningStep();
        running.ifPresent(step -> {
            step.finish(StepStatus.FAILED, reason, now);
            emitter.emit(new WorkflowEvent.StepEnd(step.getPlanStepId(), indexInPlan(state, step),
                    StepStatus.FAILED, durationOf(step), reason));
        });
        return running;
    }

    private static int indexInPlan(WorkflowState state, WorkflowStep step) {
        if (state.getPlan() != null) {
            List<PlanStep> steps = state.getPlan().steps();
            for (int i = 0; i < steps.size(); i++) {
                if (steps.get(i).id().equals(step.getPlanStepId())) {
                    return i;
                }
            }
        }
        return step.getExecutionIndex();
    }

    private static long durationOf(WorkflowStep step) {
        return step.getDurationMs() != null ? step.getDurationMs() : 0L;
    }
}
