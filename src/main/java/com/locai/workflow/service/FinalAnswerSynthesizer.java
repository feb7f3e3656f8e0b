package com.locai.workflow.service;

import com.locai.stream.WorkflowEvent;
import com.locai.stream.WorkflowEventEmitter;
import com.locai.workflow.llm.ModelClient;
import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.runtime.WorkflowInterruptedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import static com.locai.workflow.service.WorkflowConstants.PURPOSE_FINAL_ANSWER;

/**
 * Streams the final answer as {@code message} deltas followed by a closing {@code done} record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinalAnswerSynthesizer {

    private final ModelClient modelClient;
    private final WorkflowPromptService promptService;

    public String synthesize(WorkflowState state, ModelInvocation invocation, WorkflowEventEmitter emitter) {
        String prompt = promptService.finalAnswerPrompt(state);
        DeltaGate gate = new DeltaGate(emitter);
        String answer;
        try {
            answer = invocation.runContext().await(PURPOSE_FINAL_ANSWER,
                    () -> modelClient.stream(invocation.request(PURPOSE_FINAL_ANSWER, prompt), gate::forward));
        } catch (WorkflowInterruptedException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Final answer call failed for workflow {}: {}", state.getId(), ex.getMessage());
            emitter.emit(new WorkflowEvent.ErrorEvent("Final answer generation failed: " + ex.getMessage(),
                    true, null));
            answer = gate.forwardedAny() ? gate.text() : promptService.fallbackAnswer(state);
            if (!gate.forwardedAny()) {
                emitter.emit(new WorkflowEvent.Message(answer, false));
            }
        } finally {
            gate.close();
        }
        emitter.emit(new WorkflowEvent.Message("", true));
        return answer;
    }

    /**
     * Forwards deltas from the streaming thread until the orchestrator stops listening.
     */
    private static final class DeltaGate {
        private final WorkflowEventEmitter emitter;
        private final StringBuilder text = new StringBuilder();
        private boolean open = true;

        DeltaGate(WorkflowEventEmitter emitter) {
            this.emitter = emitter;
        }

        synchronized void forward(String delta) {
            if (!open) {
                throw new IllegalStateException("Final answer stream abandoned");
            }
            text.append(delta);
            emitter.emit(new WorkflowEvent.Message(delta, false));
        }

        synchronized void close() {
            open = false;
        }

        synchronized boolean forwardedAny() {
            return text.length() > 0;
        }

        synchronized String text() {
            return text.toString();
        }
    }
}
