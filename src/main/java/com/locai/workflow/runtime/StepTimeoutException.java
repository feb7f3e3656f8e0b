package com.locai.workflow.runtime;

/**
 * The per-step budget ran out. Ends the step, not the run.
 */
public class StepTimeoutException extends RuntimeException {

    public StepTimeoutException(String message) {
        super(message);
    }
}
