package com.locai.stream;

/**
 * Receives orchestrator events in order, as they occur.
 */
@FunctionalInterface
public interface WorkflowEventEmitter {

    void emit(WorkflowEvent event);
}
