package com.locai.workflow.runtime;

/**
 * Thrown at a suspension point once the run was cancelled or its overall deadline passed.
 */
public class WorkflowInterruptedException extends RuntimeException {

    public enum Kind {
        CANCELLED,
        TIMED_OUT
    }

    private final Kind kind;

    private WorkflowInterruptedException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static WorkflowInterruptedException cancelled(String message) {
        return new WorkflowInterruptedException(Kind.CANCELLED, message);
    }

    public static WorkflowInterruptedException timedOut(String message) {
        return new WorkflowInterruptedException(Kind.TIMED_OUT, message);
    }

    public Kind getKind() {
        return kind;
    }
}
