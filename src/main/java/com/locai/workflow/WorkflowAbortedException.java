package com.locai.workflow;

/**
 * Raised when step reflection decides the run cannot succeed.
 */
class WorkflowAbortedException extends RuntimeException {

    WorkflowAbortedException(String reason) {
        super("Workflow aborted: " + reason);
    }
}
