package com.locai.workflow.service;

/**
 * The planner could not produce a usable plan. Ends the run with {@code error}.
 */
public class PlanningException extends RuntimeException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
