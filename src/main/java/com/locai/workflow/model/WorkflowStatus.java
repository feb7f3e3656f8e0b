package com.locai.workflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of a workflow run.
 * {@link #DONE}, {@link #ERROR}, {@link #CANCELLED} and {@link #TIMEOUT} are terminal.
 */
public enum WorkflowStatus {
    IDLE,
    PLANNING,
    EXECUTING,
    REFLECTING,
    DONE,
    ERROR,
    CANCELLED,
    TIMEOUT;

    private static final Set<WorkflowStatus> TERMINAL = EnumSet.of(DONE, ERROR, CANCELLED, TIMEOUT);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isActive() {
        return this == PLANNING || this == EXECUTING || this == REFLECTING;
    }

    /**
     * Returns whether the state machine allows moving from this status to {@code target}.
     * Any non-terminal status may end in {@code error}, {@code cancelled} or {@code timeout};
     * {@code done} is only reachable from {@code executing}.
     */
    public boolean canTransitionTo(WorkflowStatus target) {
        if (isTerminal() || target == null) {
            return false;
        }
        if (target == ERROR || target == CANCELLED || target == TIMEOUT) {
            return true;
        }
        return switch (this) {
            case IDLE -> target == PLANNING;
            case PLANNING -> target == EXECUTING;
            case EXECUTING -> target == EXECUTING || target == REFLECTING || target == DONE;
            case REFLECTING -> target == EXECUTING || target == PLANNING;
            default -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
