package com.locai.workflow.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Per-run settings, fixed when the run is created.
 */
public record WorkflowConfig(
        String model,
        List<String> enabledTools,
        int maxSteps,
        int maxRePlans,
        long timeoutMs,
        long stepTimeoutMs,
        boolean enableReflection,
        boolean enablePlanning,
        @Nullable String host
) {
    public static final int DEFAULT_MAX_STEPS = 8;
    public static final int DEFAULT_MAX_RE_PLANS = 2;
    public static final long DEFAULT_TIMEOUT_MS = 120_000L;
    public static final long DEFAULT_STEP_TIMEOUT_MS = 30_000L;

    public WorkflowConfig {
        enabledTools = enabledTools == null ? List.of() : List.copyOf(enabledTools);
    }

    public static WorkflowConfig defaults(String model, List<String> enabledTools) {
        return new WorkflowConfig(model, enabledTools, DEFAULT_MAX_STEPS, DEFAULT_MAX_RE_PLANS,
                DEFAULT_TIMEOUT_MS, DEFAULT_STEP_TIMEOUT_MS, true, true, null);
    }

    public WorkflowConfig withMaxSteps(int value) {
        return new WorkflowConfig(model, enabledTools, value, maxRePlans, timeoutMs, stepTimeoutMs,
                enableReflection, enablePlanning, host);
    }

    public WorkflowConfig withTimeouts(long overallMs, long stepMs) {
        return new WorkflowConfig(model, enabledTools, maxSteps, maxRePlans, overallMs, stepMs,
                enableReflection, enablePlanning, host);
    }

    public WorkflowConfig withFlags(boolean reflection, boolean planning) {
        return new WorkflowConfig(model, enabledTools, maxSteps, maxRePlans, timeoutMs, stepTimeoutMs,
                reflection, planning, host);
    }

    public WorkflowConfig withMaxRePlans(int value) {
        return new WorkflowConfig(model, enabledTools, maxSteps, value, timeoutMs, stepTimeoutMs,
                enableReflection, enablePlanning, host);
    }

    public WorkflowConfig withHost(@Nullable String value) {
        return new WorkflowConfig(model, enabledTools, maxSteps, maxRePlans, timeoutMs, stepTimeoutMs,
                enableReflection, enablePlanning, value);
    }
}
