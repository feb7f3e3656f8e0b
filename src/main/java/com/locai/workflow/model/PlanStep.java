package com.locai.workflow.model;

import java.util.List;

/**
 * One planned unit of work. {@code expectedTools} is advisory and {@code successCriteria}
 * is judged by the reflector, neither is enforced.
 */
public record PlanStep(
        String id,
        String description,
        List<String> expectedTools,
        List<String> dependsOn,
        String successCriteria
) {
    public PlanStep {
        expectedTools = expectedTools == null ? List.of() : List.copyOf(expectedTools);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public PlanStep withId(String newId) {
        return new PlanStep(newId, description, expectedTools, dependsOn, successCriteria);
    }
}
