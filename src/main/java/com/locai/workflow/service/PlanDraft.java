package com.locai.workflow.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Plan as returned by the model, before normalization.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanDraft(String goal, List<StepDraft> steps, Integer maxSteps) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StepDraft(
            String id,
            String description,
            List<String> expectedTools,
            List<String> dependsOn,
            String successCriteria
    ) {
    }
}
