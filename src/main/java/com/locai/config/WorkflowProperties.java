package com.locai.config;

import com.locai.workflow.model.WorkflowConfig;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "workflow")
public class WorkflowProperties {

    private String defaultModel = "llama3.1";
    private int maxSteps = WorkflowConfig.DEFAULT_MAX_STEPS;
    private int maxRePlans = WorkflowConfig.DEFAULT_MAX_RE_PLANS;
    private Duration timeout = Duration.ofMillis(WorkflowConfig.DEFAULT_TIMEOUT_MS);
    private Duration stepTimeout = Duration.ofMillis(WorkflowConfig.DEFAULT_STEP_TIMEOUT_MS);
    private boolean enableReflection = true;
    private boolean enablePlanning = true;
    private int maxTurnsPerStep = 6;
    private int maxToolOutputChars = 8000;
    private LlmConfig llm = new LlmConfig();
    private List<AgentPreset> presets = new ArrayList<>();

    public static class LlmConfig {
        private String baseUrl = "http://localhost:11434";
        private String apiKey = "none";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }

    /**
     * Builds the run configuration every request starts from.
     */
    public WorkflowConfig defaultConfig(@Nullable String model, List<String> enabledTools) {
        String resolvedModel = model == null || model.isBlank() ? defaultModel : model;
        return WorkflowConfig.defaults(resolvedModel, enabledTools)
                .withMaxSteps(maxSteps)
                .withMaxRePlans(maxRePlans)
                .withTimeouts(timeout.toMillis(), stepTimeout.toMillis())
                .withFlags(enableReflection, enablePlanning);
    }

    public Optional<AgentPreset> findPreset(@Nullable String presetId) {
        if (presetId == null || presetId.isBlank()) {
            return Optional.empty();
        }
        return presets.stream()
                .filter(preset -> presetId.equalsIgnoreCase(preset.getId()))
                .findFirst();
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public int getMaxRePlans() {
        return maxRePlans;
    }

    public void setMaxRePlans(int maxRePlans) {
        this.maxRePlans = maxRePlans;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getStepTimeout() {
        return stepTimeout;
    }

    public void setStepTimeout(Duration stepTimeout) {
        this.stepTimeout = stepTimeout;
    }

    public boolean isEnableReflection() {
        return enableReflection;
    }

    public void setEnableReflection(boolean enableReflection) {
        this.enableReflection = enableReflection;
    }

    public boolean isEnablePlanning() {
        return enablePlanning;
    }

    public void setEnablePlanning(boolean enablePlanning) {
        this.enablePlanning = enablePlanning;
    }

    public int getMaxTurnsPerStep() {
        return maxTurnsPerStep;
    }

    public void setMaxTurnsPerStep(int maxTurnsPerStep) {
        this.maxTurnsPerStep = maxTurnsPerStep;
    }

    public int getMaxToolOutputChars() {
        return maxToolOutputChars;
    }

    public void setMaxToolOutputChars(int maxToolOutputChars) {
        this.maxToolOutputChars = maxToolOutputChars;
    }

    public LlmConfig getLlm() {
        return llm;
    }

    public void setLlm(LlmConfig llm) {
        this.llm = llm != null ? llm : new LlmConfig();
    }

    public List<AgentPreset> getPresets() {
        return presets;
    }

    public void setPresets(List<AgentPreset> presets) {
        this.presets = presets != null ? new ArrayList<>(presets) : new ArrayList<>();
    }
}
