package com.locai.config;

import java.util.ArrayList;
import java.util.List;

/**
 * A pre-configured agent profile: a task-specific system prompt plus the tools it works with.
 */
public class AgentPreset {

    private String id;
    private String name;
    private String description;
    private String systemPrompt;
    private List<String> enabledTools = new ArrayList<>();

    public AgentPreset() {
    }

    public AgentPreset(String id, String name, String description, String systemPrompt, List<String> enabledTools) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.systemPrompt = systemPrompt;
        setEnabledTools(enabledTools);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public List<String> getEnabledTools() {
        return enabledTools;
    }

    public void setEnabledTools(List<String> enabledTools) {
        this.enabledTools = enabledTools != null ? new ArrayList<>(enabledTools) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AgentPreset{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", enabledTools=" + enabledTools +
                '}';
    }
}
