package com.locai.config;

import com.locai.workflow.model.WorkflowConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowPropertiesTest {

    @Test
    void testPresetLookupIgnoresCase() {
        WorkflowProperties properties = new WorkflowProperties();
        properties.getPresets().add(new AgentPreset("coding", "Coding", "Writes code", "You write code.", null));

        assertTrue(properties.findPreset("CODING").isPresent());
        assertTrue(properties.findPreset("writing").isEmpty());
        assertTrue(properties.findPreset(null).isEmpty());
        assertTrue(properties.getPresets().get(0).getEnabledTools().isEmpty());
    }

    @Test
    void testDefaultConfigFallsBackToDefaultModel() {
        WorkflowProperties properties = new WorkflowProperties();
        properties.setDefaultModel("mistral");
        properties.setMaxRePlans(1);
        properties.setStepTimeout(Duration.ofSeconds(10));

        WorkflowConfig config = properties.defaultConfig(" ", List.of("read_file"));

        assertEquals("mistral", config.model());
        assertEquals(1, config.maxRePlans());
        assertEquals(10_000L, config.stepTimeoutMs());
        assertEquals(List.of("read_file"), config.enabledTools());
    }
}
