package com.locai.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Encodes events as single-line JSON objects tagged with {@code type} and decodes them back.
 */
@Component
public class WorkflowEventCodec {

    private static final String TYPE_FIELD = "type";

    private final ObjectMapper objectMapper;

    public WorkflowEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String encode(WorkflowEvent event) {
        ObjectNode line = objectMapper.createObjectNode();
        line.put(TYPE_FIELD, event.type());
        JsonNode payload = objectMapper.valueToTree(event);
        if (payload instanceof ObjectNode fields) {
            fields.remove(TYPE_FIELD);
            line.setAll(fields);
        }
        try {
            return objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode " + event.type() + " event", ex);
        }
    }

    /**
     * @throws MalformedEventException if the line is not JSON, has no known {@code type}, or has a bad payload
     */
    public WorkflowEvent decode(String line) {
        if (!StringUtils.hasText(line)) {
            throw new MalformedEventException("Empty event line");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException ex) {
            throw new MalformedEventException("Event line is not valid JSON", ex);
        }
        if (!(node instanceof ObjectNode fields)) {
            throw new MalformedEventException("Event line is not a JSON object");
        }
        JsonNode typeNode = fields.remove(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new MalformedEventException("Event line has no type");
        }
        String type = typeNode.asText();
        Class<? extends WorkflowEvent> target = switch (type) {
            case WorkflowEvent.WORKFLOW_START -> WorkflowEvent.WorkflowStart.class;
            case WorkflowEvent.PLAN -> WorkflowEvent.Plan.class;
            case WorkflowEvent.STEP_START -> WorkflowEvent.StepStart.class;
            case WorkflowEvent.TOOL_CALL -> WorkflowEvent.ToolCallEvent.class;
            case WorkflowEvent.TOOL_RESULT -> WorkflowEvent.ToolResultEvent.class;
            case WorkflowEvent.STEP_END -> WorkflowEvent.StepEnd.class;
            case WorkflowEvent.REFLECTION -> WorkflowEvent.Reflection.class;
            case WorkflowEvent.MESSAGE -> WorkflowEvent.Message.class;
            case WorkflowEvent.WORKFLOW_END -> WorkflowEvent.WorkflowEnd.class;
            case WorkflowEvent.ERROR -> WorkflowEvent.ErrorEvent.class;
            case WorkflowEvent.CANCELLED -> WorkflowEvent.Cancelled.class;
            case WorkflowEvent.STATE_SNAPSHOT -> WorkflowEvent.StateSnapshot.class;
            default -> throw new MalformedEventException("Unknown event type: " + type);
        };
        try {
            return objectMapper.treeToValue(fields, target);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new MalformedEventException("Invalid payload for " + type + " event", ex);
        }
    }
}
