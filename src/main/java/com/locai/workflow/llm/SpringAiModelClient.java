package com.locai.workflow.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locai.config.WorkflowProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * {@link ModelClient} on top of a Spring AI {@link ChatClient} talking to an OpenAI-compatible endpoint.
 * Internal tool execution is disabled: requested tool calls are returned to the caller.
 */
@Service
@Slf4j
public class SpringAiModelClient implements ModelClient {

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ChatClient defaultClient;
    private final WorkflowProperties properties;
    private final ObjectMapper objectMapper;
    private final Map<String, ChatClient> hostClients = new ConcurrentHashMap<>();
    private final AtomicInteger llmRequestCount = new AtomicInteger();

    public SpringAiModelClient(ChatClient chatClient, WorkflowProperties properties, ObjectMapper objectMapper) {
        this.defaultClient = chatClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ModelReply chat(ModelRequest request) {
        logLlmRequest(request);
        ChatResponse response = clientFor(request.host())
                .prompt(toPrompt(request))
                .options(toOptions(request))
                .call()
                .chatResponse();
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            log.warn("Empty model response (purpose={}).", request.purpose());
            return ModelReply.text("");
        }
        AssistantMessage output = response.getResult().getOutput();
        List<ModelToolCall> toolCalls = new ArrayList<>();
        if (output.hasToolCalls()) {
            for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                toolCalls.add(new ModelToolCall(call.id(), call.name(), parseArguments(call.name(), call.arguments())));
            }
        }
        return new ModelReply(output.getText(), toolCalls);
    }

    @Override
    public String stream(ModelRequest request, Consumer<String> onDelta) {
        logLlmRequest(request);
        Flux<String> deltas = clientFor(request.host())
                .prompt(toPrompt(request))
                .options(toOptions(request))
                .stream()
                .content();
        StringBuilder full = new StringBuilder();
        for (String delta : deltas.toIterable()) {
            if (delta == null || delta.isEmpty()) {
                continue;
            }
            full.append(delta);
            onDelta.accept(delta);
        }
        return full.toString();
    }

    private void logLlmRequest(ModelRequest request) {
        int count = llmRequestCount.incrementAndGet();
        log.info("LLM request #{} sent (purpose={}, model={}, tools={}). Total requests={}.",
                count, request.purpose(), request.model(), request.tools().size(), count);
    }

    private Prompt toPrompt(ModelRequest request) {
        List<Message> messages = new ArrayList<>();
        for (ModelMessage message : request.messages()) {
            messages.add(toSpringMessage(message));
        }
        return new Prompt(messages);
    }

    private Message toSpringMessage(ModelMessage message) {
        return switch (message.role()) {
            case SYSTEM -> new SystemMessage(message.content());
            case USER -> new UserMessage(message.content());
            case ASSISTANT -> message.toolCalls().isEmpty()
                    ? new AssistantMessage(message.content())
                    : new AssistantMessage(message.content(), Map.of(), message.toolCalls().stream()
                            .map(call -> new AssistantMessage.ToolCall(call.id(), "function", call.name(),
                                    writeArguments(call.arguments())))
                            .toList());
            case TOOL -> new ToolResponseMessage(List.of(new ToolResponseMessage.ToolResponse(
                    Objects.requireNonNullElse(message.toolCallId(), ""),
                    Objects.requireNonNullElse(message.toolName(), ""),
                    message.content())));
        };
    }

    private OpenAiChatOptions toOptions(ModelRequest request) {
        return OpenAiChatOptions.builder()
                .model(request.model())
                .toolCallbacks(request.tools())
                .internalToolExecutionEnabled(false)
                .build();
    }

    private ChatClient clientFor(@Nullable String host) {
        String normalized = normalizeHost(host);
        if (normalized == null || normalized.equals(normalizeHost(properties.getLlm().getBaseUrl()))) {
            return defaultClient;
        }
        return hostClients.computeIfAbsent(normalized, this::buildClient);
    }

    private ChatClient buildClient(String baseUrl) {
        log.info("Creating chat client for model endpoint override {}", baseUrl);
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(properties.getLlm().getApiKey())
                .build();
        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(properties.getDefaultModel()).build())
                .build();
        return ChatClient.builder(chatModel).build();
    }

    static @Nullable String normalizeHost(@Nullable String host) {
        if (!StringUtils.hasText(host)) {
            return null;
        }
        String value = host.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        if (value.endsWith("/v1")) {
            value = value.substring(0, value.length() - 3);
        }
        return value;
    }

    private Map<String, Object> parseArguments(String toolName, @Nullable String raw) {
        if (!StringUtils.hasText(raw)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(raw, ARGUMENTS_TYPE);
        } catch (Exception ex) {
            log.warn("Unparseable arguments for tool {}: {}", toolName, raw);
            return Map.of();
        }
    }

    private String writeArguments(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (Exception ex) {
            return "{}";
        }
    }
}
