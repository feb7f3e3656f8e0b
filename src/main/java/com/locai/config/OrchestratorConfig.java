package com.locai.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    @Bean
    @Primary
    public ChatClient chatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    /**
     * Exposes standalone {@link ToolCallback} beans to the dispatcher alongside any other providers.
     */
    @Bean
    public ToolCallbackProvider localToolCallbackProvider(ObjectProvider<ToolCallback> toolCallbacks) {
        List<ToolCallback> callbacks = toolCallbacks.orderedStream().toList();
        return ToolCallbackProvider.from(callbacks);
    }

    @Bean
    public Clock workflowClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService workerExecutor() {
        return Executors.newCachedThreadPool();
    }
}
