package com.example.prr.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ChatClient configuration for the two LLM providers, plus shared infrastructure beans.
 * <p>
 * - analysisChatClient (OpenAI, vision-capable): architecture extraction and resilience planning
 * - reportChatClient (Anthropic): narrative prose of the PRR document
 */
@Configuration
public class AiConfig {

    @Bean("analysisChatClient")
    @ConditionalOnProperty(prefix = "prr.inference", name = "mode", havingValue = "model", matchIfMissing = true)
    public ChatClient analysisChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    @Bean("reportChatClient")
    @ConditionalOnProperty(prefix = "prr.inference", name = "mode", havingValue = "model", matchIfMissing = true)
    public ChatClient reportChatClient(AnthropicChatModel anthropicChatModel) {
        return ChatClient.builder(anthropicChatModel).build();
    }

    /**
     * Bounded pool for gateway calls; each call is awaited with a timeout.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService inferenceExecutor(PrrProperties properties) {
        return fixedPool(properties.inference().poolSize(), "prr-inference-");
    }

    /**
     * Pool for asynchronous pipeline runs. Kept apart from {@code inferenceExecutor}
     * so runs waiting on gateway calls cannot starve them.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor(PrrProperties properties) {
        return fixedPool(properties.inference().poolSize(), "prr-run-");
    }

    private static ExecutorService fixedPool(int size, String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
