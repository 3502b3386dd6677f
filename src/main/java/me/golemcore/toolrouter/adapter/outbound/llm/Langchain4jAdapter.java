package me.golemcore.toolrouter.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.model.LlmRequest;
import me.golemcore.toolrouter.domain.model.LlmResponse;
import me.golemcore.toolrouter.domain.model.Message;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter using langchain4j, serving OpenAI, Anthropic and any
 * OpenAI-compatible endpoint.
 *
 * <p>
 * Models are named {@code provider/model} (e.g. {@code openai/gpt-4o-mini},
 * {@code anthropic/claude-3-5-haiku-latest}); the provider part selects the
 * entry under {@code toolrouter.llm.langchain4j.providers}. Built models are
 * cached per name.
 *
 * <p>
 * No retries: callers such as the tie-break judge enforce their own short
 * deadline and fall back on failure.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String DEFAULT_PROVIDER = "openai";
    private static final int ANTHROPIC_MAX_TOKENS = 1024;

    private final ToolRouterProperties properties;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public Langchain4jAdapter(ToolRouterProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null ? request.getModel() : getCurrentModel();
            if (model == null || model.isBlank()) {
                throw new IllegalStateException("No model configured for langchain4j adapter");
            }
            ChatModel chatModel = models.computeIfAbsent(model, this::createModel);
            ChatResponse response = chatModel.chat(convertMessages(request));
            return convertResponse(response, model);
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getTieBreak().getModel();
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getLangchain4j().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }

    static String providerOf(String model) {
        return model.contains("/") ? model.substring(0, model.indexOf('/')) : DEFAULT_PROVIDER;
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private ToolRouterProperties.ProviderProperties getProviderConfig(String providerName) {
        ToolRouterProperties.ProviderProperties config = properties.getLlm().getLangchain4j().getProviders()
                .get(providerName);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add toolrouter.llm.langchain4j.providers." + providerName + ".api-key");
        }
        return config;
    }

    private ChatModel createModel(String model) {
        String provider = providerOf(model);
        ToolRouterProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(properties.getLlm().getLangchain4j().getTimeoutMs());
        log.info("[LLM] Creating {} model {}", provider, modelName);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0)
                    .maxTokens(ANTHROPIC_MAX_TOKENS)
                    .temperature(0.0)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .temperature(0.0)
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (Message msg : request.getMessages()) {
            String role = msg.getRole() != null ? msg.getRole() : "user";
            switch (role) {
            case "system" -> messages.add(SystemMessage.from(msg.getContent()));
            case "assistant" -> messages.add(AiMessage.from(msg.getContent()));
            default -> messages.add(UserMessage.from(msg.getContent()));
            }
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String model) {
        TokenUsage usage = response.tokenUsage();
        return LlmResponse.builder()
                .content(response.aiMessage().text())
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .inputTokens(usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0)
                .outputTokens(usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0)
                .build();
    }
}
