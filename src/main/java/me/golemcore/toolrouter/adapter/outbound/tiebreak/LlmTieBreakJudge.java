package me.golemcore.toolrouter.adapter.outbound.tiebreak;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.model.LlmRequest;
import me.golemcore.toolrouter.domain.model.LlmResponse;
import me.golemcore.toolrouter.domain.model.Message;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.LlmPort;
import me.golemcore.toolrouter.port.outbound.TieBreakJudgePort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Tie-break judge backed by the configured LLM provider. Registered as
 * {@code llm}.
 */
@Component
@Slf4j
public class LlmTieBreakJudge implements TieBreakJudgePort {

    static final String SYSTEM_PROMPT = """
            You pick the best tool pattern for an operations request.
            You are given a short list of candidates that scored almost equally.
            Answer with a single JSON object and nothing else:
            {"choice": "<one of the candidate keys exactly as given>", "reason": "<one sentence>"}
            """;

    private static final int MAX_TOKENS = 200;

    private final LlmPort llmPort;
    private final ToolRouterProperties properties;

    public LlmTieBreakJudge(LlmPort llmPort, ToolRouterProperties properties) {
        this.llmPort = llmPort;
        this.properties = properties;
    }

    @Override
    public String getJudgeId() {
        return "llm";
    }

    @Override
    public CompletableFuture<String> resolveTie(List<String> candidateKeys, String prompt) {
        if (!llmPort.isAvailable()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("LLM provider '" + llmPort.getProviderId() + "' is not available"));
        }
        LlmRequest request = LlmRequest.builder()
                .model(properties.getTieBreak().getModel())
                .systemPrompt(SYSTEM_PROMPT)
                .temperature(0.0)
                .maxTokens(MAX_TOKENS)
                .build();
        request.addMessage(Message.user(prompt));
        log.debug("[TieBreak] Asking {} to choose among {}", llmPort.getProviderId(), candidateKeys);
        return llmPort.chat(request).thenApply(LlmResponse::getContent);
    }
}
