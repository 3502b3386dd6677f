package me.golemcore.toolrouter.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.TieBreakFailedException;
import me.golemcore.toolrouter.domain.model.Candidate;
import me.golemcore.toolrouter.domain.model.Pattern;
import me.golemcore.toolrouter.domain.model.ScoredCandidate;
import me.golemcore.toolrouter.domain.model.TieBreakResolution;
import me.golemcore.toolrouter.domain.model.TieBreakTranscript;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.TieBreakJudgePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

/**
 * Defers near-ties to an external judge.
 *
 * <p>
 * Escalation happens when the top two composite scores differ by less than
 * {@code toolrouter.tie-break.epsilon}. The judge sees at most
 * {@code max-candidates} candidates within epsilon of the leader, described in
 * a prompt capped at {@code max-prompt-chars}, and must answer within
 * {@code timeout} with JSON naming one of them. Any failure (timeout, error,
 * malformed output, unknown name) falls back to the deterministic leader; the
 * transcript records what happened either way.
 *
 * @see TieBreakJudgePort
 */
@Component
@Slf4j
public class TieBreakEscalator {

    private static final java.util.regex.Pattern JSON_BLOCK = java.util.regex.Pattern
            .compile("```(?:json)?\\s*(\\{.*?})\\s*```", java.util.regex.Pattern.DOTALL);
    private static final java.util.regex.Pattern SIMPLE_JSON = java.util.regex.Pattern
            .compile("(\\{[^{}]*\"choice\"[^{}]*})", java.util.regex.Pattern.DOTALL);
    private static final String FIRST_JUDGE = "first";
    private static final int MAX_RAW_RESPONSE_CHARS = 2000;

    private final ToolRouterProperties.TieBreakProperties config;
    private final Map<String, TieBreakJudgePort> judges;
    private final ObjectMapper objectMapper;

    public TieBreakEscalator(ToolRouterProperties properties, List<TieBreakJudgePort> judges,
            ObjectMapper objectMapper) {
        this.config = properties.getTieBreak();
        this.judges = judges.stream()
                .collect(Collectors.toMap(TieBreakJudgePort::getJudgeId, Function.identity(), (a, b) -> a));
        this.objectMapper = objectMapper;
    }

    /**
     * Whether the ranking's top two are within epsilon of each other.
     */
    public boolean shouldEscalate(List<ScoredCandidate> ranked) {
        if (!config.isEnabled() || ranked.size() < 2) {
            return false;
        }
        return ranked.get(0).composite() - ranked.get(1).composite() < config.getEpsilon();
    }

    /**
     * Asks the judge to choose among the tied leaders. Never throws for judge
     * failures.
     */
    public Outcome escalate(List<ScoredCandidate> ranked) {
        List<ScoredCandidate> presented = presented(ranked);
        List<String> keys = presented.stream().map(ScoredCandidate::key).toList();
        ScoredCandidate leader = ranked.get(0);
        String prompt = buildPrompt(presented);
        TieBreakJudgePort judge = activeJudge();

        log.info("[TieBreak] Escalating {} candidates to judge '{}': {}", keys.size(), judge.getJudgeId(), keys);
        long startNanos = System.nanoTime();
        String raw = null;
        try {
            raw = await(ask(judge, keys, prompt));
            Choice choice = parseChoice(raw, keys);
            ScoredCandidate winner = presented.stream()
                    .filter(c -> c.key().equals(choice.key()))
                    .findFirst()
                    .orElse(leader);
            long latency = elapsedMs(startNanos);
            log.info("[TieBreak] Judge chose {} in {}ms: {}", winner.key(), latency, choice.reason());
            return new Outcome(winner, TieBreakTranscript.builder()
                    .presentedCandidates(keys)
                    .prompt(prompt)
                    .rawResponse(truncate(raw, MAX_RAW_RESPONSE_CHARS))
                    .resolution(TieBreakResolution.JUDGE_CHOICE)
                    .chosenCandidate(winner.key())
                    .reason(choice.reason())
                    .latencyMs(latency)
                    .build());
        } catch (TieBreakFailedException e) {
            long latency = elapsedMs(startNanos);
            log.warn("[TieBreak] Escalation failed ({}), falling back to {}: {}", e.getResolution(), leader.key(),
                    e.getMessage());
            return new Outcome(leader, TieBreakTranscript.builder()
                    .presentedCandidates(keys)
                    .prompt(prompt)
                    .rawResponse(truncate(raw, MAX_RAW_RESPONSE_CHARS))
                    .resolution(e.getResolution())
                    .chosenCandidate(leader.key())
                    .reason("Fallback to highest deterministic score")
                    .error(e.getMessage())
                    .latencyMs(latency)
                    .build());
        }
    }

    private List<ScoredCandidate> presented(List<ScoredCandidate> ranked) {
        double top = ranked.get(0).composite();
        int limit = Math.max(2, config.getMaxCandidates());
        List<ScoredCandidate> result = new ArrayList<>();
        for (ScoredCandidate candidate : ranked) {
            if (result.size() >= limit || top - candidate.composite() >= config.getEpsilon()) {
                break;
            }
            result.add(candidate);
        }
        return result;
    }

    private TieBreakJudgePort activeJudge() {
        TieBreakJudgePort judge = judges.get(config.getJudge());
        if (judge == null) {
            judge = judges.get(FIRST_JUDGE);
        }
        if (judge == null) {
            throw new IllegalStateException("No tie-break judge registered");
        }
        return judge;
    }

    private static CompletableFuture<String> ask(TieBreakJudgePort judge, List<String> keys, String prompt) {
        CompletableFuture<String> response;
        try {
            response = judge.resolveTie(keys, prompt);
        } catch (RuntimeException e) {
            throw new TieBreakFailedException(TieBreakResolution.FALLBACK_ERROR, "Judge failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new TieBreakFailedException(TieBreakResolution.FALLBACK_ERROR, "Judge returned no response");
        }
        return response;
    }

    private String await(CompletableFuture<String> response) {
        try {
            return response.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            response.cancel(true);
            throw new TieBreakFailedException(TieBreakResolution.FALLBACK_TIMEOUT,
                    "Judge did not answer within " + config.getTimeout().toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TieBreakFailedException(TieBreakResolution.FALLBACK_ERROR,
                    "Judge failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TieBreakFailedException(TieBreakResolution.FALLBACK_ERROR, "Interrupted waiting for judge", e);
        } catch (RuntimeException e) {
            throw new TieBreakFailedException(TieBreakResolution.FALLBACK_ERROR, "Judge failed: " + e.getMessage(), e);
        }
    }

    Choice parseChoice(String raw, List<String> keys) {
        if (raw == null || raw.isBlank()) {
            throw new TieBreakFailedException(TieBreakResolution.FALLBACK_MALFORMED_OUTPUT, "Empty judge response");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(extractJson(raw));
        } catch (JsonProcessingException e) {
            throw new TieBreakFailedException(TieBreakResolution.FALLBACK_MALFORMED_OUTPUT,
                    "Judge response is not JSON", e);
        }
        if (node == null || !node.isObject() || !node.hasNonNull("choice") || !node.get("choice").isTextual()) {
            throw new TieBreakFailedException(TieBreakResolution.FALLBACK_MALFORMED_OUTPUT,
                    "Judge response has no string 'choice' field");
        }
        String choice = node.get("choice").asText().trim();
        String matched = keys.stream().filter(k -> k.equalsIgnoreCase(choice)).findFirst()
                .orElseThrow(() -> new TieBreakFailedException(TieBreakResolution.FALLBACK_UNKNOWN_CANDIDATE,
                        "Judge chose '" + choice + "', which was not presented"));
        String reason = node.hasNonNull("reason") ? node.get("reason").asText() : "";
        return new Choice(matched, reason);
    }

    private static String extractJson(String response) {
        Matcher block = JSON_BLOCK.matcher(response);
        if (block.find()) {
            return block.group(1);
        }
        Matcher simple = SIMPLE_JSON.matcher(response);
        if (simple.find()) {
            return simple.group(1);
        }
        return response.trim();
    }

    String buildPrompt(List<ScoredCandidate> presented) {
        StringBuilder sb = new StringBuilder();
        Candidate first = presented.get(0).candidate();
        sb.append("Capability: ").append(first.getCapability()).append('\n');
        sb.append("These candidates scored within ").append(config.getEpsilon())
                .append(" of each other. Pick the one best suited to the request.\n\n");
        for (ScoredCandidate scored : presented) {
            Pattern pattern = scored.candidate().getPattern();
            sb.append("- ").append(scored.key())
                    .append(String.format(Locale.ROOT, " (score %.4f, time %.0fms, cost %.2f, %s)%n", scored.composite(),
                            scored.breakdown().getModeledTimeMs(), scored.breakdown().getModeledCost(),
                            pattern.getCompleteness().toValue()));
            if (pattern.getDescription() != null) {
                sb.append("  ").append(truncate(pattern.getDescription(), 200)).append('\n');
            }
            if (!pattern.getTypicalUseCases().isEmpty()) {
                sb.append("  use cases: ").append(truncate(String.join("; ", pattern.getTypicalUseCases()), 200))
                        .append('\n');
            }
            if (!pattern.getLimitations().isEmpty()) {
                sb.append("  limitations: ").append(truncate(String.join("; ", pattern.getLimitations()), 200))
                        .append('\n');
            }
        }
        String footer = "\nRespond ONLY with JSON: {\"choice\": \"<one of the names above>\", \"reason\": \"...\"}";
        int budget = Math.max(0, config.getMaxPromptChars() - footer.length());
        return truncate(sb.toString(), budget) + footer;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String truncate(String text, int maxLen) {
        if (text == null || text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLen - 3)) + "...";
    }

    record Choice(String key, String reason) {
    }

    /**
     * The winning candidate and the audit transcript of the escalation.
     */
    public record Outcome(ScoredCandidate winner, TieBreakTranscript transcript) {

        public boolean judgeDecided() {
            return transcript.getResolution() == TieBreakResolution.JUDGE_CHOICE;
        }
    }
}
