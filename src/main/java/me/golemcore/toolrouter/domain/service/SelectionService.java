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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.CatalogUnavailableException;
import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.exception.NoEligibleCandidateException;
import me.golemcore.toolrouter.domain.exception.ServiceUnavailableException;
import me.golemcore.toolrouter.domain.model.Budget;
import me.golemcore.toolrouter.domain.model.CacheEntry;
import me.golemcore.toolrouter.domain.model.Candidate;
import me.golemcore.toolrouter.domain.model.CandidateSet;
import me.golemcore.toolrouter.domain.model.ExecutionMode;
import me.golemcore.toolrouter.domain.model.InputContract;
import me.golemcore.toolrouter.domain.model.PolicyFilterResult;
import me.golemcore.toolrouter.domain.model.PreferenceWeights;
import me.golemcore.toolrouter.domain.model.ResultSource;
import me.golemcore.toolrouter.domain.model.ScoredCandidate;
import me.golemcore.toolrouter.domain.model.ScoringAxis;
import me.golemcore.toolrouter.domain.model.SelectionMethod;
import me.golemcore.toolrouter.domain.model.SelectionOutcome;
import me.golemcore.toolrouter.domain.model.SelectionRequest;
import me.golemcore.toolrouter.domain.model.SelectionResult;
import me.golemcore.toolrouter.domain.model.SlaClass;
import me.golemcore.toolrouter.domain.model.TieBreakTranscript;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Selection gateway: fingerprint, cache lookup, and on a miss the full
 * resolution (catalog, policy filter, scoring, tie-break, routing).
 *
 * <p>
 * Degraded mode applies when the catalog store is unreachable during a miss. A
 * warm key (a warm cache entry within the stale grace window) is served with a
 * staleness marker; a cold key fails fast with
 * {@link ServiceUnavailableException} carrying a retry hint.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SelectionService {

    static final long BACKGROUND_THRESHOLD_MS = 5_000;
    static final long INTERACTIVE_SLA_MS = 1_000;
    static final long BATCH_SLA_MS = 10_000;
    static final int MAX_ALTERNATIVES = 3;

    private final CatalogService catalogService;
    private final PolicyFilter policyFilter;
    private final ScoringEngine scoringEngine;
    private final TieBreakEscalator tieBreakEscalator;
    private final PlanEnricher planEnricher;
    private final SelectionCache selectionCache;
    private final RequestFingerprinter fingerprinter;
    private final RetryAfterPolicy retryAfterPolicy;
    private final ToolRouterProperties properties;
    private final Clock clock;

    /**
     * Selects the best tool pattern for the request.
     *
     * @throws InvalidRequestException
     *             if the request is malformed
     * @throws NoEligibleCandidateException
     *             if no candidate exists or policy removed all of them
     * @throws ServiceUnavailableException
     *             if the catalog store is down and the request is a cold key
     */
    public SelectionOutcome select(SelectionRequest request) {
        validate(request);
        String fingerprint = fingerprinter.fingerprint(request);
        boolean cacheEnabled = properties.getSelection().isCacheEnabled();

        if (cacheEnabled) {
            Optional<CacheEntry> cached = selectionCache.getFresh(fingerprint);
            if (cached.isPresent()) {
                CacheEntry entry = cached.get();
                log.debug("[Selector] Cache HIT for {} ({})", request.getCapability(), abbreviate(fingerprint));
                return new SelectionOutcome(fingerprint, entry.result(), ResultSource.CACHE,
                        entry.ageMs(clock.instant()));
            }
        }

        SelectionResult result;
        try {
            result = resolve(request);
        } catch (CatalogUnavailableException e) {
            Optional<CacheEntry> warm = cacheEnabled
                    ? selectionCache.getServableDuringOutage(fingerprint)
                    : Optional.empty();
            if (warm.isPresent()) {
                CacheEntry entry = warm.get();
                log.warn("[Selector] Catalog unavailable, serving warm key {} for {} (age {}ms)",
                        abbreviate(fingerprint), request.getCapability(), entry.ageMs(clock.instant()));
                return new SelectionOutcome(fingerprint, entry.result(), ResultSource.STALE_CACHE,
                        entry.ageMs(clock.instant()));
            }
            long retryAfter = retryAfterPolicy.nextRetryAfterSeconds();
            log.warn("[Selector] Catalog unavailable and {} is a cold key, retry after {}s",
                    abbreviate(fingerprint), retryAfter);
            throw new ServiceUnavailableException("Tool catalog is unavailable and no cached selection exists for "
                    + request.getCapability(), retryAfter, e);
        }

        if (!result.isCatalogStale()) {
            retryAfterPolicy.reset();
        }
        if (cacheEnabled) {
            selectionCache.put(fingerprint, result, !result.isCatalogStale());
        }
        log.info("[Selector] {} -> {} (score {}, {}, {} of {} eligible)", request.getCapability(),
                result.candidateKey(), String.format(Locale.ROOT, "%.4f", result.getFinalScore()),
                result.getSelectionMethod(), result.getCandidatesEligible(), result.getCandidatesConsidered());
        return new SelectionOutcome(fingerprint, result, ResultSource.RESOLVED, 0);
    }

    private SelectionResult resolve(SelectionRequest request) {
        CandidateSet candidateSet = catalogService.getCandidates(request.getCapability().trim(),
                request.getPlatform());
        if (candidateSet.isEmpty()) {
            throw new NoEligibleCandidateException(request.getCapability(), List.of());
        }

        PolicyFilterResult filtered = policyFilter.filter(candidateSet.getCandidates(), request);
        List<Candidate> eligible = filtered.orElseThrow();
        List<ScoredCandidate> ranked = scoringEngine.score(eligible, request);

        ScoredCandidate winner = ranked.get(0);
        SelectionMethod method = SelectionMethod.DETERMINISTIC;
        TieBreakTranscript transcript = null;
        if (tieBreakEscalator.shouldEscalate(ranked)) {
            TieBreakEscalator.Outcome outcome = tieBreakEscalator.escalate(ranked);
            winner = outcome.winner();
            transcript = outcome.transcript();
            if (outcome.judgeDecided()) {
                method = SelectionMethod.TIE_BREAK;
            }
        }

        Candidate chosen = winner.candidate();
        double timeMs = winner.breakdown().getModeledTimeMs();
        return SelectionResult.builder()
                .capability(chosen.getCapability())
                .toolName(chosen.getTool().getName())
                .toolVersion(chosen.getTool().getVersion())
                .patternName(chosen.getPatternName())
                .platform(chosen.getTool().getPlatform())
                .finalScore(winner.composite())
                .scoreBreakdown(winner.breakdown())
                .selectionMethod(method)
                .tieBreak(transcript)
                .justification(justify(winner, method, transcript))
                .alternatives(alternatives(ranked, winner))
                .estimatedTimeMs(timeMs)
                .estimatedCost(winner.breakdown().getModeledCost())
                .executionMode(executionMode(chosen, timeMs))
                .slaClass(slaClass(timeMs))
                .candidatesConsidered(candidateSet.getCandidates().size())
                .candidatesEligible(eligible.size())
                .routing(planEnricher.routingFor(chosen))
                .inputs(InputContract.of(chosen.getPattern()))
                .catalogStale(candidateSet.isStale())
                .build();
    }

    private void validate(SelectionRequest request) {
        List<String> problems = new ArrayList<>();
        if (request == null) {
            throw new InvalidRequestException("Selection request is required");
        }
        if (request.getCapability() == null || request.getCapability().isBlank()) {
            problems.add("capability must be a non-empty capability name");
        }
        if (request.getN() < 0) {
            problems.add("N must be >= 0");
        }
        PreferenceWeights weights = request.getPreferenceWeights();
        if (weights != null) {
            if (weights.hasNegative()) {
                problems.add("preference weights must be non-negative");
            } else if (!(weights.sum() > 0) || Double.isInfinite(weights.sum())) {
                problems.add("preference weights must have a positive, finite sum");
            }
        }
        Budget budget = request.getBudget();
        if (budget != null) {
            if (budget.maxCost() != null && (budget.maxCost() < 0 || budget.maxCost().isNaN())) {
                problems.add("budget.maxCost must be >= 0");
            }
            if (budget.maxTimeMs() != null && (budget.maxTimeMs() < 0 || budget.maxTimeMs().isNaN())) {
                problems.add("budget.maxTimeMs must be >= 0");
            }
        }
        if (!problems.isEmpty()) {
            throw new InvalidRequestException("Invalid selection request: " + String.join("; ", problems), problems);
        }
    }

    private static String justify(ScoredCandidate winner, SelectionMethod method, TieBreakTranscript transcript) {
        ScoringAxis dominant = winner.breakdown().dominantAxis();
        StringBuilder sb = new StringBuilder();
        sb.append("Selected ").append(winner.key())
                .append(String.format(Locale.ROOT, " with score %.4f", winner.composite()));
        if (dominant != null) {
            sb.append(", strongest on ").append(dominant.name().toLowerCase(Locale.ROOT));
        }
        if (method == SelectionMethod.TIE_BREAK && transcript != null) {
            sb.append("; near-tie resolved by judge");
            if (transcript.getReason() != null && !transcript.getReason().isBlank()) {
                sb.append(": ").append(transcript.getReason());
            }
        } else if (transcript != null) {
            sb.append("; tie-break failed, kept highest deterministic score");
        }
        return sb.toString();
    }

    private static List<String> alternatives(List<ScoredCandidate> ranked, ScoredCandidate winner) {
        return ranked.stream()
                .filter(c -> c != winner)
                .limit(MAX_ALTERNATIVES)
                .map(ScoredCandidate::key)
                .toList();
    }

    private static ExecutionMode executionMode(Candidate chosen, double timeMs) {
        if (chosen.getPattern().getPolicy().isRequiresApproval()) {
            return ExecutionMode.APPROVAL_REQUIRED;
        }
        return timeMs > BACKGROUND_THRESHOLD_MS ? ExecutionMode.BACKGROUND : ExecutionMode.IMMEDIATE;
    }

    private static SlaClass slaClass(double timeMs) {
        if (timeMs < INTERACTIVE_SLA_MS) {
            return SlaClass.INTERACTIVE;
        }
        return timeMs < BATCH_SLA_MS ? SlaClass.BATCH : SlaClass.BACKGROUND;
    }

    private static String abbreviate(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }
}
