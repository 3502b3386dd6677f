package me.golemcore.toolrouter.adapter.inbound.web.controller;

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
import me.golemcore.toolrouter.adapter.inbound.web.dto.SelectRequest;
import me.golemcore.toolrouter.adapter.inbound.web.dto.SelectResponse;
import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.model.Budget;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;
import me.golemcore.toolrouter.domain.model.ExecutionStep;
import me.golemcore.toolrouter.domain.model.SelectionCacheStats;
import me.golemcore.toolrouter.domain.model.SelectionOutcome;
import me.golemcore.toolrouter.domain.model.SelectionRequest;
import me.golemcore.toolrouter.domain.model.SelectionResult;
import me.golemcore.toolrouter.domain.service.PlanEnricher;
import me.golemcore.toolrouter.domain.service.SelectionCache;
import me.golemcore.toolrouter.domain.service.SelectionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Selection API and selection-cache administration.
 */
@RestController
@RequestMapping("/api/select")
@RequiredArgsConstructor
@Slf4j
public class SelectionController {

    private final SelectionService selectionService;
    private final PlanEnricher planEnricher;
    private final SelectionCache selectionCache;

    @PostMapping
    public Mono<ResponseEntity<SelectResponse>> select(@RequestBody(required = false) SelectRequest request) {
        if (request == null) {
            return Mono.error(new InvalidRequestException("Request body is required"));
        }
        return Mono.fromCallable(() -> {
            SelectionOutcome outcome = selectionService.select(toDomain(request));
            EnrichedExecutionStep step = request.getStep() != null
                    ? planEnricher.enrich(toStep(request.getStep()), outcome.result())
                    : null;
            return ResponseEntity.ok(toResponse(outcome, step));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/cache")
    public Mono<ResponseEntity<SelectionCacheStats>> cacheStats() {
        return Mono.just(ResponseEntity.ok(selectionCache.getStats()));
    }

    @DeleteMapping("/cache")
    public Mono<ResponseEntity<Map<String, Object>>> clearCache() {
        int cleared = selectionCache.getStats().size();
        selectionCache.clear();
        log.info("[API] Selection cache cleared ({} entries)", cleared);
        return Mono.just(ResponseEntity.ok(Map.of("cleared", cleared)));
    }

    static SelectionRequest toDomain(SelectRequest request) {
        return SelectionRequest.builder()
                .capability(request.getCapability())
                .platform(request.getPlatform())
                .n(request.getN() != null ? request.getN() : 1L)
                .preferenceWeights(request.getPreferenceWeights())
                .preferenceMode(request.getPreferenceMode())
                .budget(request.getBudget() != null ? request.getBudget() : Budget.unlimited())
                .productionSafeOnly(request.getProductionSafeOnly())
                .approvalAllowed(request.getApprovalAllowed())
                .build();
    }

    private static ExecutionStep toStep(SelectRequest.StepRequest step) {
        return ExecutionStep.builder()
                .id(step.getId())
                .targetHost(step.getTargetHost())
                .inputs(step.getInputs() != null ? step.getInputs() : Map.of())
                .dependsOn(step.getDependsOn() != null ? step.getDependsOn() : List.of())
                .build();
    }

    private static SelectResponse toResponse(SelectionOutcome outcome, EnrichedExecutionStep step) {
        SelectionResult result = outcome.result();
        return SelectResponse.builder()
                .tool(result.getToolName())
                .toolVersion(result.getToolVersion())
                .pattern(result.getPatternName())
                .capability(result.getCapability())
                .platform(result.getPlatform())
                .finalScore(result.getFinalScore())
                .scoreBreakdown(result.getScoreBreakdown())
                .selectionMethod(result.getSelectionMethod())
                .justification(result.getJustification())
                .alternatives(result.getAlternatives())
                .estimatedTimeMs(result.getEstimatedTimeMs())
                .estimatedCost(result.getEstimatedCost())
                .executionMode(result.getExecutionMode())
                .slaClass(result.getSlaClass())
                .candidatesConsidered(result.getCandidatesConsidered())
                .candidatesEligible(result.getCandidatesEligible())
                .tieBreak(result.getTieBreak())
                .routing(result.getRouting())
                .inputs(result.getInputs())
                .stale(outcome.isStale())
                .source(outcome.source())
                .fingerprint(outcome.fingerprint())
                .ageMs(outcome.ageMs())
                .step(step)
                .build();
    }
}
