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
import me.golemcore.toolrouter.adapter.inbound.web.dto.ExecuteRequest;
import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.model.ExecutionPlan;
import me.golemcore.toolrouter.domain.model.PlanResult;
import me.golemcore.toolrouter.domain.service.ExecutionDispatcher;
import me.golemcore.toolrouter.domain.service.PlanRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Plan execution, status and cancellation.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ExecutionController {

    private final ExecutionDispatcher dispatcher;
    private final PlanRegistry planRegistry;

    @PostMapping("/execute")
    public Mono<ResponseEntity<PlanResult>> execute(@RequestBody(required = false) ExecuteRequest request) {
        if (request == null) {
            return Mono.error(new InvalidRequestException("Request body is required"));
        }
        ExecutionPlan plan = ExecutionPlan.builder()
                .planId(request.getPlanId())
                .steps(request.getSteps() != null ? request.getSteps() : List.of())
                .failurePolicy(request.getFailurePolicy())
                .planTimeoutMs(request.getPlanTimeoutMs())
                .maxConcurrency(request.getMaxConcurrency())
                .build();
        return Mono.fromCallable(() -> ResponseEntity.ok(dispatcher.dispatch(plan)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/plans/{planId}")
    public Mono<ResponseEntity<PlanResult>> getPlan(@PathVariable String planId) {
        return Mono.justOrEmpty(planRegistry.getResult(planId))
                .map(ResponseEntity::ok)
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Plan not found: " + planId)));
    }

    @PostMapping("/plans/{planId}/cancel")
    public Mono<ResponseEntity<Map<String, Object>>> cancelPlan(@PathVariable String planId) {
        if (!planRegistry.cancel(planId)) {
            return Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "No running plan with id " + planId));
        }
        return Mono.just(ResponseEntity.ok(Map.of("planId", planId, "cancelled", true)));
    }
}
