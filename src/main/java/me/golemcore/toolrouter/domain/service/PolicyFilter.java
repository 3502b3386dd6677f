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
import me.golemcore.toolrouter.domain.costmodel.CostExpressionException;
import me.golemcore.toolrouter.domain.model.Budget;
import me.golemcore.toolrouter.domain.model.Candidate;
import me.golemcore.toolrouter.domain.model.PatternPolicy;
import me.golemcore.toolrouter.domain.model.PolicyFilterResult;
import me.golemcore.toolrouter.domain.model.PolicyRejection;
import me.golemcore.toolrouter.domain.model.PolicyViolation;
import me.golemcore.toolrouter.domain.model.SelectionRequest;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes candidates whose pattern policy violates a hard constraint for the
 * request. Pure and order-preserving: it never re-ranks, and it records one
 * reason per removed candidate.
 *
 * <p>
 * Checked constraints, in order: production safety (request flag or
 * {@code toolrouter.selection.require-production-safe}), approval (only when
 * the request sets {@code approvalAllowed=false}), the pattern's own cost and
 * time ceilings, and the request's cost budget. The request's time budget is
 * not a hard constraint; the scoring engine penalizes it instead.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PolicyFilter {

    private final ToolRouterProperties properties;

    public PolicyFilterResult filter(List<Candidate> candidates, SelectionRequest request) {
        boolean productionSafeOnly = request.getProductionSafeOnly() != null
                ? request.getProductionSafeOnly()
                : properties.getSelection().isRequireProductionSafe();
        boolean approvalAllowed = request.getApprovalAllowed() == null || request.getApprovalAllowed();
        Budget budget = request.getBudget() != null ? request.getBudget() : Budget.unlimited();

        List<Candidate> eligible = new ArrayList<>();
        List<PolicyRejection> rejections = new ArrayList<>();
        for (Candidate candidate : candidates) {
            PolicyRejection rejection = check(candidate, request.getN(), budget, productionSafeOnly,
                    approvalAllowed);
            if (rejection == null) {
                eligible.add(candidate);
            } else {
                log.debug("[Policy] Excluded {}: {} ({})", candidate.key(), rejection.violation(),
                        rejection.detail());
                rejections.add(rejection);
            }
        }
        return new PolicyFilterResult(request.getCapability(), List.copyOf(eligible), List.copyOf(rejections));
    }

    private PolicyRejection check(Candidate candidate, long n, Budget budget, boolean productionSafeOnly,
            boolean approvalAllowed) {
        PatternPolicy policy = candidate.getPattern().getPolicy();
        String key = candidate.key();

        if (productionSafeOnly && !policy.isProductionSafe()) {
            return new PolicyRejection(key, PolicyViolation.NOT_PRODUCTION_SAFE, "pattern is not production safe");
        }
        if (!approvalAllowed && policy.isRequiresApproval()) {
            return new PolicyRejection(key, PolicyViolation.APPROVAL_NOT_ALLOWED,
                    "pattern requires human approval");
        }

        double cost;
        double timeMs;
        try {
            cost = candidate.getPattern().estimateCost(n);
            timeMs = candidate.getPattern().estimateTimeMs(n);
        } catch (CostExpressionException e) {
            log.warn("[Policy] Cost model of {} cannot be evaluated: {}", key, e.getMessage());
            return new PolicyRejection(key, PolicyViolation.INVALID_COST_MODEL, e.getMessage());
        }

        if (policy.getMaxCost() != null && cost > policy.getMaxCost()) {
            return new PolicyRejection(key, PolicyViolation.COST_EXCEEDS_POLICY_MAX,
                    "cost " + format(cost) + " > policy max " + format(policy.getMaxCost()));
        }
        if (policy.getMaxExecutionTimeMs() != null && timeMs > policy.getMaxExecutionTimeMs()) {
            return new PolicyRejection(key, PolicyViolation.TIME_EXCEEDS_POLICY_MAX,
                    "time " + format(timeMs) + "ms > policy max " + policy.getMaxExecutionTimeMs() + "ms");
        }
        if (budget.maxCost() != null && cost > budget.maxCost()) {
            return new PolicyRejection(key, PolicyViolation.COST_EXCEEDS_BUDGET,
                    "cost " + format(cost) + " > budget " + format(budget.maxCost()));
        }
        return null;
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
