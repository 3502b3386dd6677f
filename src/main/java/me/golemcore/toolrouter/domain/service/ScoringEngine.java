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
import me.golemcore.toolrouter.domain.model.AxisScore;
import me.golemcore.toolrouter.domain.model.Budget;
import me.golemcore.toolrouter.domain.model.Candidate;
import me.golemcore.toolrouter.domain.model.PreferenceMatch;
import me.golemcore.toolrouter.domain.model.PreferenceWeights;
import me.golemcore.toolrouter.domain.model.ScoreBreakdown;
import me.golemcore.toolrouter.domain.model.ScoredCandidate;
import me.golemcore.toolrouter.domain.model.ScoringAxis;
import me.golemcore.toolrouter.domain.model.SelectionRequest;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic multi-criteria ranking of eligible candidates.
 *
 * <p>
 * The composite score is the weighted sum of the five preference-match axes,
 * with weights normalized to sum to one. Speed and cost are scaled down when
 * the pattern's cost model at the request's {@code N} exceeds the budget: the
 * multiplier is {@code budget / modeled}, so a candidate twice over budget
 * keeps half its axis score. Nothing is excluded here.
 *
 * <p>
 * Ranking is by composite descending, then by candidate key ascending, and
 * the axes are always summed in {@link ScoringAxis} order, so identical inputs
 * give bit-identical output.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScoringEngine {

    private static final Comparator<ScoredCandidate> RANKING = Comparator
            .comparingDouble(ScoredCandidate::composite).reversed()
            .thenComparing(ScoredCandidate::key);

    private final ToolRouterProperties properties;

    public List<ScoredCandidate> score(List<Candidate> candidates, SelectionRequest request) {
        PreferenceWeights weights = request
                .effectiveWeights(properties.getScoring().getDefaultPreferenceMode())
                .normalized();
        Budget budget = request.getBudget() != null ? request.getBudget() : Budget.unlimited();

        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            scored.add(new ScoredCandidate(candidate, breakdown(candidate, request.getN(), weights, budget)));
        }
        scored.sort(RANKING);

        if (log.isDebugEnabled()) {
            for (ScoredCandidate s : scored) {
                log.debug("[Scoring] {} -> {} (time={}ms, cost={}, speedPenalty={}, costPenalty={})",
                        s.key(), String.format("%.4f", s.composite()), s.breakdown().getModeledTimeMs(),
                        s.breakdown().getModeledCost(), s.breakdown().getSpeedPenalty(),
                        s.breakdown().getCostPenalty());
            }
        }
        return List.copyOf(scored);
    }

    private ScoreBreakdown breakdown(Candidate candidate, long n, PreferenceWeights weights, Budget budget) {
        double timeMs = candidate.getPattern().estimateTimeMs(n);
        double cost = candidate.getPattern().estimateCost(n);
        double speedPenalty = penalty(timeMs, budget.maxTimeMs());
        double costPenalty = penalty(cost, budget.maxCost());

        PreferenceMatch match = candidate.getPattern().getPreferenceMatch();
        Map<ScoringAxis, AxisScore> axes = new EnumMap<>(ScoringAxis.class);
        double composite = 0.0;
        for (ScoringAxis axis : ScoringAxis.values()) {
            double raw = match != null ? clamp(match.valueOf(axis)) : 0.0;
            double adjusted = switch (axis) {
            case SPEED -> raw * speedPenalty;
            case COST -> raw * costPenalty;
            default -> raw;
            };
            double weight = weights.valueOf(axis);
            double contribution = weight * adjusted;
            composite += contribution;
            axes.put(axis, new AxisScore(raw, adjusted, weight, contribution));
        }

        return ScoreBreakdown.builder()
                .axes(axes)
                .composite(composite)
                .modeledTimeMs(timeMs)
                .modeledCost(cost)
                .speedPenalty(speedPenalty)
                .costPenalty(costPenalty)
                .build();
    }

    /**
     * Multiplier in [0,1]: 1 within budget, {@code limit / modeled} beyond it.
     */
    static double penalty(double modeled, Double limit) {
        if (limit == null || modeled <= limit) {
            return 1.0;
        }
        if (limit <= 0) {
            return 0.0;
        }
        return clamp(limit / modeled);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
