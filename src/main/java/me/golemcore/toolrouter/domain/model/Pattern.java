package me.golemcore.toolrouter.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import me.golemcore.toolrouter.domain.costmodel.CostExpression;

import java.util.List;

/**
 * One concrete way of fulfilling a capability, and the unit the scoring engine
 * ranks.
 *
 * <p>
 * Time and cost estimates are expressions over the item count {@code N} (see
 * {@link CostExpression}); catalog import guarantees both are non-decreasing
 * in {@code N}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Pattern {

    String description;

    @Builder.Default
    List<String> typicalUseCases = List.of();

    String timeEstimateMs;
    String costEstimate;
    double complexityScore;

    @Builder.Default
    Completeness completeness = Completeness.EXACT;

    @Builder.Default
    List<String> limitations = List.of();

    @Builder.Default
    PatternPolicy policy = PatternPolicy.unrestricted();

    PreferenceMatch preferenceMatch;

    @Builder.Default
    List<InputParameter> requiredInputs = List.of();

    @Builder.Default
    List<InputParameter> optionalInputs = List.of();

    @JsonIgnore
    public double estimateTimeMs(long n) {
        return CostExpression.compile(timeEstimateMs).evaluate(n);
    }

    @JsonIgnore
    public double estimateCost(long n) {
        return CostExpression.compile(costEstimate).evaluate(n);
    }
}
