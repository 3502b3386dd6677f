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

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Outcome of resolving a selection request. Instances are immutable and are
 * the value stored in the selection cache, so a cache hit returns exactly the
 * object produced by the original resolution.
 *
 * <p>
 * {@code tieBreak} is present only when escalation was attempted.
 * {@code catalogStale} records that the candidates came from last-known-good
 * catalog data while the store was unreachable.
 */
@Value
@Builder
@Jacksonized
public class SelectionResult {

    String capability;
    String toolName;
    String toolVersion;
    String patternName;
    String platform;
    double finalScore;
    ScoreBreakdown scoreBreakdown;
    SelectionMethod selectionMethod;
    TieBreakTranscript tieBreak;
    String justification;

    @Builder.Default
    List<String> alternatives = List.of();

    double estimatedTimeMs;
    double estimatedCost;
    ExecutionMode executionMode;
    SlaClass slaClass;
    int candidatesConsidered;
    int candidatesEligible;
    RoutingMetadata routing;
    InputContract inputs;
    boolean catalogStale;

    public String candidateKey() {
        return toolName + "." + patternName;
    }
}
