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

/**
 * Normalized [0,1] per-axis fitness of a pattern, independent of its raw cost
 * model. Higher is better on every axis (a cheap pattern has a high
 * {@code cost} score, a simple one a high {@code complexity} score).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PreferenceMatch {

    double speed;
    double accuracy;
    double cost;
    double complexity;
    double completeness;

    public double valueOf(ScoringAxis axis) {
        return switch (axis) {
        case SPEED -> speed;
        case ACCURACY -> accuracy;
        case COST -> cost;
        case COMPLEXITY -> complexity;
        case COMPLETENESS -> completeness;
        };
    }
}
