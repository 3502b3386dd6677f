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

/**
 * Caller-supplied weights per scoring axis. Values need not sum to one;
 * {@link #normalized()} rescales them.
 */
public record PreferenceWeights(double speed, double accuracy, double cost, double complexity,
        double completeness) {

    public static PreferenceWeights balanced() {
        return PreferenceMode.BALANCED.weights();
    }

    public double valueOf(ScoringAxis axis) {
        return switch (axis) {
        case SPEED -> speed;
        case ACCURACY -> accuracy;
        case COST -> cost;
        case COMPLEXITY -> complexity;
        case COMPLETENESS -> completeness;
        };
    }

    public double sum() {
        return speed + accuracy + cost + complexity + completeness;
    }

    public boolean hasNegative() {
        return speed < 0 || accuracy < 0 || cost < 0 || complexity < 0 || completeness < 0;
    }

    /**
     * Returns weights rescaled to sum to one.
     *
     * @throws IllegalStateException
     *             if the weights do not have a positive sum
     */
    public PreferenceWeights normalized() {
        double total = sum();
        if (!(total > 0) || Double.isInfinite(total)) {
            throw new IllegalStateException("Preference weights must have a positive sum");
        }
        return new PreferenceWeights(speed / total, accuracy / total, cost / total,
                complexity / total, completeness / total);
    }
}
