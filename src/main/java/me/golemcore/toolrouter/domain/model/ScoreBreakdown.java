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

import java.util.Map;

/**
 * Full explanation of a candidate's composite score.
 *
 * <p>
 * {@code speedPenalty} and {@code costPenalty} are the multipliers (in [0,1])
 * applied when the modeled time or cost at the request's {@code N} exceeds the
 * budget; 1.0 means no penalty.
 */
@Value
@Builder
@Jacksonized
public class ScoreBreakdown {

    Map<ScoringAxis, AxisScore> axes;
    double composite;
    double modeledTimeMs;
    double modeledCost;

    @Builder.Default
    double speedPenalty = 1.0;

    @Builder.Default
    double costPenalty = 1.0;

    /**
     * Axis with the largest weighted contribution; earliest axis wins on equal
     * contributions.
     */
    public ScoringAxis dominantAxis() {
        ScoringAxis dominant = null;
        double best = Double.NEGATIVE_INFINITY;
        for (ScoringAxis axis : ScoringAxis.values()) {
            AxisScore score = axes.get(axis);
            if (score != null && score.contribution() > best) {
                best = score.contribution();
                dominant = axis;
            }
        }
        return dominant;
    }
}
