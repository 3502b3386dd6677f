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

/**
 * A request for one capability at a given scale.
 *
 * <p>
 * When neither {@code preferenceWeights} nor {@code preferenceMode} is given
 * the configured default mode applies. {@code productionSafeOnly} and
 * {@code approvalAllowed} are optional overrides of the configured policy
 * context.
 */
@Value
@Builder(toBuilder = true)
public class SelectionRequest {

    String capability;
    String platform;

    @Builder.Default
    long n = 1;

    PreferenceWeights preferenceWeights;
    PreferenceMode preferenceMode;

    @Builder.Default
    Budget budget = Budget.unlimited();

    Boolean productionSafeOnly;
    Boolean approvalAllowed;

    /**
     * Effective (not yet normalized) weights: explicit weights win over a mode,
     * and {@code defaultMode} applies when the request names neither.
     */
    public PreferenceWeights effectiveWeights(PreferenceMode defaultMode) {
        if (preferenceWeights != null) {
            return preferenceWeights;
        }
        if (preferenceMode != null) {
            return preferenceMode.weights();
        }
        return defaultMode != null ? defaultMode.weights() : PreferenceWeights.balanced();
    }
}
