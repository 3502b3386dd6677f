package me.golemcore.toolrouter.adapter.inbound.web.dto;

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

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.toolrouter.domain.model.Budget;
import me.golemcore.toolrouter.domain.model.PreferenceMode;
import me.golemcore.toolrouter.domain.model.PreferenceWeights;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/select}. {@code N} defaults to 1. When {@code step}
 * is present the response also carries the enriched step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SelectRequest {

    private String capability;
    private String platform;

    @JsonAlias("N")
    private Long n;

    private PreferenceWeights preferenceWeights;
    private PreferenceMode preferenceMode;
    private Budget budget;
    private Boolean productionSafeOnly;
    private Boolean approvalAllowed;
    private StepRequest step;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StepRequest {
        private String id;
        private String targetHost;
        private Map<String, Object> inputs;
        private List<String> dependsOn;
    }
}
