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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;
import me.golemcore.toolrouter.domain.model.ExecutionMode;
import me.golemcore.toolrouter.domain.model.InputContract;
import me.golemcore.toolrouter.domain.model.ResultSource;
import me.golemcore.toolrouter.domain.model.RoutingMetadata;
import me.golemcore.toolrouter.domain.model.ScoreBreakdown;
import me.golemcore.toolrouter.domain.model.SelectionMethod;
import me.golemcore.toolrouter.domain.model.SlaClass;
import me.golemcore.toolrouter.domain.model.TieBreakTranscript;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SelectResponse {

    private String tool;
    private String toolVersion;
    private String pattern;
    private String capability;
    private String platform;
    private double finalScore;
    private ScoreBreakdown scoreBreakdown;
    private SelectionMethod selectionMethod;
    private String justification;
    private List<String> alternatives;
    private double estimatedTimeMs;
    private double estimatedCost;
    private ExecutionMode executionMode;
    private SlaClass slaClass;
    private int candidatesConsidered;
    private int candidatesEligible;
    private TieBreakTranscript tieBreak;
    private RoutingMetadata routing;
    private InputContract inputs;
    private boolean stale;
    private ResultSource source;
    private String fingerprint;
    private long ageMs;
    private EnrichedExecutionStep step;
}
