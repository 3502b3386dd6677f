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
 * Audit record of a tie-break escalation: what was asked, what came back, and
 * which candidate won.
 */
@Value
@Builder
@Jacksonized
public class TieBreakTranscript {

    List<String> presentedCandidates;
    String prompt;
    String rawResponse;
    TieBreakResolution resolution;
    String chosenCandidate;
    String reason;
    String error;
    long latencyMs;
}
