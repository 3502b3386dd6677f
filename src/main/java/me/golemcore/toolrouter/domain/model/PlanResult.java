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

import java.time.Instant;
import java.util.List;

/**
 * Per-step results of a plan, its overall status, and the failure policy that
 * produced that status.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PlanResult {

    String planId;
    PlanStatus overallStatus;
    FailurePolicy failurePolicy;
    List<StepResult> stepResults;
    Instant startedAt;
    Instant finishedAt;
    long durationMs;

    public long countWithStatus(StepStatus status) {
        return stepResults.stream().filter(r -> r.getStatus() == status).count();
    }
}
