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

/**
 * Uniform result of one step regardless of the backend protocol that ran it.
 * {@code observedCost} is reported by adapters that can meter the call.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StepResult {

    String stepId;
    String toolName;
    String executionLocation;
    StepStatus status;
    String output;
    String error;
    Integer exitCode;
    Double observedCost;
    Instant startedAt;
    long durationMs;

    public static StepResult success(String output) {
        return StepResult.builder().status(StepStatus.SUCCEEDED).output(output).build();
    }

    public static StepResult success(String output, Integer exitCode) {
        return StepResult.builder().status(StepStatus.SUCCEEDED).output(output).exitCode(exitCode).build();
    }

    public static StepResult failure(String error) {
        return StepResult.builder().status(StepStatus.FAILED).error(error).build();
    }

    public static StepResult failure(String error, String output, Integer exitCode) {
        return StepResult.builder().status(StepStatus.FAILED).error(error).output(output).exitCode(exitCode).build();
    }

    public static StepResult skipped(String stepId, String reason) {
        return StepResult.builder().stepId(stepId).status(StepStatus.SKIPPED).error(reason).build();
    }

    public boolean isSuccess() {
        return status == StepStatus.SUCCEEDED;
    }
}
