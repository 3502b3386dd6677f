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
import java.util.Map;

/**
 * An execution step carrying everything the dispatcher needs, stamped once at
 * selection time by the plan enricher.
 *
 * <p>
 * The dispatcher treats {@code executionLocation}, {@code requiresCredentials},
 * {@code protocolMetadata} and {@code timeoutMs} as the sole source of truth
 * and never consults the catalog to recompute them.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EnrichedExecutionStep {

    String id;
    String toolName;
    String toolVersion;
    String patternName;
    String capability;
    String targetHost;

    @Builder.Default
    Map<String, Object> inputs = Map.of();

    @Builder.Default
    List<String> dependsOn = List.of();

    boolean requiresCredentials;
    String executionLocation;
    ProtocolType protocol;

    @Builder.Default
    Map<String, Object> protocolMetadata = Map.of();

    CredentialHandle credentialHandle;
    Long timeoutMs;
    Double estimatedCost;

    // An explicit JSON null bypasses the builder defaults.
    public Map<String, Object> getInputs() {
        return inputs != null ? inputs : Map.of();
    }

    public List<String> getDependsOn() {
        return dependsOn != null ? dependsOn : List.of();
    }

    public Map<String, Object> getProtocolMetadata() {
        return protocolMetadata != null ? protocolMetadata : Map.of();
    }
}
