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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * A published, immutable version of a tool: identity, platform and category
 * tags, routing block, and the capabilities it offers.
 *
 * <p>
 * A new version is a new record; the only lifecycle change allowed on a
 * published version is retirement ({@code active=false}), which keeps the
 * record for telemetry references.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ToolDefinition {

    String name;
    String version;
    String description;
    String platform;
    String category;

    @Builder.Default
    boolean active = true;

    @Builder.Default
    ExecutionSpec execution = ExecutionSpec.builder().build();

    @Builder.Default
    Map<String, CapabilityBlock> capabilities = Map.of();

    Instant publishedAt;

    @JsonIgnore
    public SemanticVersion getSemanticVersion() {
        return SemanticVersion.parse(version);
    }

    @JsonIgnore
    public String getIdentity() {
        return name + "@" + version;
    }

    public boolean providesCapability(String capability) {
        return capabilities.containsKey(capability);
    }

    public boolean matchesPlatform(String platformFilter) {
        return platformFilter == null || platformFilter.isBlank()
                || platformFilter.equalsIgnoreCase(platform);
    }
}
