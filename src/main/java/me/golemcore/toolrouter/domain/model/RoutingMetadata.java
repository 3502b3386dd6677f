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
 * Routing fields resolved once, at selection time, from the exact tool version
 * that was scored. Copied verbatim onto enriched execution steps.
 */
@Value
@Builder
@Jacksonized
public class RoutingMetadata {

    String executionLocation;
    ProtocolType protocol;
    boolean requiresCredentials;

    @Builder.Default
    Map<String, Object> protocolMetadata = Map.of();

    long timeoutMs;
}
