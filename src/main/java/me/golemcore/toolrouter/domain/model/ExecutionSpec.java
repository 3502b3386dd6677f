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
 * Routing block of a tool definition: where the tool runs, which protocol the
 * backend speaks, and whether per-host credentials must be resolved.
 *
 * <p>
 * {@code protocolMetadata} is opaque to everything except the adapter
 * registered for {@code executionLocation}; known keys per location are
 * documented on the adapters themselves.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExecutionSpec {

    public static final String DEFAULT_LOCATION = "local";

    @Builder.Default
    String executionLocation = DEFAULT_LOCATION;

    @Builder.Default
    ProtocolType protocol = ProtocolType.LOCAL_PROCESS;

    boolean requiresCredentials;

    @Builder.Default
    Map<String, Object> protocolMetadata = Map.of();
}
