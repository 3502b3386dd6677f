package me.golemcore.toolrouter.adapter.outbound.llm;

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

import me.golemcore.toolrouter.port.outbound.LlmPort;

/**
 * LLM provider managed by {@link LlmAdapterFactory}. Each provider registers
 * under a unique id that {@code toolrouter.llm.provider} can name.
 */
public interface LlmProviderAdapter extends LlmPort {

    /**
     * Provider id, e.g. "langchain4j" or "none".
     */
    @Override
    String getProviderId();

    /**
     * Whether this adapter can serve requests, e.g. an API key is configured.
     */
    @Override
    boolean isAvailable();
}
