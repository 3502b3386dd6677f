package me.golemcore.toolrouter.port.outbound;

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

import me.golemcore.toolrouter.domain.exception.CatalogUnavailableException;
import me.golemcore.toolrouter.domain.model.ToolDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Port for the durable tool catalog. Implementations hold every published
 * version of every tool; choosing the version to serve is the catalog
 * service's job.
 *
 * <p>
 * Every read throws {@link CatalogUnavailableException} when the store cannot
 * be reached, so callers can tell an outage apart from an empty answer.
 */
public interface CatalogStorePort {

    /**
     * Returns every active tool version that provides {@code capability}.
     */
    List<ToolDefinition> findByCapability(String capability);

    /**
     * Returns every stored version of a tool, active or retired.
     */
    List<ToolDefinition> findVersions(String toolName);

    Optional<ToolDefinition> findVersion(String toolName, String version);

    List<String> listToolNames();

    /**
     * Stores a new version. Versions are immutable; callers check for an
     * existing version before saving.
     */
    void save(ToolDefinition tool);

    /**
     * Flips the active flag of a stored version.
     *
     * @return false if the version does not exist
     */
    boolean setActive(String toolName, String version, boolean active);
}
