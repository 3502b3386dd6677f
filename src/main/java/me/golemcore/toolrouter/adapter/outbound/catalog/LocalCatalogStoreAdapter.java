package me.golemcore.toolrouter.adapter.outbound.catalog;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.CatalogUnavailableException;
import me.golemcore.toolrouter.domain.model.ToolDefinition;
import me.golemcore.toolrouter.port.outbound.CatalogStorePort;
import me.golemcore.toolrouter.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Durable catalog on top of {@link StoragePort}: one JSON document per
 * published version at {@code catalog/<tool>/<version>.json}.
 *
 * <p>
 * Writes go through atomic replace, so a concurrent reader sees the previous or
 * the new document. Any storage or decoding failure surfaces as
 * {@link CatalogUnavailableException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalCatalogStoreAdapter implements CatalogStorePort {

    private static final String CATALOG_DIR = "catalog";
    private static final String EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public List<ToolDefinition> findByCapability(String capability) {
        List<ToolDefinition> result = new ArrayList<>();
        for (String name : listToolNames()) {
            for (ToolDefinition tool : findVersions(name)) {
                if (tool.isActive() && tool.providesCapability(capability)) {
                    result.add(tool);
                }
            }
        }
        return result;
    }

    @Override
    public List<ToolDefinition> findVersions(String toolName) {
        List<String> files = list(toolName + "/");
        List<ToolDefinition> versions = new ArrayList<>();
        for (String file : files) {
            if (file.endsWith(EXTENSION)) {
                ToolDefinition tool = read(file);
                if (tool != null) {
                    versions.add(tool);
                }
            }
        }
        return versions;
    }

    @Override
    public Optional<ToolDefinition> findVersion(String toolName, String version) {
        return Optional.ofNullable(read(documentPath(toolName, version)));
    }

    @Override
    public List<String> listToolNames() {
        TreeSet<String> names = new TreeSet<>();
        for (String file : list("")) {
            int slash = file.indexOf('/');
            if (slash > 0 && file.endsWith(EXTENSION)) {
                names.add(file.substring(0, slash));
            }
        }
        return List.copyOf(names);
    }

    @Override
    public void save(ToolDefinition tool) {
        write(tool);
        log.debug("[CatalogStore] Saved {}", tool.getIdentity());
    }

    @Override
    public boolean setActive(String toolName, String version, boolean active) {
        ToolDefinition existing = read(documentPath(toolName, version));
        if (existing == null) {
            return false;
        }
        if (existing.isActive() != active) {
            write(existing.toBuilder().active(active).build());
            log.info("[CatalogStore] {} is now {}", existing.getIdentity(), active ? "active" : "retired");
        }
        return true;
    }

    private List<String> list(String prefix) {
        try {
            return storagePort.listObjects(CATALOG_DIR, prefix).join();
        } catch (RuntimeException e) {
            throw new CatalogUnavailableException("Cannot list catalog documents: " + rootMessage(e), e);
        }
    }

    private ToolDefinition read(String path) {
        String json;
        try {
            json = storagePort.getText(CATALOG_DIR, path).join();
        } catch (RuntimeException e) {
            throw new CatalogUnavailableException("Cannot read catalog document " + path + ": " + rootMessage(e), e);
        }
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ToolDefinition.class);
        } catch (JsonProcessingException e) {
            throw new CatalogUnavailableException("Corrupt catalog document " + path, e);
        }
    }

    private void write(ToolDefinition tool) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tool);
            storagePort.putTextAtomic(CATALOG_DIR, documentPath(tool.getName(), tool.getVersion()), json, false)
                    .join();
        } catch (JsonProcessingException | RuntimeException e) {
            throw new CatalogUnavailableException("Cannot write " + tool.getIdentity() + ": " + rootMessage(e), e);
        }
    }

    private static String documentPath(String toolName, String version) {
        return toolName + "/" + version + EXTENSION;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
