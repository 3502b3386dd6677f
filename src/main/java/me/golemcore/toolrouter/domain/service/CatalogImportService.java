package me.golemcore.toolrouter.domain.service;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.CatalogUnavailableException;
import me.golemcore.toolrouter.domain.exception.CatalogValidationException;
import me.golemcore.toolrouter.domain.model.ImportReport;
import me.golemcore.toolrouter.domain.model.ToolDefinition;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.CatalogStorePort;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Administrative entry point that validates tool definitions and writes new
 * versions to the durable catalog.
 *
 * <p>
 * Published versions are immutable: re-importing identical content is a no-op,
 * while different content under an existing version is rejected. A successful
 * import triggers a catalog hot reload so the new version is visible to the
 * next selection.
 */
@Service
@Slf4j
public class CatalogImportService {

    private final CatalogStorePort store;
    private final CatalogService catalogService;
    private final ToolDefinitionValidator validator;
    private final ObjectMapper objectMapper;
    private final ToolRouterProperties.CatalogProperties config;
    private final Clock clock;
    private final ResourcePatternResolver resourceResolver = new PathMatchingResourcePatternResolver();

    public CatalogImportService(CatalogStorePort store, CatalogService catalogService,
            ToolDefinitionValidator validator, ObjectMapper objectMapper, ToolRouterProperties properties,
            Clock clock) {
        this.store = store;
        this.catalogService = catalogService;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.config = properties.getCatalog();
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        if (config.isSeedOnStartup()) {
            seedFromClasspath();
        }
    }

    /**
     * Validates a definition and, unless {@code dryRun}, stores it as a new
     * active version.
     *
     * @throws CatalogValidationException
     *             if the definition is invalid or conflicts with a stored version
     */
    public ImportReport importTool(ToolDefinition tool, boolean dryRun) {
        if (tool == null) {
            throw new CatalogValidationException("<empty>", List.of("tool definition is required"));
        }
        ToolDefinitionValidator.Validation validation = validator.validate(tool);
        if (!validation.isValid()) {
            log.info("[Import] Rejected {}: {} violation(s)", tool.getIdentity(), validation.violations().size());
            throw new CatalogValidationException(tool.getIdentity(), validation.violations());
        }

        Optional<ToolDefinition> existing = store.findVersion(tool.getName(), tool.getVersion());
        if (existing.isPresent()) {
            if (!sameContent(existing.get(), tool)) {
                throw new CatalogValidationException(tool.getIdentity(), List.of(
                        "version " + tool.getVersion() + " is already published with different content;"
                                + " publish a new version instead"));
            }
            log.debug("[Import] {} already published, nothing to do", tool.getIdentity());
            return report(tool, dryRun, ImportReport.Outcome.UNCHANGED, validation);
        }

        if (dryRun) {
            log.info("[Import] Dry run passed for {}", tool.getIdentity());
            return report(tool, true, ImportReport.Outcome.VALIDATED, validation);
        }

        store.save(tool.toBuilder().active(true).publishedAt(clock.instant()).build());
        log.info("[Import] Published {}", tool.getIdentity());
        catalogService.refresh();
        return report(tool, false, ImportReport.Outcome.CREATED, validation);
    }

    /**
     * Imports every bundled definition whose tool has no stored version yet.
     *
     * @return number of tools imported
     */
    public int seedFromClasspath() {
        String location = config.getSeedPath().endsWith("/")
                ? config.getSeedPath() + "*.json"
                : config.getSeedPath() + "/*.json";
        Resource[] resources;
        try {
            resources = resourceResolver.getResources(location);
        } catch (IOException e) {
            log.warn("[Import] Cannot list seed definitions at {}: {}", location, e.getMessage());
            return 0;
        }

        int imported = 0;
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                ToolDefinition tool = objectMapper.readValue(in, ToolDefinition.class);
                if (!store.findVersions(tool.getName()).isEmpty()) {
                    log.debug("[Import] Seed {} skipped, tool already in catalog", tool.getIdentity());
                    continue;
                }
                importTool(tool, false);
                imported++;
            } catch (IOException | CatalogValidationException | CatalogUnavailableException e) {
                log.warn("[Import] Failed to import seed {}: {}", resource.getFilename(), e.getMessage());
            }
        }
        log.info("[Import] Seeded {} tool(s) from {}", imported, location);
        return imported;
    }

    private static boolean sameContent(ToolDefinition stored, ToolDefinition submitted) {
        return normalize(stored).equals(normalize(submitted));
    }

    private static ToolDefinition normalize(ToolDefinition tool) {
        return tool.toBuilder().active(true).publishedAt(null).build();
    }

    private static ImportReport report(ToolDefinition tool, boolean dryRun, ImportReport.Outcome outcome,
            ToolDefinitionValidator.Validation validation) {
        return ImportReport.builder()
                .toolName(tool.getName())
                .version(tool.getVersion())
                .dryRun(dryRun)
                .outcome(outcome)
                .warnings(validation.warnings())
                .build();
    }
}
