package me.golemcore.toolrouter.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.adapter.inbound.web.dto.CatalogToolSummary;
import me.golemcore.toolrouter.domain.exception.CatalogValidationException;
import me.golemcore.toolrouter.domain.model.CatalogStatus;
import me.golemcore.toolrouter.domain.model.ImportReport;
import me.golemcore.toolrouter.domain.model.ToolDefinition;
import me.golemcore.toolrouter.domain.service.CatalogImportService;
import me.golemcore.toolrouter.domain.service.CatalogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog administration: import, queries, retirement and hot reload.
 */
@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
@Slf4j
public class CatalogController {

    private final CatalogService catalogService;
    private final CatalogImportService importService;

    @PostMapping("/import")
    public Mono<ResponseEntity<ImportReport>> importTool(@RequestBody(required = false) ToolDefinition tool,
            @RequestParam(defaultValue = "false") boolean dryRun) {
        if (tool == null) {
            return Mono.error(new CatalogValidationException("<empty>", List.of("tool definition is required")));
        }
        return Mono.fromCallable(() -> {
            ImportReport report = importService.importTool(tool, dryRun);
            HttpStatus status = report.getOutcome() == ImportReport.Outcome.CREATED ? HttpStatus.CREATED
                    : HttpStatus.OK;
            return ResponseEntity.status(status).body(report);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/tools")
    public Mono<ResponseEntity<List<CatalogToolSummary>>> listTools() {
        return Mono.fromCallable(() -> ResponseEntity.ok(catalogService.listTools().stream()
                .map(CatalogController::toSummary)
                .toList()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/tools/{name}")
    public Mono<ResponseEntity<ToolDefinition>> getTool(@PathVariable String name,
            @RequestParam(required = false) String version) {
        return Mono.fromCallable(() -> {
            Optional<ToolDefinition> tool = version != null
                    ? catalogService.getVersion(name, version)
                    : catalogService.getByName(name);
            return tool.map(ResponseEntity::ok)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                            "Tool not found: " + name + (version != null ? "@" + version : "")));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/tools/{name}/{version}/retire")
    public Mono<ResponseEntity<Map<String, Object>>> retire(@PathVariable String name,
            @PathVariable String version) {
        return Mono.fromCallable(() -> {
            if (!catalogService.retire(name, version)) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Tool not found: " + name + "@" + version);
            }
            return ResponseEntity.ok(Map.<String, Object>of("tool", name, "version", version, "active", false));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/reload")
    public Mono<ResponseEntity<Map<String, Object>>> reload() {
        return Mono.fromCallable(() -> {
            int failures = catalogService.refresh();
            log.info("[API] Catalog reload requested, {} lookup(s) failed", failures);
            return ResponseEntity.ok(Map.<String, Object>of("failedLookups", failures,
                    "status", catalogService.getStatus()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<CatalogStatus>> status() {
        return Mono.just(ResponseEntity.ok(catalogService.getStatus()));
    }

    private static CatalogToolSummary toSummary(ToolDefinition tool) {
        return CatalogToolSummary.builder()
                .name(tool.getName())
                .version(tool.getVersion())
                .description(tool.getDescription())
                .platform(tool.getPlatform())
                .category(tool.getCategory())
                .active(tool.isActive())
                .executionLocation(tool.getExecution().getExecutionLocation())
                .capabilities(tool.getCapabilities().keySet().stream().sorted().toList())
                .publishedAt(tool.getPublishedAt())
                .build();
    }
}
