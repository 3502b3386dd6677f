package me.golemcore.toolrouter;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore tool router.
 *
 * <p>
 * The router accepts a request for a capability, picks the tool pattern that
 * best fits a multi-criteria cost model under hard policy constraints, and
 * dispatches the resulting execution steps to the matching protocol backend.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers (selection, execution, catalog, telemetry)
 * Domain Layer       → Catalog, PolicyFilter, ScoringEngine, TieBreakEscalator,
 *                      SelectionService, PlanEnricher, ExecutionDispatcher
 * Infrastructure     → Storage, LLM, backend protocol adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code toolrouter.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ToolRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolRouterApplication.class, args);
    }

}
