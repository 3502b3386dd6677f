package me.golemcore.toolrouter.adapter.inbound.web.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * One entry of {@code GET /api/catalog/tools}: the newest version of a
 * tool and the capabilities it offers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogToolSummary {
    private String name;
    private String version;
    private String description;
    private String platform;
    private String category;
    private boolean active;
    private String executionLocation;
    private List<String> capabilities;
    private Instant publishedAt;
}
