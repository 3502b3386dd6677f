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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.BackendAdapterPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backend adapters indexed by execution location.
 *
 * <p>
 * Lookup is by exact location key; an unknown location resolves to the
 * configured default backend instead of failing the plan.
 */
@Component
@Slf4j
public class BackendRegistry {

    private final Map<String, BackendAdapterPort> adaptersByLocation = new ConcurrentHashMap<>();
    private final String defaultLocation;

    public BackendRegistry(List<BackendAdapterPort> adapters, ToolRouterProperties properties) {
        for (BackendAdapterPort adapter : adapters) {
            BackendAdapterPort previous = adaptersByLocation.putIfAbsent(adapter.getLocation(), adapter);
            if (previous != null) {
                log.warn("[Dispatch] Duplicate backend for location '{}', keeping {}", adapter.getLocation(),
                        previous.getClass().getSimpleName());
            } else {
                log.debug("[Dispatch] Registered backend: {}", adapter.getLocation());
            }
        }
        this.defaultLocation = properties.getDispatch().getDefaultLocation();
        log.info("[Dispatch] Backends: {} (default: {})", new TreeSet<>(adaptersByLocation.keySet()),
                defaultLocation);
    }

    /**
     * Returns the adapter for {@code location}, or the default backend.
     *
     * @throws IllegalStateException
     *             if neither exists
     */
    public BackendAdapterPort resolve(String location) {
        BackendAdapterPort adapter = location != null ? adaptersByLocation.get(location) : null;
        if (adapter != null) {
            return adapter;
        }
        BackendAdapterPort fallback = adaptersByLocation.get(defaultLocation);
        if (fallback == null) {
            throw new IllegalStateException("No backend for location '" + location
                    + "' and default backend '" + defaultLocation + "' is not registered");
        }
        log.warn("[Dispatch] Unknown execution location '{}', using default backend '{}'", location,
                defaultLocation);
        return fallback;
    }

    public Optional<BackendAdapterPort> find(String location) {
        return Optional.ofNullable(adaptersByLocation.get(location));
    }

    public Set<String> getLocations() {
        return new TreeSet<>(adaptersByLocation.keySet());
    }
}
