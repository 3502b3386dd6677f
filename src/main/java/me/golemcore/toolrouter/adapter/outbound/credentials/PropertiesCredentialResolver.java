package me.golemcore.toolrouter.adapter.outbound.credentials;

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
import me.golemcore.toolrouter.domain.model.CredentialHandle;
import me.golemcore.toolrouter.domain.model.HostCredentials;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.CredentialResolverPort;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves host credentials from {@code toolrouter.credentials.hosts.<host>}.
 * Host names match case-insensitively; a {@code default} entry, when present,
 * serves hosts with no entry of their own.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PropertiesCredentialResolver implements CredentialResolverPort {

    static final String DEFAULT_ENTRY = "default";

    private final ToolRouterProperties properties;

    @Override
    public Optional<HostCredentials> resolve(CredentialHandle handle) {
        if (handle == null || handle.host() == null) {
            return Optional.empty();
        }
        Map<String, ToolRouterProperties.HostCredentialProperties> hosts = properties.getCredentials().getHosts();
        ToolRouterProperties.HostCredentialProperties entry = hosts.get(handle.host());
        if (entry == null) {
            String wanted = handle.host().toLowerCase(Locale.ROOT);
            entry = hosts.entrySet().stream()
                    .filter(e -> e.getKey().toLowerCase(Locale.ROOT).equals(wanted))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(hosts.get(DEFAULT_ENTRY));
        }
        if (entry == null) {
            log.debug("[Credentials] No credentials for {}", handle.host());
            return Optional.empty();
        }
        return Optional.of(new HostCredentials(handle.host(), entry.getUsername(), entry.getPassword(),
                entry.getIdentityFile(), entry.getDomain()));
    }
}
