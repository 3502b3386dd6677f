package me.golemcore.toolrouter.infrastructure.config;

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

import lombok.Data;
import me.golemcore.toolrouter.domain.model.FailurePolicy;
import me.golemcore.toolrouter.domain.model.PreferenceMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the tool router, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code toolrouter.*} prefix with one
 * nested class per subsystem:
 * <ul>
 * <li>{@link CatalogProperties} - catalog cache, hot reload and seeding</li>
 * <li>{@link TieBreakProperties} - tie-break escalation</li>
 * <li>{@link SelectionProperties} - selection cache and degraded mode</li>
 * <li>{@link DispatchProperties} - plan execution</li>
 * <li>{@link CredentialProperties} - per-host credentials for backends</li>
 * <li>{@link BackendProperties} - per-location backend adapter settings</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "toolrouter")
@Data
public class ToolRouterProperties {

    private StorageProperties storage = new StorageProperties();
    private CatalogProperties catalog = new CatalogProperties();
    private ScoringProperties scoring = new ScoringProperties();
    private TieBreakProperties tieBreak = new TieBreakProperties();
    private SelectionProperties selection = new SelectionProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private TelemetryProperties telemetry = new TelemetryProperties();
    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private CredentialProperties credentials = new CredentialProperties();
    private BackendProperties backends = new BackendProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/toolrouter";
    }

    @Data
    public static class CatalogProperties {
        private int cacheMaxEntries = 1000;
        private Duration cacheTtl = Duration.ofMinutes(5);
        private Duration refreshInterval = Duration.ofMinutes(5);
        private int storePoolSize = 8;
        private Duration storeAcquireTimeout = Duration.ofSeconds(2);
        private String seedPath = "classpath:catalog/";
        private boolean seedOnStartup = true;
    }

    @Data
    public static class ScoringProperties {
        private PreferenceMode defaultPreferenceMode = PreferenceMode.BALANCED;
    }

    @Data
    public static class TieBreakProperties {
        private boolean enabled = true;
        private double epsilon = 0.02;
        private Duration timeout = Duration.ofSeconds(3);
        private int maxCandidates = 3;
        private int maxPromptChars = 4000;
        private String judge = "llm";
        private String model;
    }

    @Data
    public static class SelectionProperties {
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofSeconds(60);
        private int cacheMaxEntries = 10_000;
        private Duration staleGrace = Duration.ofMinutes(10);
        private long retryAfterBaseSeconds = 30;
        private long retryAfterMaxSeconds = 300;
        private boolean requireProductionSafe = false;
    }

    @Data
    public static class DispatchProperties {
        private String defaultLocation = "local";
        private FailurePolicy defaultFailurePolicy = FailurePolicy.ABORT_ON_FIRST_FAILURE;
        private int maxConcurrency = 50;
        private Duration defaultStepTimeout = Duration.ofMinutes(5);
        private Duration planTimeout;
        private int maxRetainedPlans = 500;
    }

    @Data
    public static class TelemetryProperties {
        private boolean enabled = true;
        private int queueCapacity = 10_000;
        private Duration retention = Duration.ofDays(30);
    }

    @Data
    public static class LlmProperties {
        private String provider = "none";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        private Map<String, ProviderProperties> providers = new HashMap<>();
        private long timeoutMs = 30_000;
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class CredentialProperties {
        private Map<String, HostCredentialProperties> hosts = new HashMap<>();
    }

    @Data
    public static class HostCredentialProperties {
        private String username;
        private String password;
        private String identityFile;
        private String domain;
    }

    @Data
    public static class BackendProperties {
        private SshProperties ssh = new SshProperties();
        private WinRmProperties winrm = new WinRmProperties();
        private HttpBackendProperties http = new HttpBackendProperties();
        private DatabaseProperties database = new DatabaseProperties();
    }

    @Data
    public static class SshProperties {
        private String binary = "ssh";
        private int port = 22;
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class WinRmProperties {
        private int port = 5985;
        private boolean https = false;
        private String shell = "cmd";
    }

    @Data
    public static class HttpBackendProperties {
        private String baseUrl;
    }

    @Data
    public static class DatabaseProperties {
        private String url;
        private int maxRows = 1000;
    }
}
