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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.CatalogUnavailableException;
import me.golemcore.toolrouter.domain.model.CandidateSet;
import me.golemcore.toolrouter.domain.model.Candidate;
import me.golemcore.toolrouter.domain.model.CapabilityBlock;
import me.golemcore.toolrouter.domain.model.CatalogStatus;
import me.golemcore.toolrouter.domain.model.Pattern;
import me.golemcore.toolrouter.domain.model.ToolDefinition;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.CatalogStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Catalog store adapter: candidate lookups by capability and platform, and
 * point lookups by tool name, served from a bounded, time-expiring cache in
 * front of the durable {@link CatalogStorePort}.
 *
 * <p>
 * The cache is an immutable {@link Snapshot} behind an
 * {@link AtomicReference}. Misses publish a copy with the new entry, and the
 * background refresh publishes a wholly rebuilt snapshot, so readers never see
 * a half-updated candidate set and never wait for a refresh.
 *
 * <p>
 * When the store cannot be read, an entry past its TTL is returned as stale;
 * with no entry at all the lookup fails with
 * {@link CatalogUnavailableException}.
 *
 * <p>
 * Store access is bounded by a fixed number of permits, acting as the
 * connection pool of the durable store.
 */
@Service
@Slf4j
public class CatalogService {

    private static final String ANY_PLATFORM = "*";

    private final CatalogStorePort store;
    private final ToolRouterProperties.CatalogProperties config;
    private final Clock clock;
    private final Semaphore storePermits;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.empty());
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong accessSequence = new AtomicLong();
    private final AtomicReference<Instant> lastRefreshAt = new AtomicReference<>();
    private final AtomicReference<String> lastRefreshError = new AtomicReference<>();
    private volatile boolean storeAvailable = true;

    private ScheduledExecutorService refreshExecutor;

    public CatalogService(CatalogStorePort store, ToolRouterProperties properties, Clock clock) {
        this.store = store;
        this.config = properties.getCatalog();
        this.clock = clock;
        this.storePermits = new Semaphore(Math.max(1, config.getStorePoolSize()), true);
    }

    @PostConstruct
    void startRefresh() {
        long intervalMs = config.getRefreshInterval().toMillis();
        if (intervalMs <= 0) {
            return;
        }
        refreshExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "catalog-refresh");
            t.setDaemon(true);
            return t;
        });
        refreshExecutor.scheduleWithFixedDelay(this::refreshQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void destroy() {
        if (refreshExecutor != null) {
            refreshExecutor.shutdownNow();
        }
    }

    /**
     * Returns the (tool, pattern) pairs offering {@code capability}, using the
     * newest active version of each tool. Candidates are ordered by tool name,
     * then pattern name.
     *
     * @throws CatalogUnavailableException
     *             if the store is unreachable and nothing is cached for this
     *             lookup
     */
    public CandidateSet getCandidates(String capability, String platformFilter) {
        String key = lookupKey(capability, platformFilter);
        Instant now = clock.instant();
        Entry<CandidateSet> cached = snapshot.get().lookups().get(key);
        if (cached != null && cached.isFresh(now, config.getCacheTtl())) {
            cached.touch(accessSequence.incrementAndGet());
            return cached.value();
        }

        try {
            List<ToolDefinition> tools = withStore(() -> store.findByCapability(capability));
            CandidateSet loaded = new CandidateSet(buildCandidates(tools, capability, platformFilter), false, now);
            publishLookup(key, loaded, now);
            log.debug("[Catalog] Loaded {} candidates for {} (platform={})", loaded.getCandidates().size(),
                    capability, platformFilter);
            return loaded;
        } catch (CatalogUnavailableException e) {
            if (cached != null) {
                log.warn("[Catalog] Store unavailable, serving stale candidates for {} loaded at {}", key,
                        cached.loadedAt());
                cached.touch(accessSequence.incrementAndGet());
                return new CandidateSet(cached.value().getCandidates(), true, cached.value().getLoadedAt());
            }
            throw e;
        }
    }

    /**
     * Returns the newest active version of a tool.
     *
     * @throws CatalogUnavailableException
     *             if the store is unreachable and the tool was never cached
     */
    public Optional<ToolDefinition> getByName(String toolName) {
        Instant now = clock.instant();
        Entry<Optional<ToolDefinition>> cached = snapshot.get().tools().get(toolName);
        if (cached != null && cached.isFresh(now, config.getCacheTtl())) {
            cached.touch(accessSequence.incrementAndGet());
            return cached.value();
        }

        try {
            Optional<ToolDefinition> loaded = latestActive(withStore(() -> store.findVersions(toolName)));
            publishTool(toolName, loaded, now);
            return loaded;
        } catch (CatalogUnavailableException e) {
            if (cached != null) {
                log.warn("[Catalog] Store unavailable, serving stale definition of {}", toolName);
                return cached.value();
            }
            throw e;
        }
    }

    /**
     * Returns a specific stored version, active or retired. Not cached.
     */
    public Optional<ToolDefinition> getVersion(String toolName, String version) {
        return withStore(() -> store.findVersion(toolName, version));
    }

    /**
     * Returns every stored version of a tool, newest first. Not cached.
     */
    public List<ToolDefinition> getVersions(String toolName) {
        List<ToolDefinition> versions = new ArrayList<>(withStore(() -> store.findVersions(toolName)));
        versions.sort(Comparator.comparing(ToolDefinition::getSemanticVersion).reversed());
        return versions;
    }

    /**
     * Returns the newest version of every tool, active or retired, ordered by
     * name.
     */
    public List<ToolDefinition> listTools() {
        List<ToolDefinition> result = new ArrayList<>();
        for (String name : withStore(store::listToolNames)) {
            List<ToolDefinition> versions = withStore(() -> store.findVersions(name));
            versions.stream()
                    .max(Comparator.comparing(ToolDefinition::getSemanticVersion))
                    .ifPresent(result::add);
        }
        result.sort(Comparator.comparing(ToolDefinition::getName));
        return result;
    }

    /**
     * Marks a tool version inactive and reloads the cache so the version stops
     * being offered. The record itself is kept.
     *
     * @return false if the version does not exist
     */
    public boolean retire(String toolName, String version) {
        boolean updated = withStore(() -> store.setActive(toolName, version, false));
        if (updated) {
            log.info("[Catalog] Retired {}@{}", toolName, version);
            refresh();
        }
        return updated;
    }

    /**
     * Rebuilds every cached entry from the store and publishes the result as one
     * new snapshot. Entries whose reload fails keep their previous value.
     *
     * @return number of entries that could not be refreshed
     */
    public int refresh() {
        Snapshot current = snapshot.get();
        Instant now = clock.instant();
        Map<String, Entry<CandidateSet>> lookups = new HashMap<>();
        Map<String, Entry<Optional<ToolDefinition>>> tools = new HashMap<>();
        int failures = 0;
        String firstError = null;

        for (Map.Entry<String, Entry<CandidateSet>> e : current.lookups().entrySet()) {
            String[] parts = splitKey(e.getKey());
            try {
                List<ToolDefinition> loaded = withStore(() -> store.findByCapability(parts[0]));
                String platform = ANY_PLATFORM.equals(parts[1]) ? null : parts[1];
                CandidateSet set = new CandidateSet(buildCandidates(loaded, parts[0], platform), false, now);
                lookups.put(e.getKey(), new Entry<>(set, now, e.getValue().lastAccess()));
            } catch (CatalogUnavailableException ex) {
                lookups.put(e.getKey(), e.getValue());
                failures++;
                firstError = firstError != null ? firstError : ex.getMessage();
            }
        }
        for (Map.Entry<String, Entry<Optional<ToolDefinition>>> e : current.tools().entrySet()) {
            try {
                Optional<ToolDefinition> loaded = latestActive(withStore(() -> store.findVersions(e.getKey())));
                tools.put(e.getKey(), new Entry<>(loaded, now, e.getValue().lastAccess()));
            } catch (CatalogUnavailableException ex) {
                tools.put(e.getKey(), e.getValue());
                failures++;
                firstError = firstError != null ? firstError : ex.getMessage();
            }
        }

        Snapshot refreshed = new Snapshot(Map.copyOf(lookups), Map.copyOf(tools));
        snapshot.updateAndGet(latest -> latest.mergeRefreshed(refreshed));
        long gen = generation.incrementAndGet();
        lastRefreshAt.set(now);
        lastRefreshError.set(firstError);
        if (failures > 0) {
            log.warn("[Catalog] Refresh #{} kept {} stale entries: {}", gen, failures, firstError);
        } else {
            log.debug("[Catalog] Refresh #{} reloaded {} lookups and {} tools", gen, lookups.size(), tools.size());
        }
        return failures;
    }

    /**
     * Drops every cached entry. Subsequent lookups go to the store.
     */
    public void invalidate() {
        snapshot.set(Snapshot.empty());
        generation.incrementAndGet();
        log.info("[Catalog] Cache invalidated");
    }

    public CatalogStatus getStatus() {
        Snapshot current = snapshot.get();
        return CatalogStatus.builder()
                .cachedLookups(current.lookups().size())
                .cachedTools(current.tools().size())
                .generation(generation.get())
                .lastRefreshAt(lastRefreshAt.get())
                .lastRefreshError(lastRefreshError.get())
                .storeAvailable(storeAvailable)
                .build();
    }

    private void refreshQuietly() {
        try {
            refresh();
        } catch (RuntimeException e) { // NOSONAR - scheduled task must survive to the next run
            log.warn("[Catalog] Scheduled refresh failed: {}", e.getMessage());
        }
    }

    private <T> T withStore(Supplier<T> call) {
        boolean acquired;
        try {
            acquired = storePermits.tryAcquire(config.getStoreAcquireTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogUnavailableException("Interrupted while waiting for a catalog store connection", e);
        }
        if (!acquired) {
            throw new CatalogUnavailableException("No catalog store connection available within "
                    + config.getStoreAcquireTimeout());
        }
        try {
            T result = call.get();
            storeAvailable = true;
            return result;
        } catch (CatalogUnavailableException e) {
            storeAvailable = false;
            throw e;
        } catch (RuntimeException e) {
            storeAvailable = false;
            throw new CatalogUnavailableException("Catalog store read failed: " + e.getMessage(), e);
        } finally {
            storePermits.release();
        }
    }

    private void publishLookup(String key, CandidateSet value, Instant now) {
        Entry<CandidateSet> entry = new Entry<>(value, now, new AtomicLong(accessSequence.incrementAndGet()));
        snapshot.updateAndGet(s -> s.withLookup(key, entry, config.getCacheMaxEntries()));
    }

    private void publishTool(String name, Optional<ToolDefinition> value, Instant now) {
        Entry<Optional<ToolDefinition>> entry = new Entry<>(value, now,
                new AtomicLong(accessSequence.incrementAndGet()));
        snapshot.updateAndGet(s -> s.withTool(name, entry, config.getCacheMaxEntries()));
    }

    static List<Candidate> buildCandidates(List<ToolDefinition> tools, String capability, String platformFilter) {
        Map<String, ToolDefinition> newest = new TreeMap<>();
        for (ToolDefinition tool : tools) {
            if (!tool.isActive() || !tool.providesCapability(capability) || !tool.matchesPlatform(platformFilter)) {
                continue;
            }
            newest.merge(tool.getName(), tool,
                    (a, b) -> a.getSemanticVersion().compareTo(b.getSemanticVersion()) >= 0 ? a : b);
        }

        List<Candidate> candidates = new ArrayList<>();
        for (ToolDefinition tool : newest.values()) {
            CapabilityBlock block = tool.getCapabilities().get(capability);
            for (Map.Entry<String, Pattern> pattern : new TreeMap<>(block.getPatterns()).entrySet()) {
                candidates.add(new Candidate(tool, capability, pattern.getKey(), pattern.getValue()));
            }
        }
        return List.copyOf(candidates);
    }

    private static Optional<ToolDefinition> latestActive(List<ToolDefinition> versions) {
        return versions.stream()
                .filter(ToolDefinition::isActive)
                .max(Comparator.comparing(ToolDefinition::getSemanticVersion));
    }

    private static String lookupKey(String capability, String platformFilter) {
        String platform = platformFilter == null || platformFilter.isBlank()
                ? ANY_PLATFORM
                : platformFilter.trim().toLowerCase(Locale.ROOT);
        return capability + "|" + platform;
    }

    private static String[] splitKey(String key) {
        int idx = key.lastIndexOf('|');
        return new String[] { key.substring(0, idx), key.substring(idx + 1) };
    }

    /**
     * Cached value with load time and a last-access stamp used for LRU eviction.
     */
    private record Entry<T>(T value, Instant loadedAt, AtomicLong lastAccess) {

        boolean isFresh(Instant now, Duration ttl) {
            return now.isBefore(loadedAt.plus(ttl));
        }

        void touch(long sequence) {
            lastAccess.set(sequence);
        }
    }

    /**
     * Immutable view of the cache. Every mutation returns a new instance.
     */
    private record Snapshot(Map<String, Entry<CandidateSet>> lookups,
            Map<String, Entry<Optional<ToolDefinition>>> tools) {

        static Snapshot empty() {
            return new Snapshot(Map.of(), Map.of());
        }

        Snapshot withLookup(String key, Entry<CandidateSet> entry, int maxEntries) {
            return new Snapshot(put(lookups, key, entry, maxEntries), tools);
        }

        Snapshot withTool(String key, Entry<Optional<ToolDefinition>> entry, int maxEntries) {
            return new Snapshot(lookups, put(tools, key, entry, maxEntries));
        }

        /**
         * Takes refreshed entries, keeping any entry loaded after the refresh began.
         */
        Snapshot mergeRefreshed(Snapshot refreshed) {
            return new Snapshot(merge(lookups, refreshed.lookups()), merge(tools, refreshed.tools()));
        }

        private static <T> Map<String, Entry<T>> merge(Map<String, Entry<T>> latest,
                Map<String, Entry<T>> refreshed) {
            Map<String, Entry<T>> merged = new HashMap<>(latest);
            refreshed.forEach((key, entry) -> merged.merge(key, entry,
                    (cur, ref) -> cur.loadedAt().isAfter(ref.loadedAt()) ? cur : ref));
            return Map.copyOf(merged);
        }

        private static <T> Map<String, Entry<T>> put(Map<String, Entry<T>> source, String key, Entry<T> entry,
                int maxEntries) {
            Map<String, Entry<T>> copy = new HashMap<>(source);
            if (!copy.containsKey(key) && copy.size() >= maxEntries) {
                evictLeastRecentlyUsed(copy);
            }
            copy.put(key, entry);
            return Map.copyOf(copy);
        }

        private static <T> void evictLeastRecentlyUsed(Map<String, Entry<T>> entries) {
            // Remove ~10% of the least recently used entries
            int toRemove = Math.max(1, entries.size() / 10);
            List<Map.Entry<String, Entry<T>>> sorted = new ArrayList<>(entries.entrySet());
            sorted.sort(Comparator.comparingLong(e -> e.getValue().lastAccess().get()));
            for (int i = 0; i < toRemove && i < sorted.size(); i++) {
                entries.remove(sorted.get(i).getKey());
            }
        }
    }
}
