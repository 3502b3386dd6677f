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
import me.golemcore.toolrouter.domain.model.CacheEntry;
import me.golemcore.toolrouter.domain.model.SelectionCacheStats;
import me.golemcore.toolrouter.domain.model.SelectionResult;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process selection cache keyed by request fingerprint.
 *
 * <p>
 * Entries are immutable {@link CacheEntry} records replaced whole, so a reader
 * never sees a partially written entry. Expired entries stay around for the
 * stale grace window because degraded mode may still serve them; a periodic
 * sweep drops them afterwards.
 */
@Component
@Slf4j
public class SelectionCache {

    private final ToolRouterProperties.SelectionProperties config;
    private final Clock clock;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong staleServed = new AtomicLong();

    private ScheduledExecutorService cleanupExecutor;

    public SelectionCache(ToolRouterProperties properties, Clock clock) {
        this.config = properties.getSelection();
        this.clock = clock;
    }

    @PostConstruct
    void startCleanup() {
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "selection-cache-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::removeExpired, 1, 1, TimeUnit.MINUTES);
    }

    @PreDestroy
    void destroy() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
        }
    }

    /**
     * Returns the entry for {@code fingerprint} if it is within its TTL.
     */
    public Optional<CacheEntry> getFresh(String fingerprint) {
        CacheEntry entry = entries.get(fingerprint);
        if (entry != null && entry.isFresh(clock.instant())) {
            hits.incrementAndGet();
            return Optional.of(entry);
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    /**
     * Returns a warm entry that may be served while the catalog store is down,
     * even if its TTL has passed, as long as it is within the grace window.
     */
    public Optional<CacheEntry> getServableDuringOutage(String fingerprint) {
        CacheEntry entry = entries.get(fingerprint);
        if (entry != null && entry.isServableDuringOutage(clock.instant(), config.getStaleGrace())) {
            staleServed.incrementAndGet();
            return Optional.of(entry);
        }
        return Optional.empty();
    }

    /**
     * Stores a result for {@code fingerprint}. A cold result (resolved from
     * stale catalog data) never replaces a warm entry that is still servable
     * during an outage; the warm entry is kept and returned instead.
     */
    public CacheEntry put(String fingerprint, SelectionResult result, boolean warm) {
        if (!entries.containsKey(fingerprint) && entries.size() >= config.getCacheMaxEntries()) {
            evictOldest();
        }
        Instant now = clock.instant();
        return entries.compute(fingerprint, (key, current) -> {
            if (!warm && current != null && current.isServableDuringOutage(now, config.getStaleGrace())) {
                log.debug("[Selector] Keeping warm entry for {} over a stale-catalog result", key);
                return current;
            }
            return new CacheEntry(key, result, now, config.getCacheTtl(), warm);
        });
    }

    public void clear() {
        int size = entries.size();
        entries.clear();
        hits.set(0);
        misses.set(0);
        staleServed.set(0);
        log.info("[Selector] Selection cache cleared ({} entries)", size);
    }

    public SelectionCacheStats getStats() {
        return new SelectionCacheStats(entries.size(), hits.get(), misses.get(), staleServed.get());
    }

    void removeExpired() {
        Instant now = clock.instant();
        entries.values().removeIf(e -> !e.isFresh(now) && !e.isServableDuringOutage(now, config.getStaleGrace()));
    }

    private void evictOldest() {
        // Simple eviction: remove ~10% of oldest entries
        int toRemove = Math.max(1, entries.size() / 10);
        List<Map.Entry<String, CacheEntry>> sorted = new ArrayList<>(entries.entrySet());
        sorted.sort(Comparator.comparing(e -> e.getValue().createdAt()));
        for (int i = 0; i < toRemove && i < sorted.size(); i++) {
            entries.remove(sorted.get(i).getKey());
        }
    }
}
