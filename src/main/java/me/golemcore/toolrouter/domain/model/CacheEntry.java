package me.golemcore.toolrouter.domain.model;

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

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable selection-cache entry. {@code warm} entries remain servable past
 * their TTL (within the stale grace window) while the catalog store is down;
 * entries resolved from stale catalog data are stored cold.
 */
public record CacheEntry(String fingerprint, SelectionResult result, Instant createdAt, Duration ttl,
        boolean warm) {

    public boolean isFresh(Instant now) {
        return now.isBefore(createdAt.plus(ttl));
    }

    public boolean isServableDuringOutage(Instant now, Duration grace) {
        return warm && now.isBefore(createdAt.plus(ttl).plus(grace));
    }

    public long ageMs(Instant now) {
        return Math.max(0, Duration.between(createdAt, now).toMillis());
    }
}
