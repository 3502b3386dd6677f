package me.golemcore.toolrouter.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of the catalog cache state for the admin API.
 */
@Value
@Builder
public class CatalogStatus {

    int cachedLookups;
    int cachedTools;
    long generation;
    Instant lastRefreshAt;
    String lastRefreshError;
    boolean storeAvailable;
}
