package me.golemcore.toolrouter.domain.model;

/**
 * Where a selection response came from.
 */
public enum ResultSource {
    /** Resolved through filter, scoring and tie-break on this call. */
    RESOLVED,
    /** Fresh selection-cache hit within the TTL. */
    CACHE,
    /** Expired cache entry served because the catalog store is unavailable. */
    STALE_CACHE
}
