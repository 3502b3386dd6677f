package me.golemcore.toolrouter.domain.model;

/**
 * Counters of the selection cache since startup or the last clear.
 */
public record SelectionCacheStats(int size, long hits, long misses, long staleServed) {
}
