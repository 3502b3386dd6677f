package me.golemcore.toolrouter.domain.model;

/**
 * A selection result together with how it was obtained. The wrapped result is
 * shared with the cache; serving metadata lives only here.
 */
public record SelectionOutcome(String fingerprint, SelectionResult result, ResultSource source, long ageMs) {

    public boolean isStale() {
        return source == ResultSource.STALE_CACHE || result.isCatalogStale();
    }
}
