package me.golemcore.toolrouter.domain.model;

/**
 * Upper bounds a caller accepts for the modeled time and cost. A null field
 * means no bound on that dimension.
 */
public record Budget(Double maxTimeMs, Double maxCost) {

    public static Budget unlimited() {
        return new Budget(null, null);
    }
}
