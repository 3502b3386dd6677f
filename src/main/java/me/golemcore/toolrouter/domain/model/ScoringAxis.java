package me.golemcore.toolrouter.domain.model;

/**
 * Criteria the scoring engine weighs. Declaration order is the summation order
 * of the composite score and must not change.
 */
public enum ScoringAxis {
    SPEED, ACCURACY, COST, COMPLEXITY, COMPLETENESS
}
