package me.golemcore.toolrouter.domain.model;

/**
 * Reason a candidate was removed by the policy filter.
 */
public enum PolicyViolation {
    COST_EXCEEDS_BUDGET,
    COST_EXCEEDS_POLICY_MAX,
    TIME_EXCEEDS_POLICY_MAX,
    NOT_PRODUCTION_SAFE,
    APPROVAL_NOT_ALLOWED,
    INVALID_COST_MODEL
}
