package me.golemcore.toolrouter.domain.model;

/**
 * Per-axis scoring detail: the pattern's raw preference-match value, the value
 * after budget penalties, the normalized weight, and the weighted contribution
 * to the composite score.
 */
public record AxisScore(double raw, double adjusted, double weight, double contribution) {
}
