package me.golemcore.toolrouter.domain.model;

/**
 * One candidate removed by the policy filter and why.
 */
public record PolicyRejection(String candidate, PolicyViolation violation, String detail) {
}
