package me.golemcore.toolrouter.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Enriched steps plus the plan-level execution settings. Null settings fall
 * back to configuration.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionPlan {

    String planId;
    List<EnrichedExecutionStep> steps;
    FailurePolicy failurePolicy;
    Long planTimeoutMs;
    Integer maxConcurrency;
}
