package me.golemcore.toolrouter.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;
import me.golemcore.toolrouter.domain.model.FailurePolicy;

import java.util.List;

/**
 * Body of {@code POST /api/execute}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteRequest {
    private String planId;
    private List<EnrichedExecutionStep> steps;
    private FailurePolicy failurePolicy;
    private Long planTimeoutMs;
    private Integer maxConcurrency;
}
