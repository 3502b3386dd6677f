package me.golemcore.toolrouter.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.model.Candidate;
import me.golemcore.toolrouter.domain.model.CredentialHandle;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;
import me.golemcore.toolrouter.domain.model.ExecutionSpec;
import me.golemcore.toolrouter.domain.model.ExecutionStep;
import me.golemcore.toolrouter.domain.model.InputContract;
import me.golemcore.toolrouter.domain.model.InputParameter;
import me.golemcore.toolrouter.domain.model.RoutingMetadata;
import me.golemcore.toolrouter.domain.model.SelectionResult;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Single writer of routing metadata.
 *
 * <p>
 * {@link #routingFor(Candidate)} runs at selection time against the exact tool
 * version that was scored, and its output travels inside the
 * {@link SelectionResult}. {@link #enrich(ExecutionStep, SelectionResult)}
 * copies that metadata onto a step without consulting the catalog, so the
 * dispatcher always executes against the scored version.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlanEnricher {

    private final ToolRouterProperties properties;

    public RoutingMetadata routingFor(Candidate candidate) {
        ExecutionSpec execution = candidate.getTool().getExecution();
        Long maxTime = candidate.getPattern().getPolicy().getMaxExecutionTimeMs();
        String location = execution.getExecutionLocation() == null || execution.getExecutionLocation().isBlank()
                ? ExecutionSpec.DEFAULT_LOCATION
                : execution.getExecutionLocation();
        return RoutingMetadata.builder()
                .executionLocation(location)
                .protocol(execution.getProtocol())
                .requiresCredentials(execution.isRequiresCredentials())
                .protocolMetadata(Collections.unmodifiableMap(new LinkedHashMap<>(execution.getProtocolMetadata())))
                .timeoutMs(maxTime != null ? maxTime : properties.getDispatch().getDefaultStepTimeout().toMillis())
                .build();
    }

    /**
     * Validates the step's inputs against the selected pattern and stamps the
     * routing metadata of the selection onto it.
     *
     * @throws InvalidRequestException
     *             if inputs are missing or malformed, or credentials are
     *             required but the step names no target host
     */
    public EnrichedExecutionStep enrich(ExecutionStep step, SelectionResult selection) {
        RoutingMetadata routing = selection.getRouting();
        Map<String, Object> inputs = step.getInputs() != null ? step.getInputs() : Map.of();

        List<String> violations = validateInputs(inputs, selection.getInputs());
        if (routing.isRequiresCredentials() && (step.getTargetHost() == null || step.getTargetHost().isBlank())) {
            violations.add(selection.getToolName() + " requires credentials, so the step must name a target host");
        }
        if (!violations.isEmpty()) {
            throw new InvalidRequestException("Step inputs do not satisfy " + selection.candidateKey(), violations);
        }

        String stepId = step.getId() != null && !step.getId().isBlank() ? step.getId() : selection.candidateKey();
        CredentialHandle handle = routing.isRequiresCredentials() ? CredentialHandle.forHost(step.getTargetHost())
                : null;

        log.debug("[Enricher] Step {} -> {}@{} at {} (credentials={})", stepId, selection.getToolName(),
                selection.getToolVersion(), routing.getExecutionLocation(), routing.isRequiresCredentials());
        return EnrichedExecutionStep.builder()
                .id(stepId)
                .toolName(selection.getToolName())
                .toolVersion(selection.getToolVersion())
                .patternName(selection.getPatternName())
                .capability(selection.getCapability())
                .targetHost(step.getTargetHost())
                .inputs(Collections.unmodifiableMap(new LinkedHashMap<>(inputs)))
                .dependsOn(step.getDependsOn() != null ? List.copyOf(step.getDependsOn()) : List.of())
                .requiresCredentials(routing.isRequiresCredentials())
                .executionLocation(routing.getExecutionLocation())
                .protocol(routing.getProtocol())
                .protocolMetadata(routing.getProtocolMetadata())
                .credentialHandle(handle)
                .timeoutMs(routing.getTimeoutMs())
                .estimatedCost(selection.getEstimatedCost())
                .build();
    }

    private List<String> validateInputs(Map<String, Object> inputs, InputContract contract) {
        List<String> violations = new ArrayList<>();
        if (contract == null) {
            return violations;
        }
        for (InputParameter parameter : contract.required()) {
            if (inputs.get(parameter.getName()) == null) {
                violations.add("missing required input '" + parameter.getName() + "'");
            } else {
                checkValue(parameter, inputs.get(parameter.getName()), violations);
            }
        }
        for (InputParameter parameter : contract.optional()) {
            Object value = inputs.get(parameter.getName());
            if (value != null) {
                checkValue(parameter, value, violations);
            }
        }
        return violations;
    }

    private void checkValue(InputParameter parameter, Object value, List<String> violations) {
        if (!parameter.getType().accepts(value)) {
            violations.add("input '" + parameter.getName() + "' must be of type " + parameter.getType().toValue());
            return;
        }
        String rule = parameter.getValidation();
        if (rule == null || rule.isBlank() || value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return;
        }
        try {
            if (!String.valueOf(value).matches(rule)) {
                violations.add("input '" + parameter.getName() + "' does not match " + rule);
            }
        } catch (PatternSyntaxException e) {
            violations.add("input '" + parameter.getName() + "' has an invalid validation rule");
        }
    }
}
