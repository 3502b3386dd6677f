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

import me.golemcore.toolrouter.domain.costmodel.CostExpression;
import me.golemcore.toolrouter.domain.costmodel.CostExpressionException;
import me.golemcore.toolrouter.domain.costmodel.MonotonicityCheck;
import me.golemcore.toolrouter.domain.model.CapabilityBlock;
import me.golemcore.toolrouter.domain.model.ExecutionSpec;
import me.golemcore.toolrouter.domain.model.InputParameter;
import me.golemcore.toolrouter.domain.model.Pattern;
import me.golemcore.toolrouter.domain.model.PatternPolicy;
import me.golemcore.toolrouter.domain.model.PreferenceMatch;
import me.golemcore.toolrouter.domain.model.ScoringAxis;
import me.golemcore.toolrouter.domain.model.SemanticVersion;
import me.golemcore.toolrouter.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Schema and cost-model checks applied to a tool definition before it enters
 * the catalog. Collects every violation instead of stopping at the first one.
 */
@Component
public class ToolDefinitionValidator {

    private static final java.util.regex.Pattern NAME = java.util.regex.Pattern.compile("[A-Za-z0-9_.-]+");

    /**
     * Hard violations and soft warnings found in one definition.
     */
    public record Validation(List<String> violations, List<String> warnings) {

        public boolean isValid() {
            return violations.isEmpty();
        }
    }

    public Validation validate(ToolDefinition tool) {
        List<String> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (tool.getName() == null || !NAME.matcher(tool.getName()).matches()) {
            violations.add("name must be non-empty and contain only letters, digits, '_', '.' or '-'");
        }
        if (!SemanticVersion.isValid(tool.getVersion())) {
            violations.add("version '" + tool.getVersion() + "' is not a semantic version (MAJOR.MINOR.PATCH)");
        }
        if (tool.getPlatform() == null || tool.getPlatform().isBlank()) {
            violations.add("platform is required");
        }
        if (tool.getDescription() == null || tool.getDescription().isBlank()) {
            warnings.add("tool has no description");
        }
        validateExecution(tool.getExecution(), violations);

        Map<String, CapabilityBlock> capabilities = tool.getCapabilities();
        if (capabilities == null || capabilities.isEmpty()) {
            violations.add("at least one capability is required");
            return new Validation(List.copyOf(violations), List.copyOf(warnings));
        }
        capabilities.forEach((capabilityName, block) -> {
            if (capabilityName == null || capabilityName.isBlank()) {
                violations.add("capability names must not be blank");
                return;
            }
            if (block == null || block.getPatterns() == null || block.getPatterns().isEmpty()) {
                violations.add(capabilityName + ": at least one pattern is required");
                return;
            }
            block.getPatterns().forEach((patternName, pattern) -> validatePattern(
                    capabilityName + "." + patternName, pattern, violations, warnings));
        });
        return new Validation(List.copyOf(violations), List.copyOf(warnings));
    }

    private void validateExecution(ExecutionSpec execution, List<String> violations) {
        if (execution == null) {
            violations.add("execution block is required");
            return;
        }
        if (execution.getExecutionLocation() == null || execution.getExecutionLocation().isBlank()) {
            violations.add("execution.executionLocation must not be blank");
        }
        if (execution.getProtocol() == null) {
            violations.add("execution.protocol is required");
        }
    }

    private void validatePattern(String path, Pattern pattern, List<String> violations, List<String> warnings) {
        if (pattern == null) {
            violations.add(path + ": pattern body is missing");
            return;
        }
        if (pattern.getDescription() == null || pattern.getDescription().isBlank()) {
            warnings.add(path + ": pattern has no description");
        }
        validateExpression(path + ".timeEstimateMs", pattern.getTimeEstimateMs(), violations);
        validateExpression(path + ".costEstimate", pattern.getCostEstimate(), violations);

        PreferenceMatch match = pattern.getPreferenceMatch();
        if (match == null) {
            violations.add(path + ": preferenceMatch is required");
        } else {
            for (ScoringAxis axis : ScoringAxis.values()) {
                double value = match.valueOf(axis);
                if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                    violations.add(path + ": preferenceMatch." + axis.name().toLowerCase(Locale.ROOT) + " must be within [0,1]");
                }
            }
        }

        PatternPolicy policy = pattern.getPolicy();
        if (policy != null) {
            if (policy.getMaxCost() != null && policy.getMaxCost() < 0) {
                violations.add(path + ": policy.maxCost must not be negative");
            }
            if (policy.getMaxExecutionTimeMs() != null && policy.getMaxExecutionTimeMs() <= 0) {
                violations.add(path + ": policy.maxExecutionTimeMs must be positive");
            }
        }

        Set<String> inputNames = new HashSet<>();
        validateInputs(path, pattern.getRequiredInputs(), inputNames, violations);
        validateInputs(path, pattern.getOptionalInputs(), inputNames, violations);
    }

    private void validateExpression(String path, String source, List<String> violations) {
        CostExpression expression;
        try {
            expression = CostExpression.compile(source);
        } catch (CostExpressionException e) {
            violations.add(path + ": " + e.getMessage());
            return;
        }
        try {
            if (expression.evaluate(0) < 0) {
                violations.add(path + ": '" + source + "' is negative at N=0");
            }
            for (String decrease : MonotonicityCheck.findDecreases(expression)) {
                violations.add(path + ": " + decrease);
            }
        } catch (CostExpressionException e) {
            violations.add(path + ": " + e.getMessage());
        }
    }

    private void validateInputs(String path, List<InputParameter> inputs, Set<String> seen, List<String> violations) {
        if (inputs == null) {
            return;
        }
        for (InputParameter input : inputs) {
            if (input == null || input.getName() == null || input.getName().isBlank()) {
                violations.add(path + ": input names must not be blank");
                continue;
            }
            if (!seen.add(input.getName())) {
                violations.add(path + ": input '" + input.getName() + "' is declared twice");
            }
            if (input.getType() == null) {
                violations.add(path + ": input '" + input.getName() + "' has no type");
            }
            if (input.getValidation() != null) {
                try {
                    java.util.regex.Pattern.compile(input.getValidation());
                } catch (PatternSyntaxException e) {
                    violations.add(path + ": input '" + input.getName() + "' has an invalid validation regex: "
                            + e.getDescription());
                }
            }
        }
    }
}
