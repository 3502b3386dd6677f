package me.golemcore.toolrouter.adapter.outbound.backend;

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

import me.golemcore.toolrouter.domain.exception.StepExecutionException;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads adapter-specific keys from a step's {@code protocolMetadata} and fills
 * {@code {{name}}} placeholders from the step's inputs.
 *
 * <p>
 * {@code {{targetHost}}} and {@code {{stepId}}} are always available. A
 * placeholder with no matching input fails the step.
 */
final class StepTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    private StepTemplates() {
    }

    static String render(String template, EnrichedExecutionStep step, UnaryOperator<String> escape) {
        if (template == null) {
            return null;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = lookup(name, step);
            matcher.appendReplacement(out, Matcher.quoteReplacement(escape.apply(value)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static String render(String template, EnrichedExecutionStep step) {
        return render(template, step, UnaryOperator.identity());
    }

    /**
     * POSIX shell single-quoting.
     */
    static String shellQuote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    static String requiredString(EnrichedExecutionStep step, String key) {
        String value = optionalString(step, key);
        if (value == null || value.isBlank()) {
            throw new StepExecutionException("protocolMetadata." + key + " is required for location "
                    + step.getExecutionLocation());
        }
        return value;
    }

    static String optionalString(EnrichedExecutionStep step, String key) {
        Object value = step.getProtocolMetadata().get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> optionalMap(EnrichedExecutionStep step, String key) {
        Object value = step.getProtocolMetadata().get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new StepExecutionException("protocolMetadata." + key + " must be an object");
    }

    static List<String> optionalList(EnrichedExecutionStep step, String key) {
        Object value = step.getProtocolMetadata().get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).toList();
        }
        throw new StepExecutionException("protocolMetadata." + key + " must be a list");
    }

    static String truncate(String output, int maxChars) {
        if (output == null || output.length() <= maxChars) {
            return output;
        }
        return output.substring(0, maxChars) + "\n[Output truncated...]";
    }

    private static String lookup(String name, EnrichedExecutionStep step) {
        if ("targetHost".equals(name)) {
            if (step.getTargetHost() == null) {
                throw new StepExecutionException("Step " + step.getId() + " has no targetHost");
            }
            return step.getTargetHost();
        }
        if ("stepId".equals(name)) {
            return step.getId();
        }
        if (!step.getInputs().containsKey(name) || step.getInputs().get(name) == null) {
            throw new StepExecutionException("Step " + step.getId() + " has no value for placeholder {{" + name
                    + "}}");
        }
        return String.valueOf(step.getInputs().get(name));
    }
}
