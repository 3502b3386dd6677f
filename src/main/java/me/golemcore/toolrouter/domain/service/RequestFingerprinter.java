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
import me.golemcore.toolrouter.domain.model.Budget;
import me.golemcore.toolrouter.domain.model.PreferenceWeights;
import me.golemcore.toolrouter.domain.model.SelectionRequest;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Stable SHA-256 fingerprint of a normalized selection request.
 *
 * <p>
 * Normalization trims and lower-cases the platform, resolves the effective
 * weights (explicit, mode preset or configured default) and rescales them to
 * sum to one, and resolves the policy flags against configuration, so requests
 * that select identically share a fingerprint.
 */
@Component
@RequiredArgsConstructor
public class RequestFingerprinter {

    private final ToolRouterProperties properties;

    public String fingerprint(SelectionRequest request) {
        return sha256(canonicalForm(request));
    }

    String canonicalForm(SelectionRequest request) {
        PreferenceWeights weights = request
                .effectiveWeights(properties.getScoring().getDefaultPreferenceMode())
                .normalized();
        Budget budget = request.getBudget() != null ? request.getBudget() : Budget.unlimited();
        boolean productionSafeOnly = request.getProductionSafeOnly() != null
                ? request.getProductionSafeOnly()
                : properties.getSelection().isRequireProductionSafe();
        boolean approvalAllowed = request.getApprovalAllowed() == null || request.getApprovalAllowed();
        String platform = request.getPlatform() == null ? "" : request.getPlatform().trim().toLowerCase(Locale.ROOT);

        return "capability=" + request.getCapability().trim()
                + "|platform=" + platform
                + "|n=" + request.getN()
                + "|weights=" + format(weights.speed()) + "," + format(weights.accuracy()) + ","
                + format(weights.cost()) + "," + format(weights.complexity()) + "," + format(weights.completeness())
                + "|maxTimeMs=" + (budget.maxTimeMs() == null ? "-" : format(budget.maxTimeMs()))
                + "|maxCost=" + (budget.maxCost() == null ? "-" : format(budget.maxCost()))
                + "|productionSafeOnly=" + productionSafeOnly
                + "|approvalAllowed=" + approvalAllowed;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.9f", value);
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
