package me.golemcore.toolrouter.domain.exception;

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

import me.golemcore.toolrouter.domain.model.PolicyRejection;

import java.util.List;

/**
 * Every candidate for a capability was removed by policy, or the catalog has
 * none. Surfaced to the caller as a rejection and never retried.
 */
public class NoEligibleCandidateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String capability;
    private final transient List<PolicyRejection> rejections;

    public NoEligibleCandidateException(String capability, List<PolicyRejection> rejections) {
        super(rejections.isEmpty()
                ? "No tool provides capability '" + capability + "'"
                : "No eligible candidate for capability '" + capability + "': " + rejections.size()
                        + " rejected by policy");
        this.capability = capability;
        this.rejections = List.copyOf(rejections);
    }

    public String getCapability() {
        return capability;
    }

    public List<PolicyRejection> getRejections() {
        return rejections;
    }
}
