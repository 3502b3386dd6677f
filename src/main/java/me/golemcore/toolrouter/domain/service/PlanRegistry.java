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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.model.CancellationToken;
import me.golemcore.toolrouter.domain.model.FailurePolicy;
import me.golemcore.toolrouter.domain.model.PlanResult;
import me.golemcore.toolrouter.domain.model.PlanStatus;
import me.golemcore.toolrouter.domain.model.StepResult;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded in-memory registry of running and recently finished plans, used for
 * cancellation and status queries. The oldest finished plans are dropped first.
 */
@Component
@Slf4j
public class PlanRegistry {

    private final int maxRetained;
    private final Map<String, PlanHandle> plans = new LinkedHashMap<>();

    public PlanRegistry(ToolRouterProperties properties) {
        this.maxRetained = Math.max(1, properties.getDispatch().getMaxRetainedPlans());
    }

    /**
     * Registers a plan about to run.
     *
     * @throws InvalidRequestException
     *             if a plan with the same id is still running
     */
    public synchronized PlanHandle register(String planId, List<String> stepIds, FailurePolicy policy,
            Instant startedAt) {
        PlanHandle existing = plans.get(planId);
        if (existing != null && !existing.isFinished()) {
            throw new InvalidRequestException("Plan " + planId + " is already running");
        }
        PlanHandle handle = new PlanHandle(planId, List.copyOf(stepIds), policy, startedAt);
        plans.remove(planId);
        plans.put(planId, handle);
        trim();
        return handle;
    }

    public synchronized Optional<PlanResult> getResult(String planId) {
        return Optional.ofNullable(plans.get(planId)).map(PlanHandle::snapshot);
    }

    /**
     * Cancels a running plan.
     *
     * @return false if the plan is unknown or already finished
     */
    public synchronized boolean cancel(String planId) {
        PlanHandle handle = plans.get(planId);
        if (handle == null || handle.isFinished()) {
            return false;
        }
        log.info("[Dispatch] Cancelling plan {}", planId);
        handle.getToken().cancel();
        return true;
    }

    private void trim() {
        if (plans.size() <= maxRetained) {
            return;
        }
        List<String> removable = new ArrayList<>();
        int excess = plans.size() - maxRetained;
        for (Map.Entry<String, PlanHandle> entry : plans.entrySet()) {
            if (removable.size() >= excess) {
                break;
            }
            if (entry.getValue().isFinished()) {
                removable.add(entry.getKey());
            }
        }
        removable.forEach(plans::remove);
    }

    /**
     * Live state of one plan. Step results are recorded as they complete.
     */
    public static final class PlanHandle {

        private final String planId;
        private final List<String> stepIds;
        private final FailurePolicy failurePolicy;
        private final Instant startedAt;
        private final CancellationToken token = CancellationToken.create();
        private final Map<String, StepResult> completed = new ConcurrentHashMap<>();
        private volatile PlanResult finalResult;

        PlanHandle(String planId, List<String> stepIds, FailurePolicy failurePolicy, Instant startedAt) {
            this.planId = planId;
            this.stepIds = stepIds;
            this.failurePolicy = failurePolicy;
            this.startedAt = startedAt;
        }

        public CancellationToken getToken() {
            return token;
        }

        public void recordStep(StepResult result) {
            completed.put(result.getStepId(), result);
        }

        public void finish(PlanResult result) {
            this.finalResult = result;
        }

        public boolean isFinished() {
            return finalResult != null;
        }

        PlanResult snapshot() {
            PlanResult done = finalResult;
            if (done != null) {
                return done;
            }
            List<StepResult> soFar = new ArrayList<>();
            for (String id : stepIds) {
                StepResult r = completed.get(id);
                if (r != null) {
                    soFar.add(r);
                }
            }
            return PlanResult.builder()
                    .planId(planId)
                    .overallStatus(PlanStatus.RUNNING)
                    .failurePolicy(failurePolicy)
                    .stepResults(soFar)
                    .startedAt(startedAt)
                    .build();
        }
    }
}
