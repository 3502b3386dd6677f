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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.exception.StepExecutionException;
import me.golemcore.toolrouter.domain.model.CancellationToken;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;
import me.golemcore.toolrouter.domain.model.ExecutionPlan;
import me.golemcore.toolrouter.domain.model.FailurePolicy;
import me.golemcore.toolrouter.domain.model.PlanResult;
import me.golemcore.toolrouter.domain.model.PlanStatus;
import me.golemcore.toolrouter.domain.model.StepResult;
import me.golemcore.toolrouter.domain.model.StepStatus;
import me.golemcore.toolrouter.domain.model.TelemetryRecord;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.BackendAdapterPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs enriched plans against the registered backend adapters.
 *
 * <p>
 * Each step goes to the adapter registered for its stamped
 * {@code executionLocation}; the catalog is never consulted. Under
 * {@link FailurePolicy#ABORT_ON_FIRST_FAILURE} steps run one at a time in
 * declaration order and the first failure skips the rest. Under
 * {@link FailurePolicy#CONTINUE_AND_COLLECT} a step starts as soon as its
 * declared dependencies have succeeded, bounded by the plan's concurrency
 * limit; steps whose dependencies did not succeed are skipped.
 *
 * <p>
 * Timeouts apply per step (the step's stamped {@code timeoutMs}) and per plan
 * (explicit, configured, or the sum of step timeouts). Cancelling a plan
 * cancels every in-flight adapter call through its {@link CancellationToken}.
 */
@Service
@Slf4j
public class ExecutionDispatcher {

    private final BackendRegistry backendRegistry;
    private final PlanRegistry planRegistry;
    private final TelemetryRecorder telemetryRecorder;
    private final ToolRouterProperties.DispatchProperties config;
    private final Clock clock;

    private final ExecutorService stepExecutor;
    private final ExecutorService adapterExecutor;

    public ExecutionDispatcher(BackendRegistry backendRegistry, PlanRegistry planRegistry,
            TelemetryRecorder telemetryRecorder, ToolRouterProperties properties, Clock clock) {
        this.backendRegistry = backendRegistry;
        this.planRegistry = planRegistry;
        this.telemetryRecorder = telemetryRecorder;
        this.config = properties.getDispatch();
        this.clock = clock;
        this.stepExecutor = Executors.newCachedThreadPool(daemonThreads("dispatch-step"));
        this.adapterExecutor = Executors.newCachedThreadPool(daemonThreads("dispatch-adapter"));
    }

    @PreDestroy
    public void destroy() {
        stepExecutor.shutdownNow();
        adapterExecutor.shutdownNow();
    }

    /**
     * Executes a plan and blocks until it finishes, times out or is cancelled.
     *
     * @throws InvalidRequestException
     *             if the plan is empty, has duplicate step ids or declares a
     *             dependency on a step that is not declared before it
     */
    public PlanResult dispatch(ExecutionPlan plan) {
        validate(plan);
        String planId = plan.getPlanId() != null && !plan.getPlanId().isBlank()
                ? plan.getPlanId()
                : UUID.randomUUID().toString();
        FailurePolicy policy = plan.getFailurePolicy() != null
                ? plan.getFailurePolicy()
                : config.getDefaultFailurePolicy();
        List<EnrichedExecutionStep> steps = plan.getSteps();
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(planTimeoutMs(plan));

        PlanRegistry.PlanHandle handle = planRegistry.register(planId,
                steps.stream().map(EnrichedExecutionStep::getId).toList(), policy, startedAt);
        log.info("[Dispatch] Plan {} started: {} steps, policy {}", planId, steps.size(), policy.getValue());

        PlanRun run = new PlanRun(handle, deadlineNanos);
        List<StepResult> results = policy == FailurePolicy.ABORT_ON_FIRST_FAILURE
                ? runSequential(steps, run)
                : runConcurrent(steps, run, concurrencyLimit(plan));

        PlanStatus status = overallStatus(results, policy, run);
        PlanResult result = PlanResult.builder()
                .planId(planId)
                .overallStatus(status)
                .failurePolicy(policy)
                .stepResults(List.copyOf(results))
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos))
                .build();
        handle.finish(result);
        log.info("[Dispatch] Plan {} finished: {} ({} succeeded, {} failed, {} skipped)", planId, status,
                result.countWithStatus(StepStatus.SUCCEEDED), result.countWithStatus(StepStatus.FAILED),
                result.countWithStatus(StepStatus.SKIPPED));
        return result;
    }

    private List<StepResult> runSequential(List<EnrichedExecutionStep> steps, PlanRun run) {
        List<StepResult> results = new ArrayList<>();
        String stopReason = null;
        for (EnrichedExecutionStep step : steps) {
            if (stopReason != null) {
                results.add(record(run, StepResult.skipped(step.getId(), stopReason)));
                continue;
            }
            StepResult result = executeStep(step, run);
            results.add(result);
            if (!result.isSuccess()) {
                stopReason = "Skipped after step " + step.getId() + " ended with " + result.getStatus();
            }
        }
        return results;
    }

    private List<StepResult> runConcurrent(List<EnrichedExecutionStep> steps, PlanRun run, int limit) {
        Semaphore permits = new Semaphore(limit);
        Map<String, CompletableFuture<StepResult>> futures = new LinkedHashMap<>();
        for (EnrichedExecutionStep step : steps) {
            List<CompletableFuture<StepResult>> dependencies = step.getDependsOn().stream()
                    .map(futures::get)
                    .toList();
            CompletableFuture<StepResult> future = CompletableFuture
                    .allOf(dependencies.toArray(new CompletableFuture[0]))
                    .thenApplyAsync(ignored -> runWhenReady(step, dependencies, permits, run), stepExecutor);
            futures.put(step.getId(), future);
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]));
        try {
            all.get(Math.max(0, run.remainingNanos()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("[Dispatch] Plan deadline reached, cancelling in-flight steps");
            run.markTimedOut();
            run.handle().getToken().cancel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.handle().getToken().cancel();
        } catch (ExecutionException e) {
            log.error("[Dispatch] Unexpected step failure", e.getCause());
        }

        List<StepResult> results = new ArrayList<>();
        for (EnrichedExecutionStep step : steps) {
            StepResult result = futures.get(step.getId()).getNow(null);
            if (result == null) {
                StepStatus status = run.isTimedOut() ? StepStatus.TIMED_OUT : StepStatus.CANCELLED;
                result = record(run, base(step).status(status)
                        .error(status == StepStatus.TIMED_OUT ? "Plan timeout reached" : "Plan cancelled")
                        .build());
            }
            results.add(result);
        }
        return results;
    }

    private StepResult runWhenReady(EnrichedExecutionStep step, List<CompletableFuture<StepResult>> dependencies,
            Semaphore permits, PlanRun run) {
        for (CompletableFuture<StepResult> dependency : dependencies) {
            StepResult dependencyResult = dependency.join();
            if (!dependencyResult.isSuccess()) {
                return record(run, StepResult.skipped(step.getId(),
                        "Dependency " + dependencyResult.getStepId() + " ended with " + dependencyResult.getStatus()));
            }
        }
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return record(run, base(step).status(StepStatus.CANCELLED).error("Interrupted").build());
        }
        try {
            return executeStep(step, run);
        } finally {
            permits.release();
        }
    }

    private StepResult executeStep(EnrichedExecutionStep step, PlanRun run) {
        CancellationToken planToken = run.handle().getToken();
        if (planToken.isCancelled()) {
            StepStatus status = run.isTimedOut() ? StepStatus.TIMED_OUT : StepStatus.CANCELLED;
            return record(run, base(step).status(status).error("Plan " + status.name().toLowerCase() + " before start")
                    .build());
        }

        long stepTimeoutMs = step.getTimeoutMs() != null && step.getTimeoutMs() > 0
                ? step.getTimeoutMs()
                : config.getDefaultStepTimeout().toMillis();
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(run.remainingNanos());
        boolean planBound = remainingMs < stepTimeoutMs;
        long waitMs = Math.max(0, Math.min(stepTimeoutMs, remainingMs));

        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        CancellationToken stepToken = planToken.child();
        StepResult.StepResultBuilder outcome;
        String location = step.getExecutionLocation();

        try {
            BackendAdapterPort adapter = backendRegistry.resolve(step.getExecutionLocation());
            location = adapter.getLocation();
            log.info("[Dispatch] Step {}: {}.{} via {} (timeout {}ms)", step.getId(), step.getToolName(),
                    step.getPatternName(), location, waitMs);
            CompletableFuture<StepResult> call = CompletableFuture
                    .supplyAsync(() -> adapter.execute(step, stepToken), adapterExecutor);
            try {
                StepResult adapterResult = call.get(waitMs, TimeUnit.MILLISECONDS);
                outcome = adapterResult != null
                        ? adapterResult.toBuilder()
                        : StepResult.builder().status(StepStatus.FAILED).error("Adapter returned no result");
                if (adapterResult != null && adapterResult.getStatus() == null) {
                    outcome.status(StepStatus.FAILED).error("Adapter returned no status");
                }
            } catch (TimeoutException e) {
                stepToken.cancel();
                call.cancel(true);
                if (planBound) {
                    run.markTimedOut();
                    planToken.cancel();
                }
                outcome = StepResult.builder().status(StepStatus.TIMED_OUT)
                        .error(planBound ? "Plan timeout reached" : "Step exceeded timeout of " + stepTimeoutMs + "ms");
            }
        } catch (ExecutionException e) {
            outcome = failure(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stepToken.cancel();
            outcome = StepResult.builder().status(StepStatus.CANCELLED).error("Interrupted");
        } catch (RuntimeException e) {
            outcome = failure(e);
        }

        StepResult built = outcome.build();
        if (planToken.isCancelled() && !built.isSuccess() && built.getStatus() != StepStatus.TIMED_OUT) {
            outcome.status(run.isTimedOut() ? StepStatus.TIMED_OUT : StepStatus.CANCELLED);
        }
        StepResult result = outcome
                .stepId(step.getId())
                .toolName(step.getToolName())
                .executionLocation(location)
                .startedAt(startedAt)
                .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos))
                .build();
        if (result.isSuccess()) {
            log.info("[Dispatch] Step {} succeeded in {}ms", step.getId(), result.getDurationMs());
        } else {
            log.warn("[Dispatch] Step {} {}: {}", step.getId(), result.getStatus(), result.getError());
        }
        recordTelemetry(step, result);
        return record(run, result);
    }

    private StepResult.StepResultBuilder failure(Throwable cause) {
        if (cause instanceof StepExecutionException see) {
            return StepResult.builder().status(StepStatus.FAILED).error(see.getMessage())
                    .exitCode(see.getExitCode()).output(see.getOutput());
        }
        log.error("[Dispatch] Unexpected adapter error", cause);
        return StepResult.builder().status(StepStatus.FAILED)
                .error(cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    private void recordTelemetry(EnrichedExecutionStep step, StepResult result) {
        if (result.getStatus() == StepStatus.SKIPPED || result.getStatus() == StepStatus.CANCELLED
                || step.getToolName() == null || step.getPatternName() == null) {
            return;
        }
        double cost = result.getObservedCost() != null
                ? result.getObservedCost()
                : Objects.requireNonNullElse(step.getEstimatedCost(), 0.0);
        try {
            telemetryRecorder.record(TelemetryRecord.builder()
                    .tool(step.getToolName())
                    .pattern(step.getPatternName())
                    .observedTimeMs(result.getDurationMs())
                    .observedCost(cost)
                    .success(result.isSuccess())
                    .timestamp(result.getStartedAt())
                    .build());
        } catch (RuntimeException e) {
            log.warn("[Dispatch] Failed to record telemetry for step {}: {}", step.getId(), e.getMessage());
        }
    }

    private StepResult record(PlanRun run, StepResult result) {
        run.handle().recordStep(result);
        return result;
    }

    private static StepResult.StepResultBuilder base(EnrichedExecutionStep step) {
        return StepResult.builder()
                .stepId(step.getId())
                .toolName(step.getToolName())
                .executionLocation(step.getExecutionLocation());
    }

    private PlanStatus overallStatus(List<StepResult> results, FailurePolicy policy, PlanRun run) {
        long succeeded = results.stream().filter(StepResult::isSuccess).count();
        if (succeeded == results.size()) {
            return PlanStatus.SUCCEEDED;
        }
        if (run.isTimedOut()) {
            return PlanStatus.TIMED_OUT;
        }
        if (run.handle().getToken().isCancelled()) {
            return PlanStatus.CANCELLED;
        }
        if (policy == FailurePolicy.CONTINUE_AND_COLLECT && succeeded > 0) {
            return PlanStatus.PARTIAL;
        }
        return PlanStatus.FAILED;
    }

    private long planTimeoutMs(ExecutionPlan plan) {
        if (plan.getPlanTimeoutMs() != null && plan.getPlanTimeoutMs() > 0) {
            return plan.getPlanTimeoutMs();
        }
        Duration configured = config.getPlanTimeout();
        if (configured != null && !configured.isZero() && !configured.isNegative()) {
            return configured.toMillis();
        }
        long defaultStepMs = config.getDefaultStepTimeout().toMillis();
        long sum = 0;
        for (EnrichedExecutionStep step : plan.getSteps()) {
            long stepMs = step.getTimeoutMs() != null && step.getTimeoutMs() > 0 ? step.getTimeoutMs() : defaultStepMs;
            sum = sum > Long.MAX_VALUE - stepMs ? Long.MAX_VALUE : sum + stepMs;
        }
        return sum;
    }

    /**
     * Explicit plan limit, else the number of distinct target hosts, capped by
     * configuration and never below one.
     */
    int concurrencyLimit(ExecutionPlan plan) {
        if (plan.getMaxConcurrency() != null && plan.getMaxConcurrency() > 0) {
            return Math.min(plan.getMaxConcurrency(), config.getMaxConcurrency());
        }
        Set<String> hosts = new HashSet<>();
        for (EnrichedExecutionStep step : plan.getSteps()) {
            hosts.add(step.getTargetHost() != null ? step.getTargetHost() : "");
        }
        return Math.max(1, Math.min(hosts.size(), config.getMaxConcurrency()));
    }

    private void validate(ExecutionPlan plan) {
        if (plan == null || plan.getSteps() == null || plan.getSteps().isEmpty()) {
            throw new InvalidRequestException("Plan must contain at least one step");
        }
        List<String> problems = new ArrayList<>();
        Set<String> declared = new HashSet<>();
        for (int i = 0; i < plan.getSteps().size(); i++) {
            EnrichedExecutionStep step = plan.getSteps().get(i);
            if (step == null) {
                problems.add("step #" + (i + 1) + " is null");
                continue;
            }
            if (step.getId() == null || step.getId().isBlank()) {
                problems.add("every step needs an id");
                continue;
            }
            for (String dependency : step.getDependsOn()) {
                if (dependency == null || dependency.isBlank()) {
                    problems.add("step " + step.getId() + " has an empty dependency");
                } else if (!declared.contains(dependency)) {
                    problems.add("step " + step.getId() + " depends on " + dependency
                            + ", which is not declared before it");
                }
            }
            if (!declared.add(step.getId())) {
                problems.add("duplicate step id " + step.getId());
            }
        }
        if (!problems.isEmpty()) {
            throw new InvalidRequestException("Invalid plan: " + String.join("; ", problems), problems);
        }
    }

    private static java.util.concurrent.ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Mutable state of one dispatch shared by its steps.
     */
    private static final class PlanRun {

        private final PlanRegistry.PlanHandle handle;
        private final long deadlineNanos;
        private volatile boolean timedOut;

        PlanRun(PlanRegistry.PlanHandle handle, long deadlineNanos) {
            this.handle = handle;
            this.deadlineNanos = deadlineNanos;
        }

        PlanRegistry.PlanHandle handle() {
            return handle;
        }

        long remainingNanos() {
            return deadlineNanos - System.nanoTime();
        }

        void markTimedOut() {
            timedOut = true;
        }

        boolean isTimedOut() {
            return timedOut;
        }
    }
}
