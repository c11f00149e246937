/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.orchestration.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import org.fireflyframework.orchestration.exception.CircuitOpenException;
import org.fireflyframework.orchestration.exception.OperationCancelledException;
import org.fireflyframework.orchestration.exception.OperationExecutionException;
import org.fireflyframework.orchestration.exception.ParameterValidationException;
import org.fireflyframework.orchestration.exception.ProviderException;
import org.fireflyframework.orchestration.metrics.OrchestrationMetrics;
import org.fireflyframework.orchestration.model.ExecutionPlan;
import org.fireflyframework.orchestration.model.OperationContext;
import org.fireflyframework.orchestration.model.OperationDescriptor;
import org.fireflyframework.orchestration.model.OperationResult;
import org.fireflyframework.orchestration.model.OperationStatus;
import org.fireflyframework.orchestration.model.RunReport;
import org.fireflyframework.orchestration.model.RunStatus;
import org.fireflyframework.orchestration.properties.OrchestrationProperties;
import org.fireflyframework.orchestration.resilience.CircuitBreaker;
import org.fireflyframework.orchestration.resilience.EndpointRegistry;
import org.fireflyframework.orchestration.resilience.EndpointResilience;
import org.fireflyframework.orchestration.resilience.ProviderErrorClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Executes resolved operation plans against remote endpoints.
 * <p>
 * Stages run strictly one after another. Operations of one stage run
 * concurrently, at most {@code maxConcurrentRequests} at a time. Every attempt
 * of an operation goes through its endpoint's components in this order:
 * <ol>
 *   <li>circuit breaker permission, failing fast with {@link CircuitOpenException}</li>
 *   <li>rate limiter wait</li>
 *   <li>bulkhead permit and per-attempt timeout around the operation body</li>
 *   <li>outcome fed back to the breaker, and to the limiter on a rate-limit signal</li>
 * </ol>
 * Attempts are driven by the endpoint's retry engine with the
 * {@link ProviderErrorClassifier}. Cacheable operations are memoized per
 * endpoint, keyed by operation type and run input.
 * <p>
 * <b>Failure handling:</b>
 * No error escapes for a single operation; it is captured in the operation's
 * result. An operation whose dependency did not succeed is SKIPPED without being
 * attempted. A failing operation lets its in-flight siblings finish.
 */
@Slf4j
public class OperationExecutor {

    private final EndpointRegistry endpointRegistry;
    private final OperationDependencyResolver resolver;
    private final OrchestrationProperties.ExecutorConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Scheduler scheduler;
    private final OrchestrationMetrics metrics;
    private final ProviderErrorClassifier classifier = ProviderErrorClassifier.INSTANCE;

    public OperationExecutor(
            EndpointRegistry endpointRegistry,
            OperationDependencyResolver resolver,
            OrchestrationProperties.ExecutorConfig config,
            ObjectMapper objectMapper,
            Clock clock,
            Scheduler scheduler,
            @Nullable OrchestrationMetrics metrics) {
        this.endpointRegistry = Objects.requireNonNull(endpointRegistry, "endpointRegistry cannot be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.metrics = metrics;
    }

    /**
     * Resolves the operations and executes the resulting plan.
     * <p>
     * Resolution errors are signalled as
     * {@link org.fireflyframework.orchestration.exception.GraphValidationException}
     * before any operation runs.
     *
     * @param operations the operations with their bodies
     * @param input the run input
     * @param cancellation the run-level cancel signal
     * @return the run report
     */
    public Mono<RunReport> run(List<Operation<?>> operations, Map<String, Object> input, RunCancellation cancellation) {
        return Mono.defer(() -> {
            List<OperationDescriptor> descriptors = operations.stream().map(Operation::descriptor).toList();
            ExecutionPlan plan = resolver.resolve(descriptors);

            Map<String, OperationHandler<?>> handlers = new LinkedHashMap<>();
            operations.forEach(operation -> handlers.putIfAbsent(operation.type(), operation.handler()));
            return execute(plan, handlers, input, cancellation);
        });
    }

    public Mono<RunReport> run(List<Operation<?>> operations, Map<String, Object> input) {
        return run(operations, input, RunCancellation.create());
    }

    public Mono<RunReport> execute(ExecutionPlan plan,
                                   Map<String, ? extends OperationHandler<?>> handlers,
                                   Map<String, Object> input) {
        return execute(plan, handlers, input, RunCancellation.create());
    }

    /**
     * Executes a resolved plan.
     *
     * @param plan the plan to execute
     * @param handlers operation bodies keyed by operation type
     * @param input the run input
     * @param cancellation the run-level cancel signal
     * @return the run report, results in plan order
     */
    public Mono<RunReport> execute(ExecutionPlan plan,
                                   Map<String, ? extends OperationHandler<?>> handlers,
                                   Map<String, Object> input,
                                   RunCancellation cancellation) {
        return Mono.defer(() -> {
            RunState state = new RunState(plan, new LinkedHashMap<>(handlers), input, cancellation, clock.instant());
            log.info("RUN_STARTED: planId={}, operations={}, stages={}",
                    plan.planId(), plan.size(), plan.stages().size());

            return executeStagesSequentially(state, 0)
                    .then(Mono.fromCallable(() -> buildReport(state)))
                    .doOnNext(report -> {
                        log.info("RUN_COMPLETED: planId={}, status={}, succeeded={}, failed={}, skipped={}, cancelled={}, durationMs={}",
                                report.planId(), report.status(),
                                report.count(OperationStatus.SUCCESS),
                                report.count(OperationStatus.FAILURE),
                                report.count(OperationStatus.SKIPPED),
                                report.count(OperationStatus.CANCELLED),
                                report.duration().toMillis());
                        if (metrics != null) {
                            metrics.recordRun(report);
                        }
                    });
        });
    }

    private Mono<Void> executeStagesSequentially(RunState state, int stageIndex) {
        List<List<OperationDescriptor>> stages = state.plan.stages();
        if (stageIndex >= stages.size()) {
            return Mono.empty();
        }

        List<OperationDescriptor> stage = stages.get(stageIndex);
        log.debug("STAGE_STARTED: planId={}, stage={}, operations={}",
                state.plan.planId(), stageIndex, stage.size());

        return Flux.fromIterable(stage)
                .flatMap(operation -> executeOperation(state, operation), config.getMaxConcurrentRequests())
                .then(Mono.defer(() -> executeStagesSequentially(state, stageIndex + 1)));
    }

    private Mono<Void> executeOperation(RunState state, OperationDescriptor operation) {
        return Mono.defer(() -> {
            if (state.cancellation.isCancelled()) {
                return complete(state, OperationResult.cancelled(operation, clock.instant(),
                        new OperationCancelledException(operation.type())));
            }

            Optional<OperationResult> blocker = findUnsatisfiedDependency(state, operation);
            if (blocker.isPresent()) {
                OperationResult dependency = blocker.get();
                return complete(state, OperationResult.skipped(operation, clock.instant(),
                        new OperationExecutionException(operation.type(), String.format(
                                "Skipped because dependency '%s' finished with status %s",
                                dependency.type(), dependency.status()), dependency.error())));
            }

            Instant startedAt = clock.instant();
            OperationHandler<?> handler = state.handlers.get(operation.type());
            if (handler == null) {
                return complete(state, OperationResult.failure(operation, startedAt, clock.instant(), 0,
                        new OperationExecutionException(operation.type(), "No handler registered for operation")));
            }

            List<String> missingParams = operation.requiredParams().stream()
                    .filter(param -> state.input.get(param) == null)
                    .toList();
            if (!missingParams.isEmpty()) {
                return complete(state, OperationResult.failure(operation, startedAt, clock.instant(), 0,
                        new ParameterValidationException(operation.type(), missingParams)));
            }

            OperationContext context = new OperationContext(
                    state.plan.planId(), operation, state.input, state.outputs, objectMapper);
            if (handler.shouldSkip(context)) {
                return complete(state, OperationResult.skipped(operation, startedAt, null));
            }

            log.debug("OPERATION_STARTED: planId={}, operation={}, endpoint={}",
                    state.plan.planId(), operation.type(), operation.endpoint());

            AtomicInteger attempts = new AtomicInteger();
            return invoke(state, operation, handler, context, attempts)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .map(output -> OperationResult.success(operation, startedAt, clock.instant(),
                            attempts.get(), output.orElse(null)))
                    .onErrorResume(error -> Mono.just(OperationResult.failure(
                            operation, startedAt, clock.instant(), attempts.get(), error)))
                    .flatMap(result -> complete(state, result));
        }).onErrorResume(error -> {
            // handler hooks such as shouldSkip run outside the attempt pipeline
            Instant failedAt = clock.instant();
            return complete(state, OperationResult.failure(operation, failedAt, failedAt, 0, error));
        });
    }

    private Mono<Object> invoke(RunState state,
                                OperationDescriptor operation,
                                OperationHandler<?> handler,
                                OperationContext context,
                                AtomicInteger attempts) {
        EndpointResilience endpoint = endpointRegistry.getOrCreate(operation.endpoint());
        Duration timeout = operation.timeout() != null ? operation.timeout() : config.getDefaultOperationTimeout();

        Supplier<Mono<Object>> retried = () -> endpoint.retryEngine().executeWithRetry(
                () -> attempt(endpoint, operation, handler, context, timeout, attempts),
                classifier,
                (failedAttempt, delay, error) -> {
                    if (metrics != null) {
                        metrics.recordRetry(endpoint.endpoint(), operation.type());
                    }
                });

        if (!operation.cacheable()) {
            return retried.get();
        }
        return endpoint.cache().getOrComputeAsync(cacheKey(operation, state.input), retried);
    }

    private Mono<Object> attempt(EndpointResilience endpoint,
                                 OperationDescriptor operation,
                                 OperationHandler<?> handler,
                                 OperationContext context,
                                 Duration timeout,
                                 AtomicInteger attempts) {
        return Mono.defer(() -> {
            int attempt = attempts.incrementAndGet();
            CircuitBreaker breaker = endpoint.circuitBreaker();
            if (!breaker.isAllowed()) {
                log.warn("CIRCUIT_OPEN_REJECTED: endpoint={}, operation={}", endpoint.endpoint(), operation.type());
                return Mono.error(new CircuitOpenException(endpoint.endpoint()));
            }

            Mono<Object> body = Mono.defer(() -> handler.execute(context))
                    .cast(Object.class)
                    .timeout(timeout, scheduler)
                    .transformDeferred(BulkheadOperator.of(endpoint.bulkhead()));

            return endpoint.rateLimiter().throttle()
                    .then(body)
                    .doOnSuccess(output -> breaker.recordSuccess())
                    .doOnError(error -> onAttemptFailure(endpoint, operation, attempt, error));
        });
    }

    private void onAttemptFailure(EndpointResilience endpoint, OperationDescriptor operation, int attempt, Throwable error) {
        log.warn("OPERATION_ATTEMPT_FAILED: endpoint={}, operation={}, attempt={}, error={}",
                endpoint.endpoint(), operation.type(), attempt, error.toString());

        if (classifier.countsAsEndpointFailure(error)) {
            endpoint.circuitBreaker().recordFailure();
        }
        if (error instanceof ProviderException providerError && providerError.isRateLimitSignal()) {
            endpoint.rateLimiter().handleRateLimitResponse(providerError.getRetryAfterMs().orElse(0L));
        }
    }

    private Optional<OperationResult> findUnsatisfiedDependency(RunState state, OperationDescriptor operation) {
        for (String dependency : operation.dependencies()) {
            OperationResult result = state.results.get(dependency);
            if (result == null) {
                OperationDescriptor missing = OperationDescriptor.of(dependency);
                return Optional.of(OperationResult.skipped(missing, clock.instant(),
                        new OperationExecutionException(dependency, "Dependency is not part of the plan")));
            }
            if (result.status() != OperationStatus.SUCCESS) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    private Mono<Void> complete(RunState state, OperationResult result) {
        state.results.put(result.type(), result);
        if (result.status() == OperationStatus.SUCCESS && result.output() != null) {
            state.outputs.put(result.type(), result.output());
        }

        switch (result.status()) {
            case SUCCESS -> log.info("OPERATION_COMPLETED: planId={}, operation={}, attempts={}, durationMs={}",
                    state.plan.planId(), result.type(), result.attempts(), result.duration().toMillis());
            case FAILURE -> log.warn("OPERATION_FAILED: planId={}, operation={}, required={}, attempts={}, error={}",
                    state.plan.planId(), result.type(), result.required(), result.attempts(),
                    result.errorMessage().orElse("unknown"));
            case SKIPPED -> log.info("OPERATION_SKIPPED: planId={}, operation={}, reason={}",
                    state.plan.planId(), result.type(), result.errorMessage().orElse("handler"));
            case CANCELLED -> log.info("OPERATION_CANCELLED: planId={}, operation={}",
                    state.plan.planId(), result.type());
        }

        if (metrics != null) {
            metrics.recordOperation(result);
        }
        return Mono.empty();
    }

    private RunReport buildReport(RunState state) {
        List<OperationResult> ordered = new ArrayList<>();
        for (OperationDescriptor operation : state.plan.order()) {
            OperationResult result = state.results.get(operation.type());
            if (result != null) {
                ordered.add(result);
            }
        }
        return new RunReport(state.plan.planId(), RunStatus.of(ordered), ordered, state.startedAt, clock.instant());
    }

    static String cacheKey(OperationDescriptor operation, Map<String, Object> input) {
        return operation.type() + ":" + new TreeMap<>(input);
    }

    private static final class RunState {
        private final ExecutionPlan plan;
        private final Map<String, OperationHandler<?>> handlers;
        private final Map<String, Object> input;
        private final RunCancellation cancellation;
        private final Instant startedAt;
        private final Map<String, OperationResult> results = new ConcurrentHashMap<>();
        private final Map<String, Object> outputs = new ConcurrentHashMap<>();

        private RunState(ExecutionPlan plan,
                         Map<String, OperationHandler<?>> handlers,
                         Map<String, Object> input,
                         RunCancellation cancellation,
                         Instant startedAt) {
            this.plan = plan;
            this.handlers = handlers;
            this.input = input == null ? Map.of() : new LinkedHashMap<>(input);
            this.cancellation = cancellation;
            this.startedAt = startedAt;
        }
    }
}
