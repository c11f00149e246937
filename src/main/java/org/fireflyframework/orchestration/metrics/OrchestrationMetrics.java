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

package org.fireflyframework.orchestration.metrics;

import io.github.resilience4j.micrometer.tagged.TaggedBulkheadMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.orchestration.model.OperationResult;
import org.fireflyframework.orchestration.model.RunReport;
import org.fireflyframework.orchestration.resilience.CircuitState;
import org.fireflyframework.orchestration.resilience.EndpointRegistry;
import org.fireflyframework.orchestration.resilience.EndpointResilience;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer metrics for operation runs.
 * <p>
 * Metrics recorded:
 * <ul>
 *   <li>{@code firefly.orchestration.operation.completed} - operations by endpoint, type and status</li>
 *   <li>{@code firefly.orchestration.operation.duration} - operation wall time</li>
 *   <li>{@code firefly.orchestration.operation.retries} - scheduled retries</li>
 *   <li>{@code firefly.orchestration.run.completed} - runs by status</li>
 *   <li>{@code firefly.orchestration.run.duration} - run wall time</li>
 *   <li>{@code firefly.orchestration.endpoint.rate_limiter.delay} - current limiter delay in ms</li>
 *   <li>{@code firefly.orchestration.endpoint.circuit.state} - 0 closed, 1 half open, 2 open</li>
 * </ul>
 * Resilience4j bulkhead metrics are bound for every endpoint bulkhead.
 */
@Slf4j
public class OrchestrationMetrics {

    public static final String METRIC_PREFIX = "firefly.orchestration.";

    private final MeterRegistry meterRegistry;
    private final EndpointRegistry endpointRegistry;
    private final Set<String> instrumentedEndpoints = ConcurrentHashMap.newKeySet();

    public OrchestrationMetrics(MeterRegistry meterRegistry, EndpointRegistry endpointRegistry) {
        this.meterRegistry = meterRegistry;
        this.endpointRegistry = endpointRegistry;
        TaggedBulkheadMetrics.ofBulkheadRegistry(endpointRegistry.getBulkheadRegistry()).bindTo(meterRegistry);
        log.info("OrchestrationMetrics initialized");
    }

    public void recordOperation(OperationResult result) {
        String status = result.status().name().toLowerCase();
        String endpoint = result.endpoint() != null ? result.endpoint() : "unknown";

        Counter.builder(METRIC_PREFIX + "operation.completed")
                .tag("endpoint", endpoint)
                .tag("operation", result.type())
                .tag("status", status)
                .register(meterRegistry)
                .increment();

        if (result.status().wasAttempted()) {
            Timer.builder(METRIC_PREFIX + "operation.duration")
                    .tag("endpoint", endpoint)
                    .tag("operation", result.type())
                    .tag("status", status)
                    .register(meterRegistry)
                    .record(result.duration());
        }

        instrumentEndpoint(endpoint);
        log.debug("METRIC: operation.completed endpoint={}, operation={}, status={}, attempts={}",
                endpoint, result.type(), status, result.attempts());
    }

    public void recordRetry(String endpoint, String operation) {
        Counter.builder(METRIC_PREFIX + "operation.retries")
                .tag("endpoint", endpoint)
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    public void recordRun(RunReport report) {
        String status = report.status().name().toLowerCase();

        Counter.builder(METRIC_PREFIX + "run.completed")
                .tag("status", status)
                .register(meterRegistry)
                .increment();

        Timer.builder(METRIC_PREFIX + "run.duration")
                .tag("status", status)
                .register(meterRegistry)
                .record(report.duration());

        log.debug("METRIC: run.completed planId={}, status={}, durationMs={}",
                report.planId(), status, report.duration().toMillis());
    }

    private void instrumentEndpoint(String endpoint) {
        if (instrumentedEndpoints.contains(endpoint)) {
            return;
        }
        // results recorded before the endpoint bundle exists retry on the next call
        endpointRegistry.find(endpoint).ifPresent(resilience -> {
            if (!instrumentedEndpoints.add(endpoint)) {
                return;
            }
            Gauge.builder(METRIC_PREFIX + "endpoint.rate_limiter.delay", resilience,
                            r -> r.rateLimiter().getMetrics().currentDelayMs())
                    .tag("endpoint", endpoint)
                    .register(meterRegistry);
            Gauge.builder(METRIC_PREFIX + "endpoint.circuit.state", resilience, OrchestrationMetrics::circuitLevel)
                    .tag("endpoint", endpoint)
                    .register(meterRegistry);
        });
    }

    private static double circuitLevel(EndpointResilience resilience) {
        CircuitState state = resilience.circuitBreaker().getState();
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }
}
