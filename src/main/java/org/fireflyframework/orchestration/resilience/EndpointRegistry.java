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

package org.fireflyframework.orchestration.resilience;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import org.fireflyframework.orchestration.cache.OperationCache;
import org.fireflyframework.orchestration.properties.OrchestrationProperties;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Owns the resilience components of every remote endpoint.
 * <p>
 * Components are created lazily on the first lookup of an endpoint name, from
 * the endpoint's override configuration when one exists and from the defaults
 * otherwise. Two names never share a limiter, breaker, cache or bulkhead.
 */
@Slf4j
public class EndpointRegistry {

    private final OrchestrationProperties properties;
    private final Clock clock;
    private final Scheduler scheduler;
    private final DoubleSupplier jitter;
    private final BulkheadRegistry bulkheadRegistry = BulkheadRegistry.ofDefaults();
    private final Map<String, EndpointResilience> endpoints = new ConcurrentHashMap<>();

    public EndpointRegistry(OrchestrationProperties properties, Clock clock, Scheduler scheduler) {
        this(properties, clock, scheduler, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates a registry with an explicit jitter source for the retry engines.
     *
     * @param properties default and per-endpoint configuration
     * @param clock clock for limiter, breaker and cache time
     * @param scheduler scheduler for limiter and backoff waits
     * @param jitter source of values in [0, 1)
     */
    public EndpointRegistry(OrchestrationProperties properties,
                            Clock clock,
                            Scheduler scheduler,
                            DoubleSupplier jitter) {
        this.properties = Objects.requireNonNull(properties, "properties cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.jitter = Objects.requireNonNull(jitter, "jitter cannot be null");
    }

    /**
     * Gets the components of an endpoint, creating them on first use.
     *
     * @param endpoint the endpoint name
     * @return the endpoint's resilience components
     */
    public EndpointResilience getOrCreate(String endpoint) {
        Objects.requireNonNull(endpoint, "endpoint cannot be null");
        return endpoints.computeIfAbsent(endpoint, this::create);
    }

    public Optional<EndpointResilience> find(String endpoint) {
        return Optional.ofNullable(endpoints.get(endpoint));
    }

    /**
     * Restores limiter, breaker and cache of an endpoint. Unknown names are ignored.
     */
    public void reset(String endpoint) {
        EndpointResilience resilience = endpoints.get(endpoint);
        if (resilience != null) {
            resilience.reset();
            log.info("ENDPOINT_RESET: endpoint={}", endpoint);
        }
    }

    public void resetAll() {
        endpoints.keySet().forEach(this::reset);
    }

    /**
     * Lists the endpoints created so far, sorted by name.
     */
    public List<String> endpoints() {
        return endpoints.keySet().stream().sorted().toList();
    }

    public Optional<EndpointStatus> snapshot(String endpoint) {
        return find(endpoint).map(EndpointResilience::status);
    }

    public BulkheadRegistry getBulkheadRegistry() {
        return bulkheadRegistry;
    }

    private EndpointResilience create(String endpoint) {
        OrchestrationProperties.RateLimiterConfig limiterConfig = properties.rateLimiterFor(endpoint);
        OrchestrationProperties.CircuitBreakerConfig breakerConfig = properties.circuitBreakerFor(endpoint);
        OrchestrationProperties.RetryConfig retryConfig = properties.retryFor(endpoint);
        OrchestrationProperties.BulkheadConfig bulkheadConfig = properties.bulkheadFor(endpoint);

        Bulkhead bulkhead = bulkheadRegistry.bulkhead(endpoint, BulkheadConfig.custom()
                .maxConcurrentCalls(bulkheadConfig.getMaxConcurrentCalls())
                .maxWaitDuration(bulkheadConfig.getMaxWait())
                .build());
        bulkhead.getEventPublisher()
                .onCallRejected(event -> log.warn("BULKHEAD_REJECTED: endpoint={}", event.getBulkheadName()));

        EndpointResilience resilience = new EndpointResilience(
                endpoint,
                new AdaptiveRateLimiter(endpoint, limiterConfig, clock, scheduler),
                new CircuitBreaker(endpoint, breakerConfig, clock),
                new RetryEngine(endpoint, retryConfig.getMaxAttempts(), retryConfig.getBaseDelay(), jitter, scheduler),
                new OperationCache<>(endpoint, properties.cacheFor(endpoint), clock),
                bulkhead);

        log.info("ENDPOINT_REGISTERED: endpoint={}, maxRequestsPerMinute={}, circuitThreshold={}, maxAttempts={}",
                endpoint, limiterConfig.getMaxRequestsPerMinute(), breakerConfig.getThreshold(),
                retryConfig.getMaxAttempts());
        return resilience;
    }
}
