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

package org.fireflyframework.orchestration.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the operation orchestration library.
 */
@ConfigurationProperties(prefix = "firefly.orchestration")
@Validated
@Data
public class OrchestrationProperties {

    /**
     * Whether the orchestration engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to register the endpoint health indicator.
     */
    private boolean healthIndicatorEnabled = true;

    /**
     * Default rate limiter configuration, applied to every endpoint without an override.
     */
    @Valid
    @NotNull
    private RateLimiterConfig rateLimiter = new RateLimiterConfig();

    /**
     * Default circuit breaker configuration.
     */
    @Valid
    @NotNull
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

    /**
     * Default retry configuration.
     */
    @Valid
    @NotNull
    private RetryConfig retry = new RetryConfig();

    /**
     * Default cache configuration.
     */
    @Valid
    @NotNull
    private CacheConfig cache = new CacheConfig();

    /**
     * Default per-endpoint bulkhead configuration.
     */
    @Valid
    @NotNull
    private BulkheadConfig bulkhead = new BulkheadConfig();

    /**
     * Executor configuration.
     */
    @Valid
    @NotNull
    private ExecutorConfig executor = new ExecutorConfig();

    /**
     * Per-endpoint overrides, keyed by endpoint name.
     */
    @Valid
    @NotNull
    private Map<String, EndpointConfig> endpoints = new LinkedHashMap<>();

    /**
     * Resolves the rate limiter configuration for an endpoint.
     */
    public RateLimiterConfig rateLimiterFor(String endpoint) {
        EndpointConfig override = endpoints.get(endpoint);
        return override != null && override.getRateLimiter() != null ? override.getRateLimiter() : rateLimiter;
    }

    /**
     * Resolves the circuit breaker configuration for an endpoint.
     */
    public CircuitBreakerConfig circuitBreakerFor(String endpoint) {
        EndpointConfig override = endpoints.get(endpoint);
        return override != null && override.getCircuitBreaker() != null ? override.getCircuitBreaker() : circuitBreaker;
    }

    /**
     * Resolves the retry configuration for an endpoint.
     */
    public RetryConfig retryFor(String endpoint) {
        EndpointConfig override = endpoints.get(endpoint);
        return override != null && override.getRetry() != null ? override.getRetry() : retry;
    }

    /**
     * Resolves the cache configuration for an endpoint.
     */
    public CacheConfig cacheFor(String endpoint) {
        EndpointConfig override = endpoints.get(endpoint);
        return override != null && override.getCache() != null ? override.getCache() : cache;
    }

    /**
     * Resolves the bulkhead configuration for an endpoint.
     */
    public BulkheadConfig bulkheadFor(String endpoint) {
        EndpointConfig override = endpoints.get(endpoint);
        return override != null && override.getBulkhead() != null ? override.getBulkhead() : bulkhead;
    }

    /**
     * Adaptive rate limiter configuration.
     */
    @Data
    public static class RateLimiterConfig {

        /**
         * Request budget within the trailing 60 second window.
         */
        @Min(1)
        private int maxRequestsPerMinute = 60;

        /**
         * Minimum spacing between consecutive requests; the delay never decays below it.
         */
        @NotNull
        private Duration initialDelay = Duration.ofMillis(100);

        /**
         * Upper bound of the adaptive delay.
         */
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);

        /**
         * Multiplier applied to the delay when load crosses the threshold, must exceed 1.0.
         */
        @DecimalMin(value = "1.0", inclusive = false)
        private double backoffFactor = 2.0;

        /**
         * Fraction of the budget (0-1] above which the delay grows.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double backoffThreshold = 0.7;
    }

    /**
     * Consecutive-failure circuit breaker configuration.
     */
    @Data
    public static class CircuitBreakerConfig {

        /**
         * Consecutive failures that open the circuit.
         */
        @Min(1)
        private int threshold = 5;

        /**
         * Time since the last failure after which an open circuit allows a trial call.
         */
        @NotNull
        private Duration resetTime = Duration.ofSeconds(30);
    }

    /**
     * Retry configuration.
     */
    @Data
    public static class RetryConfig {

        /**
         * Maximum number of attempts, including the first one.
         */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * Base delay of the exponential backoff.
         */
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);
    }

    /**
     * Read cache configuration.
     */
    @Data
    public static class CacheConfig {

        /**
         * Time-to-live applied when no per-call TTL is given.
         */
        @NotNull
        private Duration defaultTtl = Duration.ofMinutes(5);

        /**
         * Maximum number of entries.
         */
        @Min(1)
        private int maxSize = 1000;

        /**
         * Whether a successful get extends the entry's TTL.
         */
        private boolean resetTtlOnGet = false;

        /**
         * Evict least recently used entries (true) or oldest inserted entries (false).
         */
        private boolean prioritizeRecentlyUsed = true;
    }

    /**
     * Per-endpoint concurrency limit (Resilience4j bulkhead).
     */
    @Data
    public static class BulkheadConfig {

        /**
         * Maximum concurrent calls against one endpoint.
         */
        @Min(1)
        private int maxConcurrentCalls = 10;

        /**
         * Maximum time to wait for a free slot.
         */
        @NotNull
        private Duration maxWait = Duration.ZERO;
    }

    /**
     * Executor configuration.
     */
    @Data
    public static class ExecutorConfig {

        /**
         * Maximum number of operations of one stage running at the same time.
         */
        @Min(1)
        private int maxConcurrentRequests = 4;

        /**
         * Timeout of a single attempt when the operation declares none.
         */
        @NotNull
        private Duration defaultOperationTimeout = Duration.ofSeconds(60);
    }

    /**
     * Endpoint-specific overrides. Any block left null falls back to the defaults.
     */
    @Data
    public static class EndpointConfig {

        @Valid
        private RateLimiterConfig rateLimiter;

        @Valid
        private CircuitBreakerConfig circuitBreaker;

        @Valid
        private RetryConfig retry;

        @Valid
        private CacheConfig cache;

        @Valid
        private BulkheadConfig bulkhead;
    }
}
