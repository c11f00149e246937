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
import org.fireflyframework.orchestration.cache.OperationCache;

/**
 * Resilience components owned by one remote endpoint.
 * <p>
 * Instances are created by {@link EndpointRegistry} and never shared between
 * endpoint names.
 *
 * @param endpoint the endpoint name
 * @param rateLimiter adaptive limiter for requests against the endpoint
 * @param circuitBreaker breaker tracking consecutive endpoint failures
 * @param retryEngine backoff policy for retryable failures
 * @param cache memoized results of cacheable operations
 * @param bulkhead concurrent call limit for the endpoint
 */
public record EndpointResilience(
        String endpoint,
        AdaptiveRateLimiter rateLimiter,
        CircuitBreaker circuitBreaker,
        RetryEngine retryEngine,
        OperationCache<String, Object> cache,
        Bulkhead bulkhead
) {

    /**
     * Restores limiter, breaker and cache to their initial state.
     */
    public void reset() {
        rateLimiter.reset();
        circuitBreaker.reset();
        cache.clear();
    }

    public EndpointStatus status() {
        return new EndpointStatus(endpoint, circuitBreaker.getState(), circuitBreaker.getFailureCount(),
                rateLimiter.getMetrics(), cache.getStats(),
                bulkhead.getMetrics().getAvailableConcurrentCalls());
    }
}
