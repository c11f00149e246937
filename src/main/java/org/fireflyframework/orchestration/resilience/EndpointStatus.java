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

import org.fireflyframework.orchestration.cache.CacheStats;

/**
 * Point-in-time view of an endpoint's resilience state.
 *
 * @param endpoint the endpoint name
 * @param circuitState current breaker state
 * @param failureCount consecutive failures recorded by the breaker
 * @param rateLimiter limiter metrics
 * @param cache cache statistics
 * @param availableConcurrentCalls free bulkhead permits
 */
public record EndpointStatus(
        String endpoint,
        CircuitState circuitState,
        int failureCount,
        RateLimiterMetrics rateLimiter,
        CacheStats cache,
        int availableConcurrentCalls
) {
}
