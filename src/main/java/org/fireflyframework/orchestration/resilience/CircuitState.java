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

/**
 * State of an endpoint circuit breaker.
 * <pre>
 * CLOSED --(threshold consecutive failures)--> OPEN
 * OPEN --(reset time elapsed since last failure)--> HALF_OPEN
 * HALF_OPEN --(success)--> CLOSED
 * HALF_OPEN --(failure)--> OPEN
 * </pre>
 */
public enum CircuitState {

    /**
     * Normal operation, calls pass through.
     */
    CLOSED,

    /**
     * Calls fail fast without reaching the endpoint.
     */
    OPEN,

    /**
     * A trial call is allowed to probe whether the endpoint recovered.
     */
    HALF_OPEN
}
