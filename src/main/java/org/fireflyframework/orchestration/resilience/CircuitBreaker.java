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

import org.fireflyframework.orchestration.properties.OrchestrationProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Consecutive-failure circuit breaker scoped to a single remote endpoint.
 * <p>
 * The OPEN to HALF_OPEN transition is evaluated lazily whenever the state is
 * queried. {@link #recordSuccess()} and {@link #recordFailure()} are the only
 * mutators besides {@link #reset()}; all access is serialized on the instance.
 * <p>
 * Instances must never be shared between endpoints.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int threshold;
    private final Duration resetTime;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;

    public CircuitBreaker(String name, OrchestrationProperties.CircuitBreakerConfig config, Clock clock) {
        this(name, config.getThreshold(), config.getResetTime(), clock);
    }

    public CircuitBreaker(String name, int threshold, Duration resetTime, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be positive (current: " + threshold + ")");
        }
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.threshold = threshold;
        this.resetTime = Objects.requireNonNull(resetTime, "resetTime cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Checks if a call may proceed.
     *
     * @return false only while the circuit is OPEN
     */
    public synchronized boolean isAllowed() {
        return evaluateState() != CircuitState.OPEN;
    }

    /**
     * Records a successful call. Closes a HALF_OPEN circuit and clears the failure count.
     */
    public synchronized void recordSuccess() {
        CircuitState current = evaluateState();
        failureCount = 0;
        if (current == CircuitState.HALF_OPEN) {
            transitionTo(CircuitState.CLOSED);
        }
    }

    /**
     * Records a failed call. Opens the circuit once the threshold of consecutive
     * failures is reached, or immediately when the circuit is HALF_OPEN.
     */
    public synchronized void recordFailure() {
        CircuitState current = evaluateState();
        failureCount++;
        lastFailureAt = clock.instant();

        if (current == CircuitState.HALF_OPEN) {
            transitionTo(CircuitState.OPEN);
        } else if (current == CircuitState.CLOSED && failureCount >= threshold) {
            transitionTo(CircuitState.OPEN);
        }
    }

    /**
     * Gets the current state, applying the lazy OPEN to HALF_OPEN transition.
     *
     * @return CLOSED, OPEN or HALF_OPEN
     */
    public synchronized CircuitState getState() {
        return evaluateState();
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Optional<Instant> getLastFailureAt() {
        return Optional.ofNullable(lastFailureAt);
    }

    /**
     * Forces the circuit back to CLOSED and clears the failure history.
     */
    public synchronized void reset() {
        failureCount = 0;
        lastFailureAt = null;
        if (state != CircuitState.CLOSED) {
            transitionTo(CircuitState.CLOSED);
        }
        log.info("CIRCUIT_BREAKER_RESET: name={}", name);
    }

    public String getName() {
        return name;
    }

    private CircuitState evaluateState() {
        if (state == CircuitState.OPEN && lastFailureAt != null
                && !clock.instant().isBefore(lastFailureAt.plus(resetTime))) {
            transitionTo(CircuitState.HALF_OPEN);
        }
        return state;
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (next == CircuitState.OPEN) {
            log.warn("CIRCUIT_BREAKER_STATE: name={}, from={}, to={}, failureCount={}",
                    name, previous, next, failureCount);
        } else {
            log.info("CIRCUIT_BREAKER_STATE: name={}, from={}, to={}", name, previous, next);
        }
    }
}
