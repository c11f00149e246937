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

package org.fireflyframework.orchestration.health;

import org.fireflyframework.orchestration.resilience.CircuitState;
import org.fireflyframework.orchestration.resilience.EndpointRegistry;
import org.fireflyframework.orchestration.resilience.EndpointStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reports the resilience state of every known endpoint.
 * <p>
 * The overall status is DOWN if any circuit is open, UNKNOWN (degraded) if any
 * circuit is half open, and UP otherwise.
 */
@Slf4j
@RequiredArgsConstructor
public class EndpointHealthIndicator implements ReactiveHealthIndicator {

    private final EndpointRegistry endpointRegistry;

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::buildHealth)
                .onErrorResume(e -> {
                    log.warn("Endpoint health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Health buildHealth() {
        List<EndpointStatus> statuses = endpointRegistry.endpoints().stream()
                .map(endpointRegistry::snapshot)
                .flatMap(Optional::stream)
                .toList();

        Map<String, Object> endpoints = new LinkedHashMap<>();
        Status overall = Status.UP;
        for (EndpointStatus status : statuses) {
            endpoints.put(status.endpoint(), Map.of(
                    "circuitState", status.circuitState().name(),
                    "status", statusOf(status.circuitState()).getCode(),
                    "failureCount", status.failureCount(),
                    "rateLimited", status.rateLimiter().isRateLimited(),
                    "currentDelayMs", status.rateLimiter().currentDelayMs()));
            overall = worst(overall, statusOf(status.circuitState()));
        }

        return Health.status(overall)
                .withDetail("endpointCount", statuses.size())
                .withDetail("endpoints", endpoints)
                .build();
    }

    static Status statusOf(CircuitState state) {
        return switch (state) {
            case CLOSED -> Status.UP;
            case HALF_OPEN -> Status.UNKNOWN;
            case OPEN -> Status.DOWN;
        };
    }

    private static Status worst(Status current, Status candidate) {
        if (Status.DOWN.equals(current) || Status.DOWN.equals(candidate)) {
            return Status.DOWN;
        }
        if (Status.UNKNOWN.equals(current) || Status.UNKNOWN.equals(candidate)) {
            return Status.UNKNOWN;
        }
        return Status.UP;
    }
}
