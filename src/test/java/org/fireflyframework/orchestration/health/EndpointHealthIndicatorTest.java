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

import org.fireflyframework.orchestration.MutableClock;
import org.fireflyframework.orchestration.properties.OrchestrationProperties;
import org.fireflyframework.orchestration.resilience.CircuitBreaker;
import org.fireflyframework.orchestration.resilience.CircuitState;
import org.fireflyframework.orchestration.resilience.EndpointRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for EndpointHealthIndicator.
 */
@ExtendWith(MockitoExtension.class)
class EndpointHealthIndicatorTest {

    @Mock
    private EndpointRegistry failingRegistry;

    private MutableClock clock;
    private EndpointRegistry registry;
    private EndpointHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T12:00:00Z");
        registry = new EndpointRegistry(new OrchestrationProperties(), clock, Schedulers.parallel());
        indicator = new EndpointHealthIndicator(registry);
    }

    @Test
    void shouldBeUpWithoutEndpoints() {
        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsEntry("endpointCount", 0);
                })
                .verifyComplete();
    }

    @Test
    void shouldBeDownWhenAnyCircuitIsOpen() {
        registry.getOrCreate("jira");
        open(registry.getOrCreate("zephyr").circuitBreaker());

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("endpointCount", 2);

                    @SuppressWarnings("unchecked")
                    Map<String, Map<String, Object>> endpoints =
                            (Map<String, Map<String, Object>>) health.getDetails().get("endpoints");
                    assertThat(endpoints.get("jira")).containsEntry("circuitState", "CLOSED")
                            .containsEntry("status", "UP");
                    assertThat(endpoints.get("zephyr")).containsEntry("circuitState", "OPEN")
                            .containsEntry("failureCount", 5)
                            .containsEntry("rateLimited", false);
                })
                .verifyComplete();
    }

    @Test
    void shouldReportDegradedWhileCircuitIsHalfOpen() {
        registry.getOrCreate("jira");
        open(registry.getOrCreate("zephyr").circuitBreaker());
        clock.advance(Duration.ofSeconds(31));

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN))
                .verifyComplete();
    }

    @Test
    void shouldReportDownWhenRegistryCannotBeRead() {
        when(failingRegistry.endpoints()).thenThrow(new IllegalStateException("registry unavailable"));

        StepVerifier.create(new EndpointHealthIndicator(failingRegistry).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("error", "registry unavailable");
                })
                .verifyComplete();
    }

    @Test
    void shouldMapCircuitStates() {
        assertThat(EndpointHealthIndicator.statusOf(CircuitState.CLOSED)).isEqualTo(Status.UP);
        assertThat(EndpointHealthIndicator.statusOf(CircuitState.HALF_OPEN)).isEqualTo(Status.UNKNOWN);
        assertThat(EndpointHealthIndicator.statusOf(CircuitState.OPEN)).isEqualTo(Status.DOWN);
    }

    private static void open(CircuitBreaker breaker) {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure();
        }
    }
}
