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

package org.fireflyframework.orchestration.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.orchestration.core.OperationDependencyResolver;
import org.fireflyframework.orchestration.core.OperationExecutor;
import org.fireflyframework.orchestration.health.EndpointHealthIndicator;
import org.fireflyframework.orchestration.metrics.OrchestrationMetrics;
import org.fireflyframework.orchestration.properties.OrchestrationProperties;
import org.fireflyframework.orchestration.resilience.EndpointRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for OrchestrationAutoConfiguration.
 */
class OrchestrationAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(OrchestrationAutoConfiguration.class));

    @Test
    void shouldRegisterCoreBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(EndpointRegistry.class);
            assertThat(context).hasSingleBean(OperationDependencyResolver.class);
            assertThat(context).hasSingleBean(OperationExecutor.class);
            assertThat(context).hasSingleBean(EndpointHealthIndicator.class);
            assertThat(context).doesNotHaveBean(OrchestrationMetrics.class);
        });
    }

    @Test
    void shouldRegisterMetricsWhenMeterRegistryIsPresent() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> assertThat(context).hasSingleBean(OrchestrationMetrics.class));
    }

    @Test
    void shouldHonourMetricsAndHealthSwitches() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues(
                        "firefly.orchestration.metrics-enabled=false",
                        "firefly.orchestration.health-indicator-enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(OrchestrationMetrics.class);
                    assertThat(context).doesNotHaveBean(EndpointHealthIndicator.class);
                    assertThat(context).hasSingleBean(OperationExecutor.class);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("firefly.orchestration.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(OperationExecutor.class);
                    assertThat(context).doesNotHaveBean(EndpointRegistry.class);
                });
    }

    @Test
    void shouldBindEndpointOverrides() {
        contextRunner
                .withPropertyValues(
                        "firefly.orchestration.rate-limiter.max-requests-per-minute=120",
                        "firefly.orchestration.retry.base-delay=250ms",
                        "firefly.orchestration.endpoints.zephyr.circuit-breaker.threshold=2",
                        "firefly.orchestration.endpoints.zephyr.circuit-breaker.reset-time=10s")
                .run(context -> {
                    OrchestrationProperties properties = context.getBean(OrchestrationProperties.class);
                    assertThat(properties.getRateLimiter().getMaxRequestsPerMinute()).isEqualTo(120);
                    assertThat(properties.getRetry().getBaseDelay()).isEqualTo(Duration.ofMillis(250));
                    assertThat(properties.circuitBreakerFor("zephyr").getThreshold()).isEqualTo(2);
                    assertThat(properties.circuitBreakerFor("jira").getThreshold()).isEqualTo(5);

                    EndpointRegistry registry = context.getBean(EndpointRegistry.class);
                    assertThat(registry.getOrCreate("jira").retryEngine().getBaseDelay())
                            .isEqualTo(Duration.ofMillis(250));
                });
    }

    @Test
    void shouldFailOnInvalidProperties() {
        contextRunner
                .withPropertyValues("firefly.orchestration.rate-limiter.max-requests-per-minute=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
