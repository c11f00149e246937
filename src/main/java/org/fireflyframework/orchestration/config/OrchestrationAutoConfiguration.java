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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.fireflyframework.orchestration.core.OperationDependencyResolver;
import org.fireflyframework.orchestration.core.OperationExecutor;
import org.fireflyframework.orchestration.health.EndpointHealthIndicator;
import org.fireflyframework.orchestration.metrics.OrchestrationMetrics;
import org.fireflyframework.orchestration.properties.OrchestrationProperties;
import org.fireflyframework.orchestration.resilience.EndpointRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Auto-configuration for the operation orchestration engine.
 * <p>
 * Registers the endpoint registry, the dependency resolver and the executor,
 * plus Micrometer metrics when a {@link MeterRegistry} is present and an
 * actuator health indicator when actuator is on the classpath.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@EnableConfigurationProperties(OrchestrationProperties.class)
@ConditionalOnProperty(prefix = "firefly.orchestration", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OrchestrationAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "orchestrationClock")
    public Clock orchestrationClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(name = "orchestrationScheduler")
    public Scheduler orchestrationScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    @ConditionalOnMissingBean
    public EndpointRegistry endpointRegistry(OrchestrationProperties properties,
                                             Clock orchestrationClock,
                                             Scheduler orchestrationScheduler) {
        log.info("Creating EndpointRegistry with {} endpoint override(s)", properties.getEndpoints().size());
        return new EndpointRegistry(properties, orchestrationClock, orchestrationScheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public OperationDependencyResolver operationDependencyResolver() {
        return new OperationDependencyResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "firefly.orchestration", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public OrchestrationMetrics orchestrationMetrics(MeterRegistry meterRegistry, EndpointRegistry endpointRegistry) {
        log.info("Creating OrchestrationMetrics");
        return new OrchestrationMetrics(meterRegistry, endpointRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public OperationExecutor operationExecutor(EndpointRegistry endpointRegistry,
                                               OperationDependencyResolver resolver,
                                               OrchestrationProperties properties,
                                               ObjectProvider<ObjectMapper> objectMapper,
                                               Clock orchestrationClock,
                                               Scheduler orchestrationScheduler,
                                               @Nullable OrchestrationMetrics orchestrationMetrics) {
        log.info("Creating OperationExecutor with maxConcurrentRequests: {}, metrics: {}",
                properties.getExecutor().getMaxConcurrentRequests(), orchestrationMetrics != null);
        return new OperationExecutor(endpointRegistry, resolver, properties.getExecutor(),
                objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules()),
                orchestrationClock, orchestrationScheduler, orchestrationMetrics);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    static class EndpointHealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(prefix = "firefly.orchestration", name = "health-indicator-enabled", havingValue = "true", matchIfMissing = true)
        public EndpointHealthIndicator endpointHealthIndicator(EndpointRegistry endpointRegistry) {
            log.info("Creating EndpointHealthIndicator");
            return new EndpointHealthIndicator(endpointRegistry);
        }
    }
}
