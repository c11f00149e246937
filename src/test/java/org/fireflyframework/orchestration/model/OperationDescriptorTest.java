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

package org.fireflyframework.orchestration.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for OperationDescriptor.
 */
class OperationDescriptorTest {

    @Test
    void shouldApplyDefaults() {
        OperationDescriptor descriptor = OperationDescriptor.of("authenticate");

        assertThat(descriptor.required()).isTrue();
        assertThat(descriptor.endpoint()).isEqualTo(OperationDescriptor.DEFAULT_ENDPOINT);
        assertThat(descriptor.estimatedCost()).isEqualTo(1);
        assertThat(descriptor.cacheable()).isFalse();
        assertThat(descriptor.timeout()).isNull();
        assertThat(descriptor.dependencies()).isEmpty();
        assertThat(descriptor.hasDependencies()).isFalse();
    }

    @Test
    void shouldDeduplicateDependenciesKeepingOrder() {
        OperationDescriptor descriptor = OperationDescriptor.of("get_test_cases",
                "get_projects", "authenticate", "get_projects");

        assertThat(descriptor.dependencies()).containsExactly("get_projects", "authenticate");
    }

    @Test
    void shouldCopyCollections() {
        List<String> dependencies = new ArrayList<>(List.of("authenticate"));
        OperationDescriptor descriptor = new OperationDescriptor("get_projects", dependencies, true, 1,
                "jira", List.of("projectKey"), true, Duration.ofSeconds(5), "Lists projects");

        dependencies.add("get_fields");

        assertThat(descriptor.dependencies()).containsExactly("authenticate");
        assertThat(descriptor.requiredParams()).containsExactly("projectKey");
    }

    @Test
    void shouldFallBackToDefaultEndpoint() {
        OperationDescriptor descriptor = OperationDescriptor.builder().type("get_users").endpoint(" ").build();

        assertThat(descriptor.endpoint()).isEqualTo(OperationDescriptor.DEFAULT_ENDPOINT);
    }

    @Test
    void shouldRejectBlankType() {
        assertThatThrownBy(() -> OperationDescriptor.of(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OperationDescriptor.builder().build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldRejectNegativeCost() {
        assertThatThrownBy(() -> OperationDescriptor.builder().type("get_users").estimatedCost(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCopyWithDifferentRequiredFlag() {
        OperationDescriptor descriptor = OperationDescriptor.builder()
                .type("get_attachments")
                .dependsOn("authenticate")
                .cacheable(true)
                .build();

        OperationDescriptor optional = descriptor.withRequired(false);

        assertThat(optional.required()).isFalse();
        assertThat(optional.dependencies()).containsExactly("authenticate");
        assertThat(optional.cacheable()).isTrue();
        assertThat(descriptor.required()).isTrue();
    }
}
