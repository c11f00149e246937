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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Declares a named operation against a remote endpoint.
 * <p>
 * Descriptors are plain data: the operation body is bound separately by type
 * when the plan is executed. Dependencies keep their declaration order and
 * duplicates are dropped.
 *
 * @param type Unique name of the operation within a batch (e.g. "get_projects")
 * @param dependencies Types of the operations that must finish before this one starts
 * @param required Whether a failure of this operation aborts its dependents and fails the run
 * @param estimatedCost Relative cost hint used by callers for budgeting
 * @param endpoint Name of the remote endpoint whose limiter, breaker and cache apply
 * @param requiredParams Run input keys that must be present before the operation is attempted
 * @param cacheable Whether the operation is an idempotent read whose result may be memoized
 * @param timeout Maximum duration of a single attempt, or null for the executor default
 * @param description Human-readable description
 */
public record OperationDescriptor(
        String type,
        List<String> dependencies,
        boolean required,
        int estimatedCost,
        String endpoint,
        List<String> requiredParams,
        boolean cacheable,
        Duration timeout,
        String description
) {

    public static final String DEFAULT_ENDPOINT = "default";

    public OperationDescriptor {
        Objects.requireNonNull(type, "type cannot be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type cannot be blank");
        }
        dependencies = dependencies == null
                ? Collections.emptyList()
                : List.copyOf(new LinkedHashSet<>(dependencies));
        requiredParams = requiredParams == null
                ? Collections.emptyList()
                : List.copyOf(requiredParams);
        if (estimatedCost < 0) {
            throw new IllegalArgumentException("estimatedCost cannot be negative");
        }
        if (endpoint == null || endpoint.isBlank()) {
            endpoint = DEFAULT_ENDPOINT;
        }
        if (description == null) {
            description = "";
        }
    }

    /**
     * Creates a required descriptor on the default endpoint.
     *
     * @param type the operation type
     * @param dependencies the dependency types
     * @return new descriptor
     */
    public static OperationDescriptor of(String type, String... dependencies) {
        return builder().type(type).dependsOn(dependencies).build();
    }

    /**
     * Checks if this operation declares dependencies.
     *
     * @return true if this operation depends on other operations
     */
    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    /**
     * Returns a copy of this descriptor with a different required flag.
     *
     * @param required the new flag
     * @return updated descriptor
     */
    public OperationDescriptor withRequired(boolean required) {
        return new OperationDescriptor(type, dependencies, required, estimatedCost, endpoint,
                requiredParams, cacheable, timeout, description);
    }

    /**
     * Builder for OperationDescriptor.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String type;
        private final List<String> dependencies = new ArrayList<>();
        private boolean required = true;
        private int estimatedCost = 1;
        private String endpoint = DEFAULT_ENDPOINT;
        private final List<String> requiredParams = new ArrayList<>();
        private boolean cacheable = false;
        private Duration timeout;
        private String description = "";

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder dependsOn(String... types) {
            this.dependencies.addAll(Arrays.asList(types));
            return this;
        }

        public Builder dependsOn(List<String> types) {
            this.dependencies.addAll(types);
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder estimatedCost(int estimatedCost) {
            this.estimatedCost = estimatedCost;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder requiredParams(String... params) {
            this.requiredParams.addAll(Arrays.asList(params));
            return this;
        }

        public Builder cacheable(boolean cacheable) {
            this.cacheable = cacheable;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public OperationDescriptor build() {
            return new OperationDescriptor(type, dependencies, required, estimatedCost, endpoint,
                    requiredParams, cacheable, timeout, description);
        }
    }
}
