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

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Resolved execution order of an operation set.
 * <p>
 * The plan is a sequence of stages. Operations inside one stage have no
 * dependency edges between them and may run concurrently; stages run strictly
 * in order. Within a stage, operations keep their declaration order.
 *
 * @param planId Unique identifier of this plan
 * @param stages Ordered stages, each a list of mutually independent operations
 */
public record ExecutionPlan(String planId, List<List<OperationDescriptor>> stages) {

    public ExecutionPlan {
        Objects.requireNonNull(planId, "planId cannot be null");
        Objects.requireNonNull(stages, "stages cannot be null");
        stages = stages.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Creates a plan with a generated identifier.
     *
     * @param stages the resolved stages
     * @return new plan
     */
    public static ExecutionPlan of(List<List<OperationDescriptor>> stages) {
        return new ExecutionPlan(UUID.randomUUID().toString(), stages);
    }

    /**
     * Flattens the stages into the resolved execution order.
     *
     * @return every operation, stage by stage
     */
    public List<OperationDescriptor> order() {
        return stages.stream().flatMap(List::stream).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Flattens the stages into operation types.
     *
     * @return every operation type in resolved order
     */
    public List<String> orderedTypes() {
        return stages.stream()
                .flatMap(List::stream)
                .map(OperationDescriptor::type)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Finds an operation in the plan.
     *
     * @param type the operation type
     * @return optional containing the descriptor if planned
     */
    public Optional<OperationDescriptor> find(String type) {
        return stages.stream()
                .flatMap(List::stream)
                .filter(d -> d.type().equals(type))
                .findFirst();
    }

    public int size() {
        return stages.stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
