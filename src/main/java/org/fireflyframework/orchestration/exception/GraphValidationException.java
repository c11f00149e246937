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

package org.fireflyframework.orchestration.exception;

import org.fireflyframework.orchestration.core.DependencyError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when an operation set cannot be resolved into an execution plan.
 * <p>
 * This exception is thrown before any operation executes when:
 * <ul>
 *   <li>An operation depends on an operation that was not declared</li>
 *   <li>Circular dependencies are detected</li>
 *   <li>A required operation depends on a non-required one</li>
 *   <li>Two operations share the same type</li>
 * </ul>
 */
public class GraphValidationException extends OrchestrationException {

    private final List<DependencyError> errors;

    /**
     * Creates a new graph validation exception from the detected errors.
     *
     * @param errors the dependency errors, never empty
     */
    public GraphValidationException(List<DependencyError> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * Gets every error detected while validating the graph.
     *
     * @return immutable list of errors
     */
    public List<DependencyError> getErrors() {
        return errors;
    }

    private static String describe(List<DependencyError> errors) {
        return "Operation graph is invalid: " + errors.stream()
                .map(DependencyError::message)
                .collect(Collectors.joining("; "));
    }
}
