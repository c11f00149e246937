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

package org.fireflyframework.orchestration.core;

import java.util.List;

/**
 * A single problem found while validating an operation graph.
 *
 * @param type the kind of problem
 * @param operation the operation the problem was found on
 * @param message human-readable description naming the offending operations
 */
public record DependencyError(DependencyErrorType type, String operation, String message) {

    public static DependencyError duplicate(String operation) {
        return new DependencyError(DependencyErrorType.DUPLICATE_OPERATION, operation,
                String.format("Operation '%s' is declared more than once", operation));
    }

    public static DependencyError missing(String operation, String dependency) {
        return new DependencyError(DependencyErrorType.MISSING_OPERATION, operation,
                String.format("Operation '%s' depends on undeclared operation '%s'", operation, dependency));
    }

    public static DependencyError missingGoal(String goal) {
        return new DependencyError(DependencyErrorType.MISSING_OPERATION, goal,
                String.format("Goal operation '%s' is not declared", goal));
    }

    public static DependencyError cycle(List<String> path) {
        return new DependencyError(DependencyErrorType.CIRCULAR_DEPENDENCY, path.get(0),
                "Circular dependency: " + String.join(" -> ", path));
    }

    public static DependencyError requiredOnOptional(String operation, String optionalDependency) {
        return new DependencyError(DependencyErrorType.REQUIRED_DEPENDS_ON_OPTIONAL, operation,
                String.format("Required operation '%s' depends on non-required operation '%s'",
                        operation, optionalDependency));
    }
}
