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
 * Outcome of validating an operation set without resolving it.
 *
 * @param valid true if no error was found
 * @param errors every error found, in detection order
 */
public record DependencyValidationResult(boolean valid, List<DependencyError> errors) {

    public DependencyValidationResult {
        errors = List.copyOf(errors);
    }

    public static DependencyValidationResult of(List<DependencyError> errors) {
        return new DependencyValidationResult(errors.isEmpty(), errors);
    }

    /**
     * Filters the errors by kind.
     */
    public List<DependencyError> errorsOf(DependencyErrorType type) {
        return errors.stream().filter(e -> e.type() == type).toList();
    }

    public boolean hasErrors(DependencyErrorType type) {
        return errors.stream().anyMatch(e -> e.type() == type);
    }
}
