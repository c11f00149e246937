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

import java.util.List;

/**
 * Exception raised when an operation is missing one of its required input parameters.
 */
public class ParameterValidationException extends OrchestrationException {

    private final List<String> missingParameters;

    public ParameterValidationException(String operationType, List<String> missingParameters) {
        super("Operation '" + operationType + "' is missing required parameter(s): "
                + String.join(", ", missingParameters));
        this.missingParameters = List.copyOf(missingParameters);
    }

    public List<String> getMissingParameters() {
        return missingParameters;
    }
}
