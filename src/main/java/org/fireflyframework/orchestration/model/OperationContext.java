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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Context passed to an operation body.
 * <p>
 * Gives access to the run input and to the outputs of operations that already
 * finished successfully in the same run. Typed getters convert values with
 * Jackson when they are not already of the requested type.
 */
@Getter
public class OperationContext {

    private final String planId;
    private final OperationDescriptor operation;
    private final Map<String, Object> input;
    private final Map<String, Object> results;
    private final ObjectMapper objectMapper;

    public OperationContext(String planId,
                            OperationDescriptor operation,
                            Map<String, Object> input,
                            Map<String, Object> results,
                            ObjectMapper objectMapper) {
        this.planId = Objects.requireNonNull(planId, "planId cannot be null");
        this.operation = Objects.requireNonNull(operation, "operation cannot be null");
        this.input = Collections.unmodifiableMap(new LinkedHashMap<>(input));
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public String getOperationType() {
        return operation.type();
    }

    /**
     * Gets a value from the run input.
     *
     * @param key the input key
     * @return optional containing the value if present
     */
    public Optional<Object> getInput(String key) {
        return Optional.ofNullable(input.get(key));
    }

    /**
     * Gets a typed value from the run input.
     *
     * @param key the input key
     * @param type the expected type
     * @param <T> the type parameter
     * @return the typed value or null if not present
     */
    public <T> T getInput(String key, Class<T> type) {
        return convertValue(input.get(key), type);
    }

    public Map<String, Object> getAllInputs() {
        return input;
    }

    /**
     * Gets the output of a finished operation.
     *
     * @param operationType the type of the operation that produced the output
     * @return optional containing the output if the operation succeeded with one
     */
    public Optional<Object> getResult(String operationType) {
        return Optional.ofNullable(results.get(operationType));
    }

    /**
     * Gets the typed output of a finished operation.
     *
     * @param operationType the type of the operation that produced the output
     * @param type the expected type
     * @param <T> the type parameter
     * @return the typed output or null if there is none
     */
    public <T> T getResult(String operationType, Class<T> type) {
        return convertValue(results.get(operationType), type);
    }

    @SuppressWarnings("unchecked")
    private <T> T convertValue(Object value, Class<T> type) {
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return (T) value;
        }
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Cannot convert value of type " + value.getClass() + " to " + type, e);
        }
    }
}
