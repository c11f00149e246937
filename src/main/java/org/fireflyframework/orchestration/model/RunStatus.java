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

import java.util.Collection;

/**
 * Represents the overall outcome of executing a plan.
 */
public enum RunStatus {

    /**
     * Every operation succeeded.
     */
    SUCCESS,

    /**
     * Every required operation succeeded but at least one optional operation did not.
     */
    PARTIAL_SUCCESS,

    /**
     * A required operation did not succeed, or nothing succeeded at all.
     */
    FAILURE,

    /**
     * The run was cancelled before every operation could start.
     */
    CANCELLED;

    /**
     * Derives the run status from the final operation results.
     *
     * @param results every result of the run
     * @return the aggregated status
     */
    public static RunStatus of(Collection<OperationResult> results) {
        if (results.stream().anyMatch(r -> r.status() == OperationStatus.CANCELLED)) {
            return CANCELLED;
        }
        boolean requiredFailed = results.stream()
                .anyMatch(r -> r.required() && !r.status().isSuccessful());
        boolean anySucceeded = results.stream().anyMatch(r -> r.status().isSuccessful());
        if (requiredFailed || (!results.isEmpty() && !anySucceeded)) {
            return FAILURE;
        }
        boolean optionalFailed = results.stream().anyMatch(r -> !r.status().isSuccessful());
        return optionalFailed ? PARTIAL_SUCCESS : SUCCESS;
    }
}
