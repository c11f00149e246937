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
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated outcome of executing one plan.
 *
 * @param planId Identifier of the executed plan
 * @param status Overall run status
 * @param results Every operation result, in resolved plan order
 * @param startedAt When the run started
 * @param finishedAt When the last operation reached a terminal state
 */
public record RunReport(
        String planId,
        RunStatus status,
        List<OperationResult> results,
        Instant startedAt,
        Instant finishedAt
) {

    public RunReport {
        Objects.requireNonNull(planId, "planId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        results = results == null ? List.of() : List.copyOf(results);
    }

    /**
     * Finds the result of an operation.
     *
     * @param type the operation type
     * @return optional containing the result if the operation was planned
     */
    public Optional<OperationResult> result(String type) {
        return results.stream().filter(r -> r.type().equals(type)).findFirst();
    }

    /**
     * Counts results with the given status.
     *
     * @param status the status to count
     * @return number of matching results
     */
    public long count(OperationStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
