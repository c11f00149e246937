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
import java.util.Objects;
import java.util.Optional;

/**
 * Final outcome of a single operation within a run.
 * <p>
 * A result is built once the operation reaches a terminal state and is never
 * mutated afterwards. Failed results keep the original error with its full
 * cause chain.
 */
public record OperationResult(
        String type,
        String endpoint,
        boolean required,
        OperationStatus status,
        Instant startedAt,
        Instant finishedAt,
        int attempts,
        Throwable error,
        Object output
) {

    public OperationResult {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(startedAt, "startedAt cannot be null");
        Objects.requireNonNull(finishedAt, "finishedAt cannot be null");
    }

    /**
     * Creates a successful result.
     *
     * @param descriptor the executed operation
     * @param startedAt when the operation started
     * @param finishedAt when the operation finished
     * @param attempts how many attempts were made
     * @param output the operation output, may be null
     * @return new result
     */
    public static OperationResult success(OperationDescriptor descriptor, Instant startedAt,
                                          Instant finishedAt, int attempts, Object output) {
        return new OperationResult(descriptor.type(), descriptor.endpoint(), descriptor.required(),
                OperationStatus.SUCCESS, startedAt, finishedAt, attempts, null, output);
    }

    /**
     * Creates a failed result.
     *
     * @param descriptor the executed operation
     * @param startedAt when the operation started
     * @param finishedAt when the operation finished
     * @param attempts how many attempts were made
     * @param error the error that caused the failure
     * @return new result
     */
    public static OperationResult failure(OperationDescriptor descriptor, Instant startedAt,
                                          Instant finishedAt, int attempts, Throwable error) {
        return new OperationResult(descriptor.type(), descriptor.endpoint(), descriptor.required(),
                OperationStatus.FAILURE, startedAt, finishedAt, attempts,
                Objects.requireNonNull(error, "error cannot be null"), null);
    }

    /**
     * Creates a skipped result for an operation that was never attempted.
     *
     * @param descriptor the skipped operation
     * @param at when the decision was made
     * @param reason why the operation was skipped
     * @return new result
     */
    public static OperationResult skipped(OperationDescriptor descriptor, Instant at, Throwable reason) {
        return new OperationResult(descriptor.type(), descriptor.endpoint(), descriptor.required(),
                OperationStatus.SKIPPED, at, at, 0, reason, null);
    }

    /**
     * Creates a cancelled result for an operation that was never dequeued.
     *
     * @param descriptor the cancelled operation
     * @param at when the cancellation was observed
     * @param reason the cancellation error
     * @return new result
     */
    public static OperationResult cancelled(OperationDescriptor descriptor, Instant at, Throwable reason) {
        return new OperationResult(descriptor.type(), descriptor.endpoint(), descriptor.required(),
                OperationStatus.CANCELLED, at, at, 0, reason, null);
    }

    /**
     * Gets the error message, if the result carries an error.
     *
     * @return optional error message
     */
    public Optional<String> errorMessage() {
        return Optional.ofNullable(error).map(Throwable::getMessage);
    }

    /**
     * Gets the duration of the operation.
     *
     * @return time between start and finish
     */
    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
