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

import org.fireflyframework.orchestration.model.OperationContext;
import reactor.core.publisher.Mono;

/**
 * Body of an operation against a remote endpoint, supplied by the provider adapter.
 * <p>
 * The handler is invoked once per attempt and must return a fresh, cold Mono.
 * Failures should be signalled as
 * {@link org.fireflyframework.orchestration.exception.ProviderException} so the
 * executor can tell retryable errors from validation errors and pick up
 * rate-limit hints.
 *
 * @param <T> the output type
 */
@FunctionalInterface
public interface OperationHandler<T> {

    /**
     * Executes one attempt of the operation.
     *
     * @param context run input and outputs of finished operations
     * @return a Mono containing the operation output
     */
    Mono<T> execute(OperationContext context);

    /**
     * Checks if the operation should be skipped based on context.
     * <p>
     * A skipped operation is reported SKIPPED without touching the endpoint.
     *
     * @param context the operation context
     * @return true if the operation should be skipped
     */
    default boolean shouldSkip(OperationContext context) {
        return false;
    }
}
