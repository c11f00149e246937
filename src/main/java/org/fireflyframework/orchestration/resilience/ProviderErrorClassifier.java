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

package org.fireflyframework.orchestration.resilience;

import io.github.resilience4j.bulkhead.BulkheadFullException;
import org.fireflyframework.orchestration.exception.CircuitOpenException;
import org.fireflyframework.orchestration.exception.ParameterValidationException;
import org.fireflyframework.orchestration.exception.ProviderException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Default retryability predicate for provider calls.
 * <p>
 * Retryable: provider errors flagged retryable by the adapter (server,
 * network, timeout and 429 classes), {@link TimeoutException},
 * {@link IOException} and a full endpoint bulkhead. Everything else, including
 * validation-class provider errors, open circuits, missing parameters and
 * cancellation, is not retried.
 */
public final class ProviderErrorClassifier implements Predicate<Throwable> {

    public static final ProviderErrorClassifier INSTANCE = new ProviderErrorClassifier();

    private ProviderErrorClassifier() {
    }

    @Override
    public boolean test(Throwable error) {
        if (error instanceof ProviderException providerError) {
            return providerError.isRetryable();
        }
        return error instanceof TimeoutException
                || error instanceof IOException
                || error instanceof BulkheadFullException;
    }

    /**
     * Checks if an error says something about the endpoint's health and should
     * count against its circuit breaker.
     * <p>
     * Validation-class provider errors mean the endpoint answered and are not
     * counted. Rejections raised locally (open circuit, full bulkhead, missing
     * parameters) never reached the endpoint.
     *
     * @param error the failure of one attempt
     * @return true if the failure should be recorded on the breaker
     */
    public boolean countsAsEndpointFailure(Throwable error) {
        if (error instanceof CircuitOpenException
                || error instanceof BulkheadFullException
                || error instanceof ParameterValidationException) {
            return false;
        }
        if (error instanceof ProviderException providerError) {
            return providerError.isRetryable();
        }
        return true;
    }
}
