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

/**
 * Exception raised when every allowed attempt failed with a retryable error.
 * The last underlying error is kept as the cause.
 */
public class RetryExhaustedException extends OrchestrationException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("Retries exhausted after " + attempts + " attempt(s): " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
