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

import java.util.Optional;

/**
 * Exception raised by a provider adapter when a remote call fails.
 * <p>
 * The adapter classifies the failure; the orchestration core only reads the
 * classification:
 * <ul>
 *   <li>{@link #isRetryable()} - whether another attempt may succeed</li>
 *   <li>{@link #getStatusCode()} - the remote status code, if any</li>
 *   <li>{@link #getRetryAfterMs()} - an explicit rate-limit hint from the provider</li>
 *   <li>{@link #isTimeout()} - whether the call timed out</li>
 * </ul>
 */
public class ProviderException extends OrchestrationException {

    public static final int TOO_MANY_REQUESTS = 429;

    private final boolean retryable;
    private final Integer statusCode;
    private final Long retryAfterMs;
    private final boolean timeout;

    public ProviderException(String message, boolean retryable) {
        this(message, retryable, null, null, false, null);
    }

    public ProviderException(String message, boolean retryable, Throwable cause) {
        this(message, retryable, null, null, false, cause);
    }

    public ProviderException(String message,
                             boolean retryable,
                             Integer statusCode,
                             Long retryAfterMs,
                             boolean timeout,
                             Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
        this.timeout = timeout;
    }

    /**
     * Creates an exception from a remote status code.
     * <p>
     * Server errors (5xx) and 429 are retryable; other statuses are treated as
     * validation-class failures and are not.
     *
     * @param statusCode the remote status code
     * @param message the error message
     * @return the classified exception
     */
    public static ProviderException fromStatus(int statusCode, String message) {
        boolean retryable = statusCode >= 500 || statusCode == TOO_MANY_REQUESTS;
        return new ProviderException(message, retryable, statusCode, null, false, null);
    }

    /**
     * Creates a rate-limit exception carrying the provider's Retry-After hint.
     *
     * @param retryAfterMs milliseconds until the provider accepts calls again
     * @param message the error message
     * @return the classified exception
     */
    public static ProviderException rateLimited(long retryAfterMs, String message) {
        return new ProviderException(message, true, TOO_MANY_REQUESTS, retryAfterMs, false, null);
    }

    /**
     * Creates a retryable timeout exception.
     *
     * @param message the error message
     * @return the classified exception
     */
    public static ProviderException timedOut(String message) {
        return new ProviderException(message, true, null, null, true, null);
    }

    /**
     * Creates a retryable network exception, e.g. a refused or reset connection.
     *
     * @param message the error message
     * @param cause the underlying I/O error
     * @return the classified exception
     */
    public static ProviderException network(String message, Throwable cause) {
        return new ProviderException(message, true, null, null, false, cause);
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Optional<Integer> getStatusCode() {
        return Optional.ofNullable(statusCode);
    }

    public Optional<Long> getRetryAfterMs() {
        return Optional.ofNullable(retryAfterMs);
    }

    public boolean isTimeout() {
        return timeout;
    }

    /**
     * Checks if the provider signalled that the caller is being rate limited.
     *
     * @return true for a 429 status or an explicit Retry-After hint
     */
    public boolean isRateLimitSignal() {
        return retryAfterMs != null || (statusCode != null && statusCode == TOO_MANY_REQUESTS);
    }
}
