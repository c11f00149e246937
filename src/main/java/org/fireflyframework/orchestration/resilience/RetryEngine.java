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

import org.fireflyframework.orchestration.exception.RetryExhaustedException;
import org.fireflyframework.orchestration.properties.OrchestrationProperties;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff with jitter.
 * <p>
 * The wait before attempt {@code n + 1} is
 * <pre>
 * baseDelay * 2^(n-1) * jitter,  jitter uniform in [0.8, 1.2)
 * </pre>
 * Jitter keeps concurrent callers from retrying in lockstep. A non-retryable
 * error propagates unchanged after the attempt that raised it; a retryable error
 * on the last attempt is wrapped in {@link RetryExhaustedException}.
 */
@Slf4j
public class RetryEngine {

    private static final double JITTER_MIN = 0.8;
    private static final double JITTER_SPAN = 0.4;

    private final String name;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final DoubleSupplier random;
    private final Scheduler scheduler;

    public RetryEngine(String name, OrchestrationProperties.RetryConfig config, Scheduler scheduler) {
        this(name, config.getMaxAttempts(), config.getBaseDelay(),
                () -> ThreadLocalRandom.current().nextDouble(), scheduler);
    }

    /**
     * Creates a retry engine with an explicit random source.
     *
     * @param name name used in log messages
     * @param maxAttempts maximum attempts including the first one
     * @param baseDelay base delay of the backoff
     * @param random source of values in [0, 1) used for jitter
     * @param scheduler scheduler the backoff waits on
     */
    public RetryEngine(String name, int maxAttempts, Duration baseDelay, DoubleSupplier random, Scheduler scheduler) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay cannot be negative (current: " + baseDelay + ")");
        }
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.random = Objects.requireNonNull(random, "random cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    }

    /**
     * Invokes the operation until it succeeds, fails with a non-retryable error,
     * or runs out of attempts.
     *
     * @param operation supplies a fresh Mono for every attempt
     * @param isRetryable decides whether an error may be retried
     * @param <T> the result type
     * @return the result of the first successful attempt
     */
    public <T> Mono<T> executeWithRetry(Supplier<Mono<T>> operation, Predicate<Throwable> isRetryable) {
        return executeWithRetry(operation, isRetryable, RetryListener.NONE);
    }

    /**
     * Same as {@link #executeWithRetry(Supplier, Predicate)}, notifying the listener
     * before every backoff wait.
     */
    public <T> Mono<T> executeWithRetry(Supplier<Mono<T>> operation,
                                        Predicate<Throwable> isRetryable,
                                        RetryListener listener) {
        return attempt(operation, isRetryable, listener, 1);
    }

    /**
     * Calculates the wait after a failed attempt.
     *
     * @param attempt the attempt that just failed (1-based)
     * @return the backoff delay
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        double jitter = JITTER_MIN + JITTER_SPAN * random.getAsDouble();
        double exponential = baseDelay.toMillis() * Math.pow(2, attempt - 1);
        return Duration.ofMillis(Math.round(exponential * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    private <T> Mono<T> attempt(Supplier<Mono<T>> operation,
                                Predicate<Throwable> isRetryable,
                                RetryListener listener,
                                int attempt) {
        return Mono.defer(operation)
                .onErrorResume(error -> {
                    if (!isRetryable.test(error)) {
                        log.debug("RETRY_ABORTED: name={}, attempt={}, error={}", name, attempt, error.getMessage());
                        return Mono.error(error);
                    }
                    if (attempt >= maxAttempts) {
                        log.warn("RETRY_EXHAUSTED: name={}, attempts={}, error={}", name, attempt, error.getMessage());
                        return Mono.error(new RetryExhaustedException(attempt, error));
                    }

                    Duration delay = delayFor(attempt);
                    log.info("RETRY_SCHEDULED: name={}, attempt={}, delayMs={}, error={}",
                            name, attempt + 1, delay.toMillis(), error.getMessage());
                    listener.onRetry(attempt, delay, error);

                    return Mono.delay(delay, scheduler)
                            .then(Mono.defer(() -> attempt(operation, isRetryable, listener, attempt + 1)));
                });
    }

    /**
     * Callback invoked before each backoff wait.
     */
    @FunctionalInterface
    public interface RetryListener {

        RetryListener NONE = (attempt, delay, error) -> { };

        /**
         * @param failedAttempt the attempt that just failed (1-based)
         * @param delay the wait before the next attempt
         * @param error the error of the failed attempt
         */
        void onRetry(int failedAttempt, Duration delay, Throwable error);
    }
}
