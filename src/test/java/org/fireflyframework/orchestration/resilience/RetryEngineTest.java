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

import org.fireflyframework.orchestration.exception.ProviderException;
import org.fireflyframework.orchestration.exception.RetryExhaustedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for RetryEngine.
 */
class RetryEngineTest {

    private VirtualTimeScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
    }

    @Test
    void shouldInvokeAlwaysFailingOperationExactlyMaxAttemptsTimes() {
        RetryEngine engine = new RetryEngine("jira", 3, Duration.ofMillis(10), () -> 0.5, Schedulers.parallel());
        AtomicInteger invocations = new AtomicInteger();
        ProviderException failure = ProviderException.fromStatus(503, "unavailable");

        StepVerifier.create(engine.executeWithRetry(() -> {
                    invocations.incrementAndGet();
                    return Mono.error(failure);
                }, error -> true))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(RetryExhaustedException.class);
                    assertThat(((RetryExhaustedException) error).getAttempts()).isEqualTo(3);
                    assertThat(error.getCause()).isSameAs(failure);
                })
                .verify(Duration.ofSeconds(5));

        assertThat(invocations).hasValue(3);
    }

    @Test
    void shouldInvokeOnceWhenErrorIsNotRetryable() {
        RetryEngine engine = new RetryEngine("jira", 3, Duration.ofMillis(10), () -> 0.5, scheduler);
        AtomicInteger invocations = new AtomicInteger();
        ProviderException failure = ProviderException.fromStatus(400, "bad request");

        StepVerifier.create(engine.executeWithRetry(() -> {
                    invocations.incrementAndGet();
                    return Mono.error(failure);
                }, error -> false))
                .expectErrorMatches(error -> error == failure)
                .verify(Duration.ofSeconds(5));

        assertThat(invocations).hasValue(1);
    }

    @Test
    void shouldReturnFirstSuccessfulResult() {
        RetryEngine engine = new RetryEngine("jira", 3, Duration.ofSeconds(1), () -> 0.0, scheduler);
        AtomicInteger invocations = new AtomicInteger();

        StepVerifier.withVirtualTime(() -> engine.executeWithRetry(() -> invocations.incrementAndGet() < 3
                                ? Mono.<String>error(ProviderException.timedOut("slow"))
                                : Mono.just("projects"),
                        ProviderErrorClassifier.INSTANCE),
                        () -> scheduler, Long.MAX_VALUE)
                .expectSubscription()
                // 1s * 0.8 after the first failure, 2s * 0.8 after the second
                .expectNoEvent(Duration.ofMillis(800))
                .expectNoEvent(Duration.ofMillis(1599))
                .thenAwait(Duration.ofMillis(1))
                .expectNext("projects")
                .verifyComplete();

        assertThat(invocations).hasValue(3);
    }

    @Test
    void shouldNotifyListenerBeforeEachWait() {
        RetryEngine engine = new RetryEngine("jira", 3, Duration.ofMillis(100), () -> 0.5, scheduler);
        List<Integer> failedAttempts = new ArrayList<>();
        List<Duration> delays = new ArrayList<>();

        StepVerifier.withVirtualTime(() -> engine.executeWithRetry(
                                () -> Mono.error(ProviderException.fromStatus(500, "boom")),
                                error -> true,
                                (attempt, delay, error) -> {
                                    failedAttempts.add(attempt);
                                    delays.add(delay);
                                }),
                        () -> scheduler, Long.MAX_VALUE)
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(1))
                .expectError(RetryExhaustedException.class)
                .verify();

        assertThat(failedAttempts).containsExactly(1, 2);
        assertThat(delays).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void shouldApplyJitterAtBothBounds() {
        RetryEngine low = new RetryEngine("jira", 5, Duration.ofSeconds(1), () -> 0.0, scheduler);
        RetryEngine high = new RetryEngine("jira", 5, Duration.ofSeconds(1), () -> 0.999, scheduler);

        assertThat(low.delayFor(1)).isEqualTo(Duration.ofMillis(800));
        assertThat(low.delayFor(3)).isEqualTo(Duration.ofMillis(3200));
        assertThat(high.delayFor(1)).isEqualTo(Duration.ofMillis(1200));
    }

    @Test
    void shouldKeepSeededJitterWithinBounds() {
        Random random = new Random(42);
        RetryEngine engine = new RetryEngine("jira", 5, Duration.ofSeconds(1), random::nextDouble, scheduler);

        for (int attempt = 1; attempt <= 4; attempt++) {
            long base = 1000L << (attempt - 1);
            for (int i = 0; i < 50; i++) {
                long delay = engine.delayFor(attempt).toMillis();
                assertThat(delay).isBetween(Math.round(base * 0.8), Math.round(base * 1.2));
            }
        }
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new RetryEngine("jira", 0, Duration.ofSeconds(1), () -> 0.5, scheduler))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryEngine("jira", 3, Duration.ofSeconds(-1), () -> 0.5, scheduler))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
