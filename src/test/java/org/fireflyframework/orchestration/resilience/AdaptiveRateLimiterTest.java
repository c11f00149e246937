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

import org.fireflyframework.orchestration.MutableClock;
import org.fireflyframework.orchestration.properties.OrchestrationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for AdaptiveRateLimiter.
 */
class AdaptiveRateLimiterTest {

    private MutableClock clock;
    private VirtualTimeScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T12:00:00Z");
        scheduler = VirtualTimeScheduler.create();
    }

    @Test
    void shouldGrantFirstRequestImmediately() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 2000, 0.5);

        assertThat(limiter.reserveSlot()).isZero();
        assertThat(limiter.getMetrics()).isEqualTo(new RateLimiterMetrics(100, 1, false));
    }

    @Test
    void shouldSpaceConsecutiveRequestsByCurrentDelay() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 2000, 0.5);

        assertThat(limiter.reserveSlot()).isZero();
        assertThat(limiter.reserveSlot()).isEqualTo(100);
        assertThat(limiter.reserveSlot()).isEqualTo(200);
    }

    @Test
    void shouldIncreaseDelayOnceLoadCrossesThreshold() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 2000, 0.5);

        for (int i = 0; i < 4; i++) {
            limiter.reserveSlot();
        }
        assertThat(limiter.getMetrics().currentDelayMs()).isEqualTo(100);

        limiter.reserveSlot();

        assertThat(limiter.getMetrics().currentDelayMs()).isEqualTo(200);
        assertThat(limiter.getMetrics().requestsLastMinute()).isEqualTo(5);
    }

    @Test
    void shouldCapDelayAtMaxDelay() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 300, 0.1);

        for (int i = 0; i < 6; i++) {
            limiter.reserveSlot();
        }

        assertThat(limiter.getMetrics().currentDelayMs()).isEqualTo(300);
    }

    @Test
    void shouldRestoreInitialDelayOnceWindowEmpties() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 2000, 0.5);
        for (int i = 0; i < 6; i++) {
            limiter.reserveSlot();
        }
        assertThat(limiter.getMetrics().currentDelayMs()).isGreaterThan(100);

        clock.advance(Duration.ofSeconds(61));

        RateLimiterMetrics metrics = limiter.getMetrics();
        assertThat(metrics.requestsLastMinute()).isZero();
        assertThat(metrics.currentDelayMs()).isEqualTo(100);
    }

    @Test
    void shouldDecayDelayWhenLoadSubsides() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 2000, 0.3);
        limiter.reserveSlot();
        clock.advance(Duration.ofSeconds(30));
        limiter.reserveSlot();
        limiter.reserveSlot();
        assertThat(limiter.getMetrics().currentDelayMs()).isEqualTo(200);

        // the first request leaves the window, load drops to 0.2
        clock.advance(Duration.ofSeconds(30));

        RateLimiterMetrics metrics = limiter.getMetrics();
        assertThat(metrics.requestsLastMinute()).isEqualTo(2);
        assertThat(metrics.currentDelayMs()).isEqualTo(100);
    }

    @Test
    void shouldDeferRequestsOnceBudgetIsUsedUp() {
        AdaptiveRateLimiter limiter = limiter(3, 0, 0, 1.0);

        assertThat(limiter.reserveSlot()).isZero();
        assertThat(limiter.reserveSlot()).isZero();
        assertThat(limiter.reserveSlot()).isZero();

        assertThat(limiter.reserveSlot()).isEqualTo(AdaptiveRateLimiter.WINDOW_MS);
    }

    @Test
    void shouldHonorExplicitRateLimitSignal() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 2000, 0.5);

        limiter.handleRateLimitResponse(5000);

        assertThat(limiter.isRateLimited()).isTrue();
        assertThat(limiter.reserveSlot()).isEqualTo(5000);

        clock.advance(Duration.ofMillis(5000));
        assertThat(limiter.isRateLimited()).isFalse();
    }

    @Test
    void shouldNotDecayWhileRateLimited() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 2000, 0.5);

        limiter.handleRateLimitResponse(10_000);
        long raised = limiter.getMetrics().currentDelayMs();
        clock.advance(Duration.ofSeconds(5));

        assertThat(raised).isEqualTo(200);
        assertThat(limiter.getMetrics().currentDelayMs()).isEqualTo(200);
        assertThat(limiter.getMetrics().isRateLimited()).isTrue();
    }

    @Test
    void shouldFallBackToMaxDelayForNonPositiveRetryAfter() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 2000, 0.5);

        limiter.handleRateLimitResponse(0);

        assertThat(limiter.reserveSlot()).isEqualTo(2000);
    }

    @Test
    void shouldParseRetryAfterHeader() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 5000, 0.5);

        limiter.handleRateLimitResponse("3");

        assertThat(limiter.reserveSlot()).isEqualTo(3000);
    }

    @Test
    void shouldResetToInitialState() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 2000, 0.5);
        for (int i = 0; i < 6; i++) {
            limiter.reserveSlot();
        }
        limiter.handleRateLimitResponse(1000);

        limiter.reset();

        assertThat(limiter.getMetrics()).isEqualTo(new RateLimiterMetrics(100, 0, false));
        assertThat(limiter.reserveSlot()).isZero();
    }

    @Test
    void shouldDelaySubscriberUntilReservedSlot() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 2000, 0.5);
        limiter.reserveSlot();

        StepVerifier.withVirtualTime(limiter::throttle, () -> scheduler, Long.MAX_VALUE)
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(99))
                .thenAwait(Duration.ofMillis(1))
                .verifyComplete();
    }

    @Test
    void shouldGrowDelayFromZeroInitialDelay() {
        AdaptiveRateLimiter limiter = limiter(10, 0, 2000, 0.5);

        long previous = limiter.getMetrics().currentDelayMs();
        for (int i = 0; i < 4; i++) {
            limiter.reserveSlot();
        }
        assertThat(limiter.getMetrics().currentDelayMs()).isZero();

        for (int i = 0; i < 5; i++) {
            limiter.reserveSlot();
            long current = limiter.getMetrics().currentDelayMs();
            assertThat(current).isGreaterThan(previous);
            previous = current;
        }
        assertThat(limiter.getMetrics().currentDelayMs()).isEqualTo(32);
    }

    @Test
    void shouldStayRateLimitedForHugeRetryAfter() {
        AdaptiveRateLimiter limiter = limiter(10, 100, 2000, 0.5);

        limiter.handleRateLimitResponse("9223372036854775");
        clock.advance(Duration.ofDays(365));

        assertThat(limiter.isRateLimited()).isTrue();
    }

    @Test
    void shouldRejectBackoffFactorThatCannotGrow() {
        OrchestrationProperties.RateLimiterConfig config = new OrchestrationProperties.RateLimiterConfig();
        config.setBackoffFactor(1.0);

        assertThatThrownBy(() -> new AdaptiveRateLimiter("jira", config, clock, scheduler))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("backoffFactor");
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        OrchestrationProperties.RateLimiterConfig config = new OrchestrationProperties.RateLimiterConfig();
        config.setInitialDelay(Duration.ofSeconds(10));
        config.setMaxDelay(Duration.ofSeconds(1));

        assertThatThrownBy(() -> new AdaptiveRateLimiter("jira", config, clock, scheduler))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDelay");
    }

    private AdaptiveRateLimiter limiter(int maxRequestsPerMinute, long initialDelayMs, long maxDelayMs, double threshold) {
        OrchestrationProperties.RateLimiterConfig config = new OrchestrationProperties.RateLimiterConfig();
        config.setMaxRequestsPerMinute(maxRequestsPerMinute);
        config.setInitialDelay(Duration.ofMillis(initialDelayMs));
        config.setMaxDelay(Duration.ofMillis(maxDelayMs));
        config.setBackoffFactor(2.0);
        config.setBackoffThreshold(threshold);
        return new AdaptiveRateLimiter("jira", config, clock, scheduler);
    }
}
