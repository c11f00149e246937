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

import org.fireflyframework.orchestration.properties.OrchestrationProperties;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Adaptive per-endpoint rate limiter over a trailing 60 second window.
 * <p>
 * Each call to {@link #throttle()} reserves the next request slot and delays the
 * subscriber until that slot. The slot is the latest of:
 * <ul>
 *   <li>now</li>
 *   <li>the previous slot plus the current delay (minimum spacing)</li>
 *   <li>the clear time of an explicit provider rate-limit signal</li>
 *   <li>the moment the window has room again, once the budget is used up</li>
 * </ul>
 * <p>
 * When the window load (requests / budget) reaches the backoff threshold the
 * delay is multiplied by the backoff factor, capped at the maximum delay. Below
 * the threshold the delay decays back toward, but never below, the initial delay.
 * <p>
 * Slot reservation is serialized on the instance; only the wait itself happens
 * outside the lock.
 */
@Slf4j
public class AdaptiveRateLimiter {

    static final long WINDOW_MS = Duration.ofSeconds(60).toMillis();

    private final String name;
    private final int maxRequestsPerMinute;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double backoffFactor;
    private final double backoffThreshold;
    private final Clock clock;
    private final Scheduler scheduler;

    private final Deque<Long> requestTimestamps = new ArrayDeque<>();
    private long currentDelayMs;
    private boolean rateLimited;
    private long rateLimitResetAt;
    private Long lastRequestAt;
    private long lastAdjustmentAt;

    public AdaptiveRateLimiter(String name,
                               OrchestrationProperties.RateLimiterConfig config,
                               Clock clock,
                               Scheduler scheduler) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        if (config.getMaxRequestsPerMinute() < 1) {
            throw new IllegalArgumentException(
                    "maxRequestsPerMinute must be positive (current: " + config.getMaxRequestsPerMinute() + ")");
        }
        if (config.getMaxDelay().compareTo(config.getInitialDelay()) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay (initial: "
                    + config.getInitialDelay() + ", max: " + config.getMaxDelay() + ")");
        }
        if (config.getBackoffFactor() <= 1.0) {
            throw new IllegalArgumentException(
                    "backoffFactor must be > 1.0 (current: " + config.getBackoffFactor() + ")");
        }
        this.maxRequestsPerMinute = config.getMaxRequestsPerMinute();
        this.initialDelayMs = config.getInitialDelay().toMillis();
        this.maxDelayMs = config.getMaxDelay().toMillis();
        this.backoffFactor = config.getBackoffFactor();
        this.backoffThreshold = config.getBackoffThreshold();
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.currentDelayMs = initialDelayMs;
        this.lastAdjustmentAt = clock.millis();
    }

    /**
     * Delays the subscriber until it is safe to issue the next request.
     *
     * @return a Mono that completes once the reserved slot is reached
     */
    public Mono<Void> throttle() {
        return Mono.defer(() -> {
            long waitMs = reserveSlot();
            if (waitMs <= 0) {
                return Mono.empty();
            }
            log.debug("RATE_LIMITER_WAIT: name={}, waitMs={}", name, waitMs);
            return Mono.delay(Duration.ofMillis(waitMs), scheduler).then();
        });
    }

    /**
     * Applies an explicit rate-limit signal from the provider.
     * <p>
     * The limiter stays rate limited until {@code now + retryAfterMs}, and the
     * delay does not decay before then. A non-positive value falls back to the
     * maximum delay.
     *
     * @param retryAfterMs milliseconds until the provider accepts requests again
     */
    public synchronized void handleRateLimitResponse(long retryAfterMs) {
        long now = clock.millis();
        long effective = retryAfterMs > 0 ? retryAfterMs : maxDelayMs;
        rateLimited = true;
        rateLimitResetAt = Math.max(rateLimitResetAt, now + Math.min(effective, Long.MAX_VALUE - now));
        currentDelayMs = increasedDelay();
        lastAdjustmentAt = now;
        log.warn("RATE_LIMITED: name={}, retryAfterMs={}, currentDelayMs={}", name, effective, currentDelayMs);
    }

    /**
     * Applies an explicit rate-limit signal given as a raw Retry-After header value.
     *
     * @param retryAfterHeader delta-seconds or HTTP-date, may be null
     */
    public void handleRateLimitResponse(String retryAfterHeader) {
        long retryAfterMs = RetryAfterParser.parseMillis(retryAfterHeader, clock).orElse(0L);
        handleRateLimitResponse(retryAfterMs);
    }

    /**
     * Checks if an explicit rate-limit signal is still in effect.
     */
    public synchronized boolean isRateLimited() {
        refresh(clock.millis());
        return rateLimited;
    }

    /**
     * Gets a snapshot of the limiter state.
     *
     * @return current delay, requests in the trailing window and rate-limit flag
     */
    public synchronized RateLimiterMetrics getMetrics() {
        refresh(clock.millis());
        return new RateLimiterMetrics(currentDelayMs, requestTimestamps.size(), rateLimited);
    }

    /**
     * Restores the initial state.
     */
    public synchronized void reset() {
        requestTimestamps.clear();
        currentDelayMs = initialDelayMs;
        rateLimited = false;
        rateLimitResetAt = 0;
        lastRequestAt = null;
        lastAdjustmentAt = clock.millis();
        log.info("RATE_LIMITER_RESET: name={}", name);
    }

    public String getName() {
        return name;
    }

    synchronized long reserveSlot() {
        long now = clock.millis();
        refresh(now);

        double load = (double) (requestTimestamps.size() + 1) / maxRequestsPerMinute;
        if (load >= backoffThreshold) {
            long increased = increasedDelay();
            if (increased != currentDelayMs) {
                log.debug("RATE_LIMITER_BACKOFF: name={}, load={}, delayMs={} -> {}",
                        name, String.format("%.2f", load), currentDelayMs, increased);
            }
            currentDelayMs = increased;
            lastAdjustmentAt = now;
        }

        long slot = now;
        if (lastRequestAt != null) {
            slot = Math.max(slot, lastRequestAt + currentDelayMs);
        }
        if (rateLimited) {
            slot = Math.max(slot, rateLimitResetAt);
        }
        if (requestTimestamps.size() >= maxRequestsPerMinute) {
            List<Long> window = new ArrayList<>(requestTimestamps);
            slot = Math.max(slot, window.get(window.size() - maxRequestsPerMinute) + WINDOW_MS);
        }

        requestTimestamps.addLast(slot);
        lastRequestAt = slot;
        return slot - now;
    }

    // a zero delay grows from 1ms so the backoff always makes progress
    private long increasedDelay() {
        long grown = (long) Math.ceil(Math.max(currentDelayMs, 1L) * backoffFactor);
        return Math.min(Math.max(grown, initialDelayMs), maxDelayMs);
    }

    private void refresh(long now) {
        while (!requestTimestamps.isEmpty() && requestTimestamps.peekFirst() <= now - WINDOW_MS) {
            requestTimestamps.pollFirst();
        }

        if (rateLimited && now >= rateLimitResetAt) {
            rateLimited = false;
            log.info("RATE_LIMIT_CLEARED: name={}", name);
        }
        if (rateLimited) {
            return;
        }

        if (requestTimestamps.isEmpty()) {
            currentDelayMs = initialDelayMs;
            return;
        }

        double load = (double) requestTimestamps.size() / maxRequestsPerMinute;
        if (load < backoffThreshold && currentDelayMs > initialDelayMs
                && now - lastAdjustmentAt >= currentDelayMs) {
            currentDelayMs = Math.max(initialDelayMs, (long) (currentDelayMs / backoffFactor));
            lastAdjustmentAt = now;
        }
    }
}
