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

/**
 * Rate limiter state snapshot.
 *
 * @param currentDelayMs Current minimum spacing between requests
 * @param requestsLastMinute Requests granted within the trailing 60 second window
 * @param isRateLimited Whether an explicit provider rate-limit signal is in effect
 */
public record RateLimiterMetrics(long currentDelayMs, int requestsLastMinute, boolean isRateLimited) {
}
