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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for RetryAfterParser.
 */
class RetryAfterParserTest {

    private final MutableClock clock = MutableClock.startingAt("2025-01-01T12:00:00Z");

    @Test
    void shouldParseDeltaSeconds() {
        assertThat(RetryAfterParser.parseMillis("120", clock)).contains(120_000L);
        assertThat(RetryAfterParser.parseMillis(" 0 ", clock)).contains(0L);
    }

    @Test
    void shouldParseHttpDateRelativeToClock() {
        assertThat(RetryAfterParser.parseMillis("Wed, 01 Jan 2025 12:01:30 GMT", clock)).contains(90_000L);
    }

    @Test
    void shouldClampPastHttpDateToZero() {
        assertThat(RetryAfterParser.parseMillis("Wed, 01 Jan 2025 11:00:00 GMT", clock)).contains(0L);
    }

    @Test
    void shouldReturnEmptyForUnparseableValues() {
        assertThat(RetryAfterParser.parseMillis(null, clock)).isEmpty();
        assertThat(RetryAfterParser.parseMillis("", clock)).isEmpty();
        assertThat(RetryAfterParser.parseMillis("soon", clock)).isEmpty();
        assertThat(RetryAfterParser.parseMillis("-5", clock)).isEmpty();
    }
}
