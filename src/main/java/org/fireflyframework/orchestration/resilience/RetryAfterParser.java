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

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses Retry-After header values.
 * <p>
 * Accepts both forms allowed by HTTP: delta-seconds ({@code "120"}) and an
 * RFC 1123 HTTP-date ({@code "Wed, 01 Jan 2025 12:01:00 GMT"}). Dates in the
 * past resolve to zero.
 */
@Slf4j
public final class RetryAfterParser {

    private RetryAfterParser() {
    }

    /**
     * Converts a Retry-After value into milliseconds from now.
     *
     * @param value the raw header value, may be null
     * @param clock the clock defining "now"
     * @return milliseconds to wait, or empty if the value cannot be parsed
     */
    public static Optional<Long> parseMillis(String value, Clock clock) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();

        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return Optional.of(Math.multiplyExact(Long.parseLong(trimmed), 1000L));
            } catch (NumberFormatException | ArithmeticException e) {
                log.debug("RETRY_AFTER_UNPARSEABLE: value={}, reason={}", trimmed, e.getMessage());
                return Optional.empty();
            }
        }

        try {
            ZonedDateTime resetAt = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            long delta = resetAt.toInstant().toEpochMilli() - clock.millis();
            return Optional.of(Math.max(0L, delta));
        } catch (DateTimeParseException e) {
            log.debug("RETRY_AFTER_UNPARSEABLE: value={}, reason={}", trimmed, e.getMessage());
            return Optional.empty();
        }
    }
}
