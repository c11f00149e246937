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

package org.fireflyframework.orchestration.cache;

/**
 * Cache statistics snapshot.
 *
 * @param size live entries
 * @param maxSize capacity
 * @param hits lookups answered from the cache
 * @param misses lookups that found nothing live
 * @param hitRate hits / (hits + misses), 0 before the first lookup
 */
public record CacheStats(int size, int maxSize, long hits, long misses, double hitRate) {
}
