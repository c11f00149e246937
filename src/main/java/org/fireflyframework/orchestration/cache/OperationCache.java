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

import org.fireflyframework.orchestration.properties.OrchestrationProperties;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Bounded TTL cache for idempotent read results.
 * <p>
 * Every entry expires {@code ttl} after it was written, or after it was last
 * read when {@code resetTtlOnGet} is enabled. Once {@code maxSize} entries are
 * held, inserting a new key evicts exactly one entry: an expired one if there
 * is any, otherwise the oldest by insertion (FIFO) or the least recently used
 * (LRU) depending on {@code prioritizeRecentlyUsed}.
 * <p>
 * Entry state is guarded by the instance lock. Asynchronous computations for the
 * same missing key are shared, so a value is computed at most once at a time.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
@Slf4j
public class OperationCache<K, V> {

    private final String name;
    private final Duration defaultTtl;
    private final int maxSize;
    private final boolean resetTtlOnGet;
    private final boolean prioritizeRecentlyUsed;
    private final Clock clock;

    private final Map<K, CacheEntry<K, V>> entries = new LinkedHashMap<>();
    private final Map<K, Mono<V>> inFlight = new ConcurrentHashMap<>();
    private long sequence;
    private long hits;
    private long misses;

    public OperationCache(String name, OrchestrationProperties.CacheConfig config, Clock clock) {
        this(name, config.getDefaultTtl(), config.getMaxSize(),
                config.isResetTtlOnGet(), config.isPrioritizeRecentlyUsed(), clock);
    }

    public OperationCache(String name,
                          Duration defaultTtl,
                          int maxSize,
                          boolean resetTtlOnGet,
                          boolean prioritizeRecentlyUsed,
                          Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
        }
        requirePositive(defaultTtl);
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.defaultTtl = defaultTtl;
        this.maxSize = maxSize;
        this.resetTtlOnGet = resetTtlOnGet;
        this.prioritizeRecentlyUsed = prioritizeRecentlyUsed;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Gets a live value.
     *
     * @param key the cache key
     * @return the value, or empty if absent or expired
     */
    public synchronized Optional<V> get(K key) {
        CacheEntry<K, V> entry = liveEntry(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        hits++;
        touch(entry);
        return Optional.of(entry.value);
    }

    public void set(K key, V value) {
        set(key, value, defaultTtl);
    }

    /**
     * Stores a value with an explicit time to live.
     *
     * @param key the cache key
     * @param value the value, must not be null
     * @param ttl the time to live of this entry
     */
    public synchronized void set(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        requirePositive(ttl);

        long now = clock.millis();
        CacheEntry<K, V> existing = entries.get(key);
        if (existing == null && entries.size() >= maxSize) {
            evictOne(now);
        }

        long seq = ++sequence;
        long insertionSeq = existing != null ? existing.insertionSeq : seq;
        entries.put(key, new CacheEntry<>(key, value, ttl.toMillis(), now + ttl.toMillis(), now, insertionSeq, seq));
    }

    /**
     * Checks for a live entry without counting a hit or refreshing its TTL.
     */
    public synchronized boolean has(K key) {
        return liveEntry(key) != null;
    }

    public synchronized boolean delete(K key) {
        return entries.remove(key) != null;
    }

    public synchronized void clear() {
        entries.clear();
        hits = 0;
        misses = 0;
    }

    /**
     * Counts entries that have not expired yet.
     */
    public synchronized int size() {
        purgeExpired(clock.millis());
        return entries.size();
    }

    /**
     * Returns the cached value or computes and stores it.
     * <p>
     * The computation runs under the cache lock. A computation that throws
     * leaves the cache unchanged.
     *
     * @param key the cache key
     * @param compute supplies the value on a miss
     * @return the cached or computed value
     */
    public synchronized V getOrCompute(K key, Supplier<V> compute) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = compute.get();
        if (value != null) {
            set(key, value);
        }
        return value;
    }

    /**
     * Returns the cached value or subscribes to the computation and stores its result.
     * <p>
     * Callers asking for the same missing key while a computation is running share
     * it. Errors and empty results are not cached.
     *
     * @param key the cache key
     * @param compute supplies the computation on a miss
     * @return the cached or computed value
     */
    public Mono<V> getOrComputeAsync(K key, Supplier<Mono<V>> compute) {
        return Mono.defer(() -> {
            Optional<V> cached = get(key);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            return inFlight.computeIfAbsent(key, k -> Mono.defer(compute)
                    .doOnNext(value -> set(k, value))
                    .doFinally(signal -> inFlight.remove(k))
                    .cache());
        });
    }

    public synchronized CacheStats getStats() {
        purgeExpired(clock.millis());
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
        return new CacheStats(entries.size(), maxSize, hits, misses, hitRate);
    }

    public String getName() {
        return name;
    }

    private CacheEntry<K, V> liveEntry(K key) {
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private void touch(CacheEntry<K, V> entry) {
        long now = clock.millis();
        entry.lastAccessedAt = now;
        entry.accessSeq = ++sequence;
        if (resetTtlOnGet) {
            entry.expiresAt = now + entry.ttlMs;
        }
    }

    private void evictOne(long now) {
        Comparator<CacheEntry<K, V>> policy = prioritizeRecentlyUsed
                ? Comparator.comparingLong((CacheEntry<K, V> e) -> e.accessSeq)
                : Comparator.comparingLong((CacheEntry<K, V> e) -> e.insertionSeq);

        CacheEntry<K, V> victim = entries.values().stream()
                .filter(e -> e.isExpired(now))
                .findFirst()
                .orElseGet(() -> entries.values().stream()
                        .min(policy.thenComparingLong(e -> e.insertionSeq))
                        .orElseThrow());

        entries.remove(victim.key);
        log.debug("CACHE_EVICTED: cache={}, key={}, policy={}", name, victim.key,
                prioritizeRecentlyUsed ? "LRU" : "FIFO");
    }

    private void purgeExpired(long now) {
        entries.values().removeIf(e -> e.isExpired(now));
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
    }

    private static final class CacheEntry<K, V> {
        private final K key;
        private final V value;
        private final long ttlMs;
        private long expiresAt;
        private long lastAccessedAt;
        private final long insertionSeq;
        private long accessSeq;

        private CacheEntry(K key, V value, long ttlMs, long expiresAt, long lastAccessedAt,
                           long insertionSeq, long accessSeq) {
            this.key = key;
            this.value = value;
            this.ttlMs = ttlMs;
            this.expiresAt = expiresAt;
            this.lastAccessedAt = lastAccessedAt;
            this.insertionSeq = insertionSeq;
            this.accessSeq = accessSeq;
        }

        private boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}
