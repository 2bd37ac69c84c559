package com.trade.signalengine.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Bounded in-memory cache. Each entry carries its own TTL; once the entry count exceeds the bound the least recently
 * used entry is evicted, whether or not it has expired.
 * <p>
 * All reads and writes run under one lock, so check-then-set sequences are atomic.
 * {@link #getOrCompute} holds the lock only for the lookup and the store, never while the loader runs.
 */
public final class TtlLruCache<K, V> {

    /**
     * @param ttl {@link Duration#ZERO} means no expiry
     */
    private record CacheEntry<V>(V value, Instant createdAt, Duration ttl) {

        boolean isExpired(Instant now) {
            return !ttl.isZero() && !now.isBefore(createdAt.plus(ttl));
        }
    }

    private final int maxEntries;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, CacheEntry<V>> map;

    public TtlLruCache(int maxEntries, Clock clock) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1");
        this.maxEntries = maxEntries;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.map = new LinkedHashMap<>(16, 0.75f, true);
    }

    public Optional<V> get(K key) {
        lock.lock();
        try {
            CacheEntry<V> e = map.get(key);
            if (e == null) return Optional.empty();
            if (e.isExpired(clock.instant())) {
                map.remove(key);
                return Optional.empty();
            }
            return Optional.ofNullable(e.value());
        } finally {
            lock.unlock();
        }
    }

    public void put(K key, V value, Duration ttl) {
        Duration t = (ttl == null || ttl.isNegative()) ? Duration.ZERO : ttl;
        lock.lock();
        try {
            map.put(key, new CacheEntry<>(value, clock.instant(), t));
            evictOverflow();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value or runs {@code loader} and stores its result. A null result is not cached.
     * Two callers missing at the same time may both load; callers that need one load per key serialize around this.
     */
    public V getOrCompute(K key, Duration ttl, Function<? super K, ? extends V> loader) {
        Optional<V> hit = get(key);
        if (hit.isPresent()) return hit.get();
        V v = loader.apply(key);
        if (v != null) put(key, v, ttl);
        return v;
    }

    public void invalidate(K key) {
        lock.lock();
        try {
            map.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            map.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Live entries; expired ones are purged first.
     */
    public int size() {
        lock.lock();
        try {
            Instant now = clock.instant();
            map.values().removeIf(e -> e.isExpired(now));
            return map.size();
        } finally {
            lock.unlock();
        }
    }

    private void evictOverflow() {
        Iterator<Map.Entry<K, CacheEntry<V>>> it = map.entrySet().iterator();
        while (map.size() > maxEntries && it.hasNext()) {
            it.next();
            it.remove();
        }
    }
}
