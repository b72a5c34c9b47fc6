package com.tradearena.backend.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Small process-local cache with a fixed time-to-live per entry.
 * <p>
 * Owners create one per settings type and clear it on shutdown; entries are loaded lazily
 * through the loader passed to {@link #get(Object, Function)}.
 */
public class TtlCache<K, V> {

    private final Duration ttl;
    private final Clock clock;
    private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();

    public TtlCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public TtlCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public V get(K key, Function<K, V> loader) {
        Instant now = clock.instant();
        Entry<V> current = entries.get(key);
        if (current != null && current.expiresAt().isAfter(now)) {
            return current.value();
        }
        V loaded = loader.apply(key);
        if (loaded != null) {
            entries.put(key, new Entry<>(loaded, now.plus(ttl)));
        }
        return loaded;
    }

    public Optional<V> getIfPresent(K key) {
        Entry<V> current = entries.get(key);
        if (current == null || !current.expiresAt().isAfter(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(current.value());
    }

    public void invalidate(K key) {
        entries.remove(key);
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    private record Entry<V>(V value, Instant expiresAt) {
    }
}
