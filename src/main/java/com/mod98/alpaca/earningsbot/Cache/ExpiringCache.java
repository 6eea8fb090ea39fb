package com.mod98.alpaca.earningsbot.Cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Small TTL cache. Expiry is measured against the supplied clock, so tests can move time explicitly.
 */
public class ExpiringCache<K, V> {

    private final Duration ttl;
    private final Clock clock;
    private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();

    public ExpiringCache(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<V> get(K key) {
        Entry<V> e = entries.get(key);
        if (e == null) return Optional.empty();
        if (isExpired(e)) {
            entries.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.value);
    }

    public void put(K key, V value) {
        entries.put(key, new Entry<>(value, clock.instant()));
    }

    /**
     * Returns the cached value or loads and caches it. A {@code null} from the loader is not cached.
     */
    public V getOrLoad(K key, Function<K, V> loader) {
        Optional<V> hit = get(key);
        if (hit.isPresent()) return hit.get();
        V loaded = loader.apply(key);
        if (loaded != null) put(key, loaded);
        return loaded;
    }

    public int size() {
        return entries.size();
    }

    private boolean isExpired(Entry<V> e) {
        return !clock.instant().isBefore(e.storedAt.plus(ttl));
    }

    private record Entry<V>(V value, Instant storedAt) {}
}
