package tech.keyledger.platform.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * In-memory cache implementation using Caffeine.
 *
 * <p>Fast, single-node caching. Not shared across multiple instances, so each node
 * keeps its own rate-limit windows.
 *
 * <p>Each entry carries its own expiry through a Caffeine {@link Expiry}; entries put
 * without a TTL fall back to {@link CacheConfig#ttl()}.
 *
 * <p>Note: @Typed excludes CacheStore from bean types so only the
 * CacheStoreProducer can provide the CacheStore interface.
 */
@Singleton
@Typed(InMemoryCacheStore.class)
public class InMemoryCacheStore implements CacheStore {

    @Inject
    CacheConfig config;

    private final ConcurrentMap<String, Cache<String, Entry>> caches = new ConcurrentHashMap<>();
    private final Ticker ticker;

    public InMemoryCacheStore() {
        this.ticker = Ticker.systemTicker();
    }

    public InMemoryCacheStore(CacheConfig config, Ticker ticker) {
        this.config = config;
        this.ticker = ticker;
    }

    private record Entry(String value, long ttlNanos) {}

    private static final class EntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    private Cache<String, Entry> getCache(String cacheName) {
        return caches.computeIfAbsent(cacheName, name ->
            Caffeine.newBuilder()
                .expireAfter(new EntryExpiry())
                .maximumSize(config.maxSize())
                .ticker(ticker)
                .build()
        );
    }

    @Override
    public Optional<String> get(String cacheName, String key) {
        Entry entry = getCache(cacheName).getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void put(String cacheName, String key, String value) {
        put(cacheName, key, value, config.ttl());
    }

    @Override
    public void put(String cacheName, String key, String value, Duration ttl) {
        requirePositive(ttl);
        getCache(cacheName).put(key, new Entry(value, ttl.toNanos()));
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
    }

    @Override
    public Optional<String> compute(String cacheName, String key, UnaryOperator<Optional<String>> remapping,
                                    Duration ttl) {
        requirePositive(ttl);
        Entry stored = getCache(cacheName).asMap().compute(key, (k, current) ->
            remapping.apply(current == null ? Optional.empty() : Optional.of(current.value()))
                .map(value -> new Entry(value, ttl.toNanos()))
                .orElse(null));
        return stored == null ? Optional.empty() : Optional.of(stored.value());
    }

    @Override
    public void invalidate(String cacheName, String key) {
        getCache(cacheName).invalidate(key);
    }

    @Override
    public void invalidateAll(String cacheName) {
        Cache<String, Entry> cache = caches.get(cacheName);
        if (cache != null) {
            cache.invalidateAll();
        }
    }
}
