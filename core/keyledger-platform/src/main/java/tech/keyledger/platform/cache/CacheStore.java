package tech.keyledger.platform.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Ephemeral key-value store with per-entry expiry.
 *
 * <p>Backs the rate limiter's sliding windows and block markers. Entries are
 * best-effort: a restart or eviction simply forgets them.
 *
 * <p>Supported backends:
 * <ul>
 *   <li>MEMORY - In-memory using Caffeine (default, single-node)</li>
 *   <li>REDIS - Redis (shared across nodes, requires a Redis server)</li>
 * </ul>
 *
 * <p>Configure via:
 * <pre>
 * keyledger.cache.type=MEMORY|REDIS
 * keyledger.cache.ttl=5m
 * </pre>
 */
public interface CacheStore {

    /**
     * Get a cached value.
     *
     * @param cacheName The cache namespace (e.g., "rate-limit-windows")
     * @param key The cache key
     * @return The cached value, or empty if not found or expired
     */
    Optional<String> get(String cacheName, String key);

    /**
     * Put a value in the cache with default TTL.
     */
    void put(String cacheName, String key, String value);

    /**
     * Put a value in the cache with custom TTL.
     *
     * @param ttl Time-to-live for this entry, must be positive
     */
    void put(String cacheName, String key, String value, Duration ttl);

    /**
     * Atomically replace the value of a key.
     *
     * <p>{@code remapping} receives the current value, or empty, and returns the new value,
     * or empty to remove the entry. It may run more than once and must not touch the store.
     *
     * @param ttl Time-to-live for the new value, must be positive
     * @return The value stored after the call
     */
    Optional<String> compute(String cacheName, String key, UnaryOperator<Optional<String>> remapping, Duration ttl);

    void invalidate(String cacheName, String key);

    /**
     * Invalidate all entries in a cache namespace.
     */
    void invalidateAll(String cacheName);

    /**
     * Cache backend type.
     */
    enum CacheType {
        MEMORY,
        REDIS
    }
}
