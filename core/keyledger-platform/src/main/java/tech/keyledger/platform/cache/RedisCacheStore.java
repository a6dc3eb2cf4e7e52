package tech.keyledger.platform.cache;

import io.quarkus.arc.lookup.LookupIfProperty;
import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.keys.KeyCommands;
import io.quarkus.redis.datasource.transactions.OptimisticLockingTransactionResult;
import io.quarkus.redis.datasource.value.ValueCommands;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Redis-backed cache implementation.
 *
 * <p>Shares rate-limit windows and blocks between nodes. Requires
 * {@code quarkus.redis.hosts} and {@code keyledger.cache.type=REDIS}.
 *
 * <p>Note: @Typed excludes CacheStore from bean types so only the
 * CacheStoreProducer can provide the CacheStore interface.
 */
@Singleton
@Typed(RedisCacheStore.class)
@LookupIfProperty(name = "keyledger.cache.type", stringValue = "REDIS")
public class RedisCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(RedisCacheStore.class);
    private static final int MAX_COMPUTE_ATTEMPTS = 5;

    @Inject
    RedisDataSource redis;

    @Inject
    CacheConfig config;

    private ValueCommands<String, String> values;
    private KeyCommands<String> keys;

    @PostConstruct
    void init() {
        values = redis.value(String.class);
        keys = redis.key();
        LOG.infof("Redis cache store ready, key prefix [%s]", config.redis().keyPrefix());
    }

    private String buildKey(String cacheName, String key) {
        return config.redis().keyPrefix() + cacheName + ":" + key;
    }

    @Override
    public Optional<String> get(String cacheName, String key) {
        return Optional.ofNullable(values.get(buildKey(cacheName, key)));
    }

    @Override
    public void put(String cacheName, String key, String value) {
        put(cacheName, key, value, config.ttl());
    }

    @Override
    public void put(String cacheName, String key, String value, Duration ttl) {
        values.setex(buildKey(cacheName, key), ttlSeconds(ttl), value);
    }

    /**
     * WATCH/MULTI on the key. A write by another node between the read and the EXEC
     * discards the transaction and the remapping runs again on the fresh value.
     */
    @Override
    public Optional<String> compute(String cacheName, String key, UnaryOperator<Optional<String>> remapping,
                                    Duration ttl) {
        String redisKey = buildKey(cacheName, key);
        long seconds = ttlSeconds(ttl);
        for (int attempt = 1; attempt <= MAX_COMPUTE_ATTEMPTS; attempt++) {
            OptimisticLockingTransactionResult<Optional<String>> result = redis.withTransaction(
                ds -> remapping.apply(Optional.ofNullable(ds.value(String.class).get(redisKey))),
                (next, tx) -> {
                    if (next.isPresent()) {
                        tx.value(String.class).setex(redisKey, seconds, next.get());
                    } else {
                        tx.key().del(redisKey);
                    }
                },
                redisKey);
            if (!result.discarded()) {
                return result.getPreTransactionResult();
            }
            LOG.debugf("Concurrent update of [%s], retrying compute (%d/%d)", redisKey, attempt, MAX_COMPUTE_ATTEMPTS);
        }
        throw new IllegalStateException("Gave up updating " + redisKey + " after "
            + MAX_COMPUTE_ATTEMPTS + " concurrent modifications");
    }

    private static long ttlSeconds(Duration ttl) {
        return Math.max(1, (ttl.toMillis() + 999) / 1000);
    }

    @Override
    public void invalidate(String cacheName, String key) {
        keys.del(buildKey(cacheName, key));
    }

    @Override
    public void invalidateAll(String cacheName) {
        List<String> matching = keys.keys(buildKey(cacheName, "*"));
        if (!matching.isEmpty()) {
            keys.del(matching.toArray(new String[0]));
        }
        LOG.debugf("Cleared %d entries from cache [%s]", matching.size(), cacheName);
    }
}
