package tech.keyledger.platform.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * CDI producer that selects the appropriate CacheStore implementation
 * based on configuration.
 */
@ApplicationScoped
public class CacheStoreProducer {

    private static final Logger LOG = Logger.getLogger(CacheStoreProducer.class);

    @Inject
    CacheConfig config;

    @Inject
    Instance<InMemoryCacheStore> inMemoryCacheStore;

    @Inject
    Instance<RedisCacheStore> redisCacheStore;

    @Produces
    @ApplicationScoped
    public CacheStore cacheStore() {
        CacheStore.CacheType type = config.type();
        LOG.infof("Initializing cache store: type=%s, ttl=%s", type, config.ttl());

        if (type == CacheStore.CacheType.REDIS) {
            LOG.info("Using Redis cache");
            return redisCacheStore.get();
        }
        LOG.info("Using in-memory cache (Caffeine)");
        return inMemoryCacheStore.get();
    }
}
