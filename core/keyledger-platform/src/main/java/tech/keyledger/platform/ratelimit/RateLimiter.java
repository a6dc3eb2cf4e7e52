package tech.keyledger.platform.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.keyledger.platform.cache.CacheStore;
import tech.keyledger.platform.config.LicensingConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Sliding-window request limiter with temporary blocking.
 *
 * <p>Uses CacheStore to keep, per identifier, the timestamps of the requests seen in the
 * trailing window. Each check prunes and extends the window in one atomic
 * {@link CacheStore#compute} call. A request arriving when the window is already full is denied and the
 * identifier is blocked for {@code keyledger.rate-limit.block-duration}, so a repeat
 * offender stays out even after its window drains. The block marker is consulted before
 * any counting.
 *
 * <p>The limiter is endpoint-agnostic: callers pass the identifier and the
 * {@code (limit, window)} pair. Counting is best-effort and may over-admit slightly when
 * two nodes race on the same identifier.
 *
 * <p>If the cache backend fails, requests are allowed and the degradation is logged.
 */
@ApplicationScoped
public class RateLimiter {

    private static final Logger LOG = Logger.getLogger(RateLimiter.class);
    static final String WINDOW_CACHE = "rate-limit-windows";
    static final String BLOCK_CACHE = "rate-limit-blocks";
    static final int MAX_IDENTIFIER_LENGTH = 64;
    private static final double WARNING_RATIO = 0.8;

    @Inject
    CacheStore cacheStore;

    @Inject
    LicensingConfig config;

    @Inject
    Clock clock;

    /**
     * Record a request for the identifier if it fits in the window.
     *
     * @return true if the request is allowed
     */
    public boolean allow(String identifier, int limit, Duration window) {
        String id = sanitize(identifier);
        long now = clock.millis();

        try {
            if (blockedUntil(id, now).isPresent()) {
                LOG.debugf("Rejecting request from blocked identifier %s", id);
                return false;
            }

            AtomicBoolean admitted = new AtomicBoolean();
            AtomicInteger seen = new AtomicInteger();
            cacheStore.compute(WINDOW_CACHE, id, cached -> {
                List<Long> timestamps = liveTimestamps(cached, now, window);
                seen.set(timestamps.size());
                admitted.set(timestamps.size() < limit);
                if (admitted.get()) {
                    timestamps.add(now);
                }
                return timestamps.isEmpty() ? Optional.empty() : Optional.of(serialize(timestamps));
            }, window);
            int current = seen.get();

            if (!admitted.get()) {
                Duration blockDuration = config.rateLimit().blockDuration();
                LOG.warnf("Rate limit exceeded for %s (%d requests in %s), blocking for %s",
                    id, current, window, blockDuration);
                putBlock(id, now, blockDuration);
                return false;
            }

            if (current >= limit * WARNING_RATIO) {
                LOG.infof("Identifier %s approaching rate limit: %d/%d in %s", id, current + 1, limit, window);
            }
            return true;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Rate limit store unavailable, allowing request from %s", id);
            return true;
        }
    }

    public boolean isBlocked(String identifier) {
        String id = sanitize(identifier);
        try {
            return blockedUntil(id, clock.millis()).isPresent();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Rate limit store unavailable, treating %s as not blocked", id);
            return false;
        }
    }

    public void block(String identifier, Duration duration) {
        String id = sanitize(identifier);
        putBlock(id, clock.millis(), duration);
        LOG.infof("Blocked identifier %s for %s", id, duration);
    }

    public void unblock(String identifier) {
        String id = sanitize(identifier);
        cacheStore.invalidate(BLOCK_CACHE, id);
        LOG.infof("Unblocked identifier %s", id);
    }

    /**
     * Requests recorded for the identifier in the trailing window.
     */
    public int getCurrentRequestCount(String identifier, Duration window) {
        String id = sanitize(identifier);
        return liveTimestamps(cacheStore.get(WINDOW_CACHE, id), clock.millis(), window).size();
    }

    /**
     * Forget both the window and any block for the identifier.
     */
    public void reset(String identifier) {
        String id = sanitize(identifier);
        cacheStore.invalidate(WINDOW_CACHE, id);
        cacheStore.invalidate(BLOCK_CACHE, id);
        LOG.infof("Reset rate limit state for %s", id);
    }

    static String sanitize(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return "unknown";
        }
        String cleaned = identifier.replaceAll("[^A-Za-z0-9.-]", "_");
        return cleaned.length() > MAX_IDENTIFIER_LENGTH ? cleaned.substring(0, MAX_IDENTIFIER_LENGTH) : cleaned;
    }

    private Optional<Long> blockedUntil(String id, long now) {
        Optional<String> cached = cacheStore.get(BLOCK_CACHE, id);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        long until = parseLong(cached.get());
        if (until <= now) {
            cacheStore.invalidate(BLOCK_CACHE, id);
            return Optional.empty();
        }
        return Optional.of(until);
    }

    private void putBlock(String id, long now, Duration duration) {
        cacheStore.put(BLOCK_CACHE, id, Long.toString(now + duration.toMillis()), duration);
    }

    private static List<Long> liveTimestamps(Optional<String> cached, long now, Duration window) {
        List<Long> result = new ArrayList<>();
        if (cached.isEmpty() || cached.get().isEmpty()) {
            return result;
        }
        long cutoff = now - window.toMillis();
        for (String part : cached.get().split(",")) {
            long ts = parseLong(part);
            if (ts > cutoff) {
                result.add(ts);
            }
        }
        return result;
    }

    private static String serialize(List<Long> timestamps) {
        return timestamps.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            // Corrupt entries count as expired
            return 0L;
        }
    }
}
