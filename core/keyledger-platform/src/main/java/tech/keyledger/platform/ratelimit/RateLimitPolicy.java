package tech.keyledger.platform.ratelimit;

import java.time.Duration;

/**
 * A request budget: at most {@code limit} requests in any trailing {@code window}.
 */
public record RateLimitPolicy(int limit, Duration window) {

    public RateLimitPolicy {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }
}
