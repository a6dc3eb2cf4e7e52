package tech.keyledger.platform.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.keyledger.platform.config.LicensingConfig;

/**
 * Maps each {@link RateLimitAction} to the budget configured under
 * {@code keyledger.rate-limit}. The limiter itself stays unaware of actions.
 */
@ApplicationScoped
public class RateLimitPolicies {

    @Inject
    LicensingConfig config;

    public RateLimitPolicies() {
    }

    public RateLimitPolicies(LicensingConfig config) {
        this.config = config;
    }

    public RateLimitPolicy policyFor(RateLimitAction action) {
        LicensingConfig.RateLimitConfig rl = config.rateLimit();
        if (action == RateLimitAction.ACTIVATE) {
            return new RateLimitPolicy(rl.activateLimit(), rl.activateWindow());
        } else if (action == RateLimitAction.VALIDATE) {
            return new RateLimitPolicy(rl.validateLimit(), rl.validateWindow());
        } else if (action == RateLimitAction.DEACTIVATE) {
            return new RateLimitPolicy(rl.deactivateLimit(), rl.deactivateWindow());
        } else if (action == RateLimitAction.UPDATE_CHECK) {
            return new RateLimitPolicy(rl.updateCheckLimit(), rl.updateCheckWindow());
        } else if (action == RateLimitAction.DOWNLOAD) {
            return new RateLimitPolicy(rl.downloadLimit(), rl.downloadWindow());
        }
        return new RateLimitPolicy(rl.defaultLimit(), rl.defaultWindow());
    }

    public boolean enabled() {
        return config.rateLimit().enabled();
    }
}
