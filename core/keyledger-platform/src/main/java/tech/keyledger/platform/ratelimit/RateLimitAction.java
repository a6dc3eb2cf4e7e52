package tech.keyledger.platform.ratelimit;

/**
 * Request categories with their own rate-limit budget.
 */
public enum RateLimitAction {
    ACTIVATE("activate"),
    VALIDATE("validate"),
    DEACTIVATE("deactivate"),
    UPDATE_CHECK("update_check"),
    DOWNLOAD("download"),
    DEFAULT("default");

    private final String key;

    RateLimitAction(String key) {
        this.key = key;
    }

    /**
     * Prefix used when building limiter identifiers, e.g. {@code download_203.0.113.7}.
     */
    public String key() {
        return key;
    }
}
