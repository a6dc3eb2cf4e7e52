package tech.keyledger.platform.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the licensing engine.
 *
 * Every limit, TTL, pattern list and secret override the engine consults is read from
 * here once, at injection time.
 *
 * Example configuration:
 * <pre>
 * keyledger.domains.exempt-patterns=localhost,*.local,*.test,staging.example.com
 * keyledger.domains.exempt-bypasses-grace=false
 * keyledger.download.base-url=https://licenses.example.com
 * keyledger.download.releases-dir=/var/lib/keyledger/releases
 * keyledger.rate-limit.activate-limit=10
 * keyledger.rate-limit.activate-window=PT5M
 * keyledger.secrets.dir=/var/lib/keyledger/secrets
 * </pre>
 */
@ConfigMapping(prefix = "keyledger")
public interface LicensingConfig {

    KeysConfig keys();

    DomainsConfig domains();

    ActivationConfig activation();

    DownloadConfig download();

    @WithName("rate-limit")
    RateLimitConfig rateLimit();

    SecretsConfig secrets();

    /**
     * License key generation.
     */
    interface KeysConfig {
        /**
         * Attempts at producing a key whose hash is not yet stored before giving up.
         */
        @WithDefault("10")
        int maxGenerationAttempts();
    }

    /**
     * Exempt (developer/staging) domains.
     */
    interface DomainsConfig {
        /**
         * Newline or comma separated patterns. An empty value falls back to the built-in set.
         */
        @WithDefault("localhost,*.local,*.test")
        String exemptPatterns();

        /**
         * Whether an exempt domain may still activate and validate once the license has
         * passed its grace period.
         */
        @WithDefault("false")
        boolean exemptBypassesGrace();
    }

    interface ActivationConfig {
        /**
         * Upper bound for waiting on the per-license lock.
         */
        @WithDefault("5s")
        Duration lockTimeout();

        /**
         * Retries after a transient storage failure.
         */
        @WithDefault("1")
        int transientRetries();
    }

    /**
     * Signed download links.
     */
    interface DownloadConfig {
        @WithDefault("PT5M")
        Duration ttl();

        /**
         * Public base URL the signed links point at.
         */
        @WithDefault("http://localhost:8080")
        String baseUrl();

        @WithDefault("/api/v1/updates/download")
        String path();

        /**
         * Directory release archives are served from.
         */
        @WithDefault("releases")
        String releasesDir();
    }

    /**
     * Per-action request budgets, all keyed by client IP.
     */
    interface RateLimitConfig {
        @WithDefault("true")
        boolean enabled();

        /**
         * How long an identifier stays blocked after breaching a limit.
         */
        @WithDefault("PT15M")
        Duration blockDuration();

        @WithDefault("10")
        int activateLimit();

        @WithDefault("PT5M")
        Duration activateWindow();

        @WithDefault("60")
        int validateLimit();

        @WithDefault("PT5M")
        Duration validateWindow();

        @WithDefault("20")
        int deactivateLimit();

        @WithDefault("PT5M")
        Duration deactivateWindow();

        @WithDefault("120")
        int updateCheckLimit();

        @WithDefault("PT5M")
        Duration updateCheckWindow();

        @WithDefault("10")
        int downloadLimit();

        @WithDefault("PT1H")
        Duration downloadWindow();

        @WithDefault("30")
        int defaultLimit();

        @WithDefault("PT5M")
        Duration defaultWindow();
    }

    /**
     * Server secrets. Explicit values win over the persisted files in {@link #dir()}.
     */
    interface SecretsConfig {
        @WithDefault(".keyledger-secrets")
        String dir();

        Optional<String> hashSalt();

        Optional<String> keySecret();

        Optional<String> signingSecret();

        Optional<String> ipSalt();
    }
}
