package tech.keyledger.engine;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import org.jboss.logging.Logger;
import tech.keyledger.activation.ActivationLedger;
import tech.keyledger.activation.ActivationReceipt;
import tech.keyledger.activation.HeartbeatReceipt;
import tech.keyledger.activation.hostname.DomainNormalizer;
import tech.keyledger.download.IssuedDownloadUrl;
import tech.keyledger.download.SignedUrlService;
import tech.keyledger.license.CreateLicenseCommand;
import tech.keyledger.license.IssuedLicense;
import tech.keyledger.license.License;
import tech.keyledger.license.LicenseService;
import tech.keyledger.license.key.LicenseKey;
import tech.keyledger.platform.common.Result;
import tech.keyledger.platform.common.TransientStorageException;
import tech.keyledger.platform.common.errors.LicensingError;
import tech.keyledger.platform.config.LicensingConfig;
import tech.keyledger.platform.ratelimit.RateLimitAction;
import tech.keyledger.platform.ratelimit.RateLimitPolicies;
import tech.keyledger.platform.ratelimit.RateLimitPolicy;
import tech.keyledger.platform.ratelimit.RateLimiter;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point for every licensing operation exposed to collaborators.
 *
 * <p>Each keyed operation follows the same pipeline:
 * <ol>
 *   <li>reject a malformed key or domain before touching storage</li>
 *   <li>resolve the key to a license, answering {@code not_found} for any miss</li>
 *   <li>hand over to the {@link ActivationLedger}</li>
 * </ol>
 *
 * <p>Storage failures are retried {@code keyledger.activation.transient-retries} times
 * and then surface as {@link TransientStorageException}. Each attempt runs in its own
 * transaction, so a failed attempt leaves nothing behind.
 */
@ApplicationScoped
public class LicensingEngine {

    private static final Logger LOG = Logger.getLogger(LicensingEngine.class);

    @Inject
    LicenseService licenseService;

    @Inject
    ActivationLedger ledger;

    @Inject
    SignedUrlService signedUrlService;

    @Inject
    RateLimiter rateLimiter;

    @Inject
    RateLimitPolicies policies;

    @Inject
    LicensingConfig config;

    @Inject
    MeterRegistry registry;

    public Result<IssuedLicense> createLicense(CreateLicenseCommand command) {
        return licenseService.createLicense(command);
    }

    public Result<ActivationReceipt> activate(String keyPlaintext, String domain, String clientIp, String userAgent) {
        Result<ActivationReceipt> result = withKeyAndDomain(keyPlaintext, domain,
            license -> ledger.activate(license, domain, clientIp, userAgent));
        record("keyledger.activation", result);
        return result;
    }

    public Result<HeartbeatReceipt> validateHeartbeat(String keyPlaintext, String domain, String clientIp) {
        Result<HeartbeatReceipt> result = withKeyAndDomain(keyPlaintext, domain,
            license -> ledger.validate(license, domain, clientIp));
        record("keyledger.validation", result);
        return result;
    }

    public Result<DeactivationReceipt> deactivate(String keyPlaintext, String domain) {
        Result<DeactivationReceipt> result = withKeyAndDomain(keyPlaintext, domain, license -> {
            if (!ledger.deactivate(license, domain, null)) {
                return Result.failure(LicensingError.domainNotActivated());
            }
            return Result.success(new DeactivationReceipt(
                license.id, DomainNormalizer.normalize(domain), ledger.remainingActivations(license)));
        });
        record("keyledger.deactivation", result);
        return result;
    }

    public IssuedDownloadUrl issueDownloadToken(String licenseId, String releaseId) {
        return signedUrlService.issue(licenseId, releaseId);
    }

    public boolean verifyDownloadToken(String licenseId, String releaseId, long expiresEpochSeconds, String signature) {
        boolean valid = signedUrlService.verify(licenseId, releaseId, expiresEpochSeconds, signature);
        if (!valid) {
            count("keyledger.download.rejected", "invalid_signature");
        }
        return valid;
    }

    /**
     * Count a request from {@code identifier} against the budget of {@code action}.
     * Every action keeps its own window and block per identifier.
     */
    public boolean checkRate(String identifier, RateLimitAction action) {
        if (!policies.enabled()) {
            return true;
        }
        RateLimitPolicy policy = policies.policyFor(action);
        boolean allowed = rateLimiter.allow(action.key() + "_" + identifier, policy.limit(), policy.window());
        if (!allowed) {
            count("keyledger.rate_limit.denied", action.key());
        }
        return allowed;
    }

    /**
     * Resolve a key for callers that need the license itself, such as the update check.
     */
    public Result<License> resolve(String keyPlaintext) {
        Optional<LicenseKey> key = LicenseKey.tryParse(keyPlaintext);
        if (key.isEmpty()) {
            return Result.failure(LicensingError.invalidRequest("Malformed license key"));
        }
        try (LicenseKey licenseKey = key.get()) {
            return withTransientRetry("resolve", () -> licenseService.findByKey(licenseKey))
                .<Result<License>>map(Result::success)
                .orElseGet(() -> Result.failure(LicensingError.notFound()));
        }
    }

    private <T> Result<T> withKeyAndDomain(String keyPlaintext, String domain, Function<License, Result<T>> work) {
        if (!LicenseKey.isValidFormat(keyPlaintext)) {
            return Result.failure(LicensingError.invalidRequest("Malformed license key"));
        }
        if (DomainNormalizer.tryNormalize(domain).isEmpty()) {
            return Result.failure(LicensingError.invalidRequest("Malformed domain"));
        }

        try (LicenseKey key = LicenseKey.parse(keyPlaintext)) {
            return withTransientRetry("licensing operation", () -> {
                Optional<License> license = licenseService.findByKey(key);
                if (license.isEmpty()) {
                    return Result.<T>failure(LicensingError.notFound());
                }
                return work.apply(license.get());
            });
        }
    }

    <T> T withTransientRetry(String operation, Supplier<T> work) {
        int retries = Math.max(0, config.activation().transientRetries());
        TransientStorageException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return work.get();
            } catch (TransientStorageException e) {
                last = e;
            } catch (PersistenceException e) {
                last = new TransientStorageException("Storage failure during " + operation, e);
            }
            if (attempt < retries) {
                LOG.warnf("Transient storage failure during %s, retrying (%d/%d)", operation, attempt + 1, retries);
            }
        }
        LOG.errorf(last, "Storage unavailable during %s after %d attempt(s)", operation, retries + 1);
        count("keyledger.storage.failure", operation.replace(' ', '_'));
        throw last;
    }

    private void record(String metric, Result<?> result) {
        if (result instanceof Result.Failure<?> failure) {
            count(metric, failure.error().code());
        } else {
            count(metric, "success");
        }
    }

    private void count(String metric, String outcome) {
        if (registry != null) {
            registry.counter(metric, "outcome", outcome).increment();
        }
    }
}
