package tech.keyledger.activation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.keyledger.activation.hostname.DomainNormalizer;
import tech.keyledger.activation.hostname.ExemptDomainMatcher;
import tech.keyledger.license.EffectiveStatus;
import tech.keyledger.license.License;
import tech.keyledger.license.LicenseRepository;
import tech.keyledger.license.LicenseStateMachine;
import tech.keyledger.platform.common.Result;
import tech.keyledger.platform.common.errors.LicensingError;
import tech.keyledger.platform.config.LicensingConfig;
import tech.keyledger.platform.security.HmacSigner;
import tech.keyledger.platform.security.secrets.ServerSecrets;
import tech.keyledger.platform.shared.EntityType;
import tech.keyledger.platform.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-license set of bound domains with capacity accounting.
 *
 * <p>First activation of a domain runs under the license lock ({@link LedgerTransaction#inLicenseScope}):
 * the existing-row check, the capacity count and the insert happen as one unit, so
 * concurrent activations can never admit more than {@code maxActivations} domains.
 * Re-activating a bound domain only refreshes it. Exempt domains never count against
 * capacity.
 *
 * <p>Heartbeats and deactivations are single conditional updates and take no lock.
 */
@ApplicationScoped
public class ActivationLedger {

    private static final Logger LOG = Logger.getLogger(ActivationLedger.class);
    static final String DEFAULT_DEACTIVATION_REASON = "client_request";

    @Inject
    ActivationRepository activationRepository;

    @Inject
    LicenseRepository licenseRepository;

    @Inject
    LedgerTransaction transaction;

    @Inject
    ExemptDomainMatcher exemptMatcher;

    @Inject
    ServerSecrets secrets;

    @Inject
    LicensingConfig config;

    @Inject
    Clock clock;

    /**
     * Bind a domain to the license, or refresh the binding if it already exists.
     *
     * @param domain a hostname or URL, normalized here
     */
    public Result<ActivationReceipt> activate(License license, String domain, String clientIp, String userAgent) {
        String normalized = DomainNormalizer.normalize(domain);
        Instant now = clock.instant();
        boolean exempt = exemptMatcher.isExempt(normalized);

        EffectiveStatus status = LicenseStateMachine.evaluate(license, now);
        if (!isUsable(status, exempt)) {
            return Result.failure(denialFor(status));
        }

        String ipHash = hashIp(clientIp);
        String userAgentHash = hashUserAgent(userAgent);

        return transaction.inLicenseScope(license.id, locked -> {
            if (locked.isEmpty()) {
                return Result.<ActivationReceipt>failure(LicensingError.notFound());
            }
            License current = locked.get();
            EffectiveStatus currentStatus = LicenseStateMachine.evaluate(current, now);
            if (!isUsable(currentStatus, exempt)) {
                return Result.<ActivationReceipt>failure(denialFor(currentStatus));
            }

            Optional<Activation> existing = activationRepository.findByLicenseAndDomain(current.id, normalized);
            if (existing.isPresent() && existing.get().active) {
                activationRepository.touch(current.id, normalized, now, ipHash, userAgentHash);
                LOG.debugf("Domain %s already active for license %s, refreshed", normalized, current.id);
                return Result.success(receipt(current, normalized, currentStatus, exempt, true));
            }

            if (current.hasActivationLimit() && !exempt) {
                long used = countNonExempt(current.id);
                if (used >= current.maxActivations) {
                    LOG.infof("Activation limit reached for license %s (%d/%d), rejected %s",
                        current.id, used, current.maxActivations, normalized);
                    return Result.<ActivationReceipt>failure(LicensingError.activationLimit(current.maxActivations));
                }
            }

            if (existing.isPresent()) {
                Activation row = existing.get();
                row.active = true;
                row.activatedAt = now;
                row.lastSeenAt = now;
                row.validationCount++;
                row.ipHash = ipHash;
                row.userAgentHash = userAgentHash;
                row.deactivatedAt = null;
                row.deactivationReason = null;
                activationRepository.update(row);
            } else {
                Activation row = new Activation();
                row.id = TsidGenerator.generate(EntityType.ACTIVATION);
                row.licenseId = current.id;
                row.domain = normalized;
                row.ipHash = ipHash;
                row.userAgentHash = userAgentHash;
                row.activatedAt = now;
                row.lastSeenAt = now;
                row.validationCount = 1;
                row.active = true;
                activationRepository.persist(row);
            }

            LOG.infof("Activated %s%s for license %s", normalized, exempt ? " (exempt)" : "", current.id);
            return Result.success(receipt(current, normalized, currentStatus, exempt, false));
        });
    }

    /**
     * Heartbeat for an already bound domain.
     */
    public Result<HeartbeatReceipt> validate(License license, String domain, String clientIp) {
        String normalized = DomainNormalizer.normalize(domain);
        Instant now = clock.instant();

        Optional<Activation> row = activationRepository.findByLicenseAndDomain(license.id, normalized)
            .filter(a -> a.active);
        if (row.isEmpty()) {
            return Result.failure(LicensingError.domainNotActivated());
        }

        EffectiveStatus status = LicenseStateMachine.evaluate(license, now);
        if (!isUsable(status, exemptMatcher.isExempt(normalized))) {
            return Result.failure(denialFor(status));
        }

        String ipHash = hashIp(clientIp);
        Optional<Activation> touched = transaction.inTransaction(() -> {
            Optional<Activation> updated = activationRepository.touch(license.id, normalized, now, ipHash, null);
            if (updated.isPresent()) {
                licenseRepository.markValidated(license.id, now);
            }
            return updated;
        });
        if (touched.isEmpty()) {
            // Deactivated between the read and the update
            return Result.failure(LicensingError.domainNotActivated());
        }

        return Result.success(new HeartbeatReceipt(
            license.id,
            license.productId,
            normalized,
            status,
            license.expiresAt,
            license.graceUntil,
            touched.get().validationCount
        ));
    }

    /**
     * Soft-deactivate the binding.
     *
     * @return false if the domain had no active binding
     */
    public boolean deactivate(License license, String domain, String reason) {
        String normalized = DomainNormalizer.normalize(domain);
        Instant now = clock.instant();
        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_DEACTIVATION_REASON : reason;

        boolean deactivated = transaction.inTransaction(
            () -> activationRepository.deactivate(license.id, normalized, now, effectiveReason));
        if (deactivated) {
            LOG.infof("Deactivated %s for license %s (%s)", normalized, license.id, effectiveReason);
        } else {
            LOG.debugf("No active binding for %s on license %s to deactivate", normalized, license.id);
        }
        return deactivated;
    }

    /**
     * Free non-exempt slots, floored at zero, or null when unlimited.
     */
    public Integer remainingActivations(License license) {
        if (!license.hasActivationLimit()) {
            return null;
        }
        long used = countNonExempt(license.id);
        return (int) Math.max(0, license.maxActivations - used);
    }

    private ActivationReceipt receipt(License license, String domain, EffectiveStatus status,
                                      boolean exempt, boolean alreadyActive) {
        return new ActivationReceipt(
            license.id,
            domain,
            status,
            license.expiresAt,
            remainingActivations(license),
            exempt,
            alreadyActive
        );
    }

    private long countNonExempt(String licenseId) {
        return activationRepository.findActiveByLicense(licenseId).stream()
            .filter(a -> !exemptMatcher.isExempt(a.domain))
            .count();
    }

    private boolean isUsable(EffectiveStatus status, boolean exempt) {
        if (status.isUsable()) {
            return true;
        }
        return exempt && status == EffectiveStatus.EXPIRED && config.domains().exemptBypassesGrace();
    }

    private static LicensingError denialFor(EffectiveStatus status) {
        return status == EffectiveStatus.EXPIRED ? LicensingError.expired() : LicensingError.inactive();
    }

    private String hashIp(String clientIp) {
        if (clientIp == null || clientIp.isBlank()) {
            return null;
        }
        return HmacSigner.hmacSha256Hex(clientIp.trim(), secrets.ipSalt());
    }

    private static String hashUserAgent(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return null;
        }
        return HmacSigner.sha256Hex(userAgent);
    }
}
