package tech.keyledger.license;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.keyledger.activation.ActivationRepository;
import tech.keyledger.license.key.KeyHashes;
import tech.keyledger.license.key.LicenseKey;
import tech.keyledger.license.key.LicenseKeyService;
import tech.keyledger.platform.common.Result;
import tech.keyledger.platform.common.errors.LicensingError;
import tech.keyledger.platform.shared.EntityType;
import tech.keyledger.platform.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * License lifecycle: issuance, key resolution, administrative status changes, renewal
 * and deletion.
 */
@ApplicationScoped
public class LicenseService {

    private static final Logger LOG = Logger.getLogger(LicenseService.class);

    @Inject
    LicenseRepository licenseRepository;

    @Inject
    ActivationRepository activationRepository;

    @Inject
    LicenseKeyService keyService;

    @Inject
    Clock clock;

    /**
     * Issue a new license with status ACTIVE and a freshly generated key.
     *
     * @return the license id and the plaintext key, or a validation failure
     */
    @Transactional
    public Result<IssuedLicense> createLicense(CreateLicenseCommand command) {
        if (command.ownerId() == null || command.ownerId().isBlank()) {
            return Result.failure(LicensingError.invalidRequest("ownerId is required"));
        }
        if (command.productId() == null || command.productId().isBlank()) {
            return Result.failure(LicensingError.invalidRequest("productId is required"));
        }
        if (command.maxActivations() != null && command.maxActivations() < 0) {
            return Result.failure(LicensingError.invalidRequest("maxActivations must not be negative"));
        }
        if (command.graceUntil() != null) {
            if (command.expiresAt() == null) {
                return Result.failure(LicensingError.invalidRequest("graceUntil requires expiresAt"));
            }
            if (command.graceUntil().isBefore(command.expiresAt())) {
                return Result.failure(LicensingError.invalidRequest("graceUntil must not precede expiresAt"));
            }
        }

        LicenseKey key = keyService.generateKey(command.productId(), command.ownerId());
        KeyHashes hashes = keyService.hashKey(key);
        Instant now = clock.instant();

        License license = new License();
        license.id = TsidGenerator.generate(EntityType.LICENSE);
        license.ownerId = command.ownerId();
        license.productId = command.productId();
        license.orderRef = command.orderRef();
        license.keyHash = hashes.primaryHash();
        license.keyVerificationHash = hashes.verificationHash();
        license.status = LicenseStatus.ACTIVE;
        license.expiresAt = command.expiresAt();
        license.graceUntil = command.graceUntil();
        // 0 from order intake means unlimited
        license.maxActivations = command.maxActivations() == null || command.maxActivations() == 0
            ? null : command.maxActivations();
        license.createdAt = now;
        license.updatedAt = now;
        licenseRepository.persist(license);

        LOG.infof("Issued license %s for product %s (key %s)",
            license.id, license.productId, LicenseKeyService.maskHash(license.keyHash));
        return Result.success(new IssuedLicense(license.id, key));
    }

    /**
     * Resolve a plaintext key. Both stored hashes must match; a mismatch of the
     * verification hash looks exactly like an unknown key to the caller.
     */
    public Optional<License> findByKey(LicenseKey key) {
        KeyHashes hashes = keyService.hashKey(key);
        Optional<License> license = licenseRepository.findByKeyHash(hashes.primaryHash());
        if (license.isEmpty()) {
            return Optional.empty();
        }
        if (!keyService.verifyHashes(hashes.primaryHash(), license.get().keyVerificationHash)) {
            LOG.warnf("Verification hash mismatch for license %s", license.get().id);
            return Optional.empty();
        }
        return license;
    }

    public Optional<License> findById(String id) {
        return licenseRepository.findById(id);
    }

    /**
     * Administrative status change (suspend, revoke, reinstate). Reinstating clears the
     * failed attempt counter.
     */
    @Transactional
    public Result<License> changeStatus(String licenseId, LicenseStatus status) {
        if (status == null) {
            return Result.failure(LicensingError.invalidRequest("status is required"));
        }
        Optional<License> found = licenseRepository.findById(licenseId);
        if (found.isEmpty()) {
            return Result.failure(LicensingError.notFound());
        }
        License license = found.get();
        LicenseStatus previous = license.status;
        license.status = status;
        if (status == LicenseStatus.ACTIVE) {
            license.failedAttempts = 0;
        }
        license.updatedAt = clock.instant();
        licenseRepository.update(license);

        LOG.infof("License %s status changed %s -> %s", license.id, previous, status);
        return Result.success(license);
    }

    /**
     * Move the expiry (and optionally the grace end) of a license.
     */
    @Transactional
    public Result<License> renew(String licenseId, Instant expiresAt, Instant graceUntil) {
        if (graceUntil != null && (expiresAt == null || graceUntil.isBefore(expiresAt))) {
            return Result.failure(LicensingError.invalidRequest("graceUntil must not precede expiresAt"));
        }
        Optional<License> found = licenseRepository.findById(licenseId);
        if (found.isEmpty()) {
            return Result.failure(LicensingError.notFound());
        }
        License license = found.get();
        license.expiresAt = expiresAt;
        license.graceUntil = graceUntil;
        license.updatedAt = clock.instant();
        licenseRepository.update(license);

        LOG.infof("License %s renewed until %s", license.id, expiresAt);
        return Result.success(license);
    }

    /**
     * Delete a license together with all of its activations.
     */
    @Transactional
    public Result<String> delete(String licenseId) {
        Optional<License> found = licenseRepository.findById(licenseId);
        if (found.isEmpty()) {
            return Result.failure(LicensingError.notFound());
        }
        long removed = activationRepository.deleteByLicense(licenseId);
        licenseRepository.delete(found.get());
        LOG.infof("Deleted license %s and %d activation(s)", licenseId, removed);
        return Result.success(licenseId);
    }
}
