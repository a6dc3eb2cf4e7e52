package tech.keyledger.activation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Activation entities.
 */
public interface ActivationRepository {

    // Read operations
    Optional<Activation> findByLicenseAndDomain(String licenseId, String domain);
    List<Activation> findActiveByLicense(String licenseId);
    List<Activation> findByLicense(String licenseId);

    // Write operations
    void persist(Activation activation);
    void update(Activation activation);

    /**
     * Atomically bump the validation count and refresh last-seen on an active row.
     *
     * @return the updated row, or empty if no active row exists
     */
    Optional<Activation> touch(String licenseId, String domain, Instant seenAt, String ipHash, String userAgentHash);

    /**
     * Soft-deactivate the active row for the domain.
     *
     * @return false if no active row existed
     */
    boolean deactivate(String licenseId, String domain, Instant at, String reason);

    long deleteByLicense(String licenseId);
}
