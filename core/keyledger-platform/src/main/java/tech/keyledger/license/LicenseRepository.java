package tech.keyledger.license;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for License entities.
 */
public interface LicenseRepository {

    // Read operations
    Optional<License> findById(String id);
    Optional<License> findByKeyHash(String keyHash);
    boolean existsByKeyHash(String keyHash);
    List<License> findByOwner(String ownerId);

    // Write operations
    void persist(License license);
    void update(License license);
    void delete(License license);

    /**
     * Record a successful heartbeat without rewriting the rest of the row.
     */
    void markValidated(String id, Instant at);
}
