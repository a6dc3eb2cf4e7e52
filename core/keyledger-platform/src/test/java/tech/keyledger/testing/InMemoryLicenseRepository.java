package tech.keyledger.testing;

import tech.keyledger.license.License;
import tech.keyledger.license.LicenseRepository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link LicenseRepository}. Stores copies so callers cannot
 * mutate stored rows without calling {@link #update}.
 */
public class InMemoryLicenseRepository implements LicenseRepository {

    private final Map<String, License> rows = new ConcurrentHashMap<>();

    @Override
    public Optional<License> findById(String id) {
        return Optional.ofNullable(rows.get(id)).map(InMemoryLicenseRepository::copy);
    }

    @Override
    public Optional<License> findByKeyHash(String keyHash) {
        return rows.values().stream()
            .filter(l -> l.keyHash.equals(keyHash))
            .findFirst()
            .map(InMemoryLicenseRepository::copy);
    }

    @Override
    public boolean existsByKeyHash(String keyHash) {
        return rows.values().stream().anyMatch(l -> l.keyHash.equals(keyHash));
    }

    @Override
    public List<License> findByOwner(String ownerId) {
        return rows.values().stream()
            .filter(l -> l.ownerId.equals(ownerId))
            .map(InMemoryLicenseRepository::copy)
            .toList();
    }

    @Override
    public void persist(License license) {
        if (rows.putIfAbsent(license.id, copy(license)) != null) {
            throw new IllegalStateException("Duplicate license id " + license.id);
        }
    }

    @Override
    public void update(License license) {
        rows.replace(license.id, copy(license));
    }

    @Override
    public void delete(License license) {
        rows.remove(license.id);
    }

    @Override
    public void markValidated(String id, Instant at) {
        rows.computeIfPresent(id, (k, l) -> {
            License updated = copy(l);
            updated.lastValidatedAt = at;
            return updated;
        });
    }

    public int size() {
        return rows.size();
    }

    private static License copy(License source) {
        License l = new License();
        l.id = source.id;
        l.ownerId = source.ownerId;
        l.productId = source.productId;
        l.orderRef = source.orderRef;
        l.keyHash = source.keyHash;
        l.keyVerificationHash = source.keyVerificationHash;
        l.status = source.status;
        l.expiresAt = source.expiresAt;
        l.graceUntil = source.graceUntil;
        l.maxActivations = source.maxActivations;
        l.failedAttempts = source.failedAttempts;
        l.lastValidatedAt = source.lastValidatedAt;
        l.createdAt = source.createdAt;
        l.updatedAt = source.updatedAt;
        return l;
    }
}
