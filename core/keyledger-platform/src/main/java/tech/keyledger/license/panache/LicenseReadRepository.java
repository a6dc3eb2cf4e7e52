package tech.keyledger.license.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.keyledger.license.License;
import tech.keyledger.license.LicenseRepository;
import tech.keyledger.license.entity.LicenseEntity;
import tech.keyledger.license.mapper.LicenseMapper;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for License entities.
 * Uses EntityManager directly to return domain objects.
 */
@ApplicationScoped
public class LicenseReadRepository implements LicenseRepository {

    @Inject
    EntityManager em;

    @Inject
    LicenseWriteRepository writeRepo;

    @Override
    public Optional<License> findById(String id) {
        return Optional.ofNullable(em.find(LicenseEntity.class, id)).map(LicenseMapper::toDomain);
    }

    @Override
    public Optional<License> findByKeyHash(String keyHash) {
        var results = em.createQuery("FROM LicenseEntity WHERE keyHash = :keyHash", LicenseEntity.class)
            .setParameter("keyHash", keyHash)
            .getResultList();
        return results.isEmpty() ? Optional.empty() : Optional.of(LicenseMapper.toDomain(results.get(0)));
    }

    @Override
    public boolean existsByKeyHash(String keyHash) {
        Long count = em.createQuery("SELECT COUNT(e) FROM LicenseEntity e WHERE e.keyHash = :keyHash", Long.class)
            .setParameter("keyHash", keyHash)
            .getSingleResult();
        return count > 0;
    }

    @Override
    public List<License> findByOwner(String ownerId) {
        return em.createQuery("FROM LicenseEntity WHERE ownerId = :ownerId ORDER BY createdAt DESC", LicenseEntity.class)
            .setParameter("ownerId", ownerId)
            .getResultList()
            .stream()
            .map(LicenseMapper::toDomain)
            .toList();
    }

    // Write operations delegate to WriteRepository
    @Override
    public void persist(License license) {
        writeRepo.persistLicense(license);
    }

    @Override
    public void update(License license) {
        writeRepo.updateLicense(license);
    }

    @Override
    public void delete(License license) {
        writeRepo.deleteLicenseById(license.id);
    }

    @Override
    public void markValidated(String id, Instant at) {
        writeRepo.markValidated(id, at);
    }
}
