package tech.keyledger.activation.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.keyledger.activation.Activation;
import tech.keyledger.activation.ActivationRepository;
import tech.keyledger.activation.entity.ActivationEntity;
import tech.keyledger.activation.mapper.ActivationMapper;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for Activation entities.
 * Uses EntityManager directly to return domain objects.
 */
@ApplicationScoped
public class ActivationReadRepository implements ActivationRepository {

    @Inject
    EntityManager em;

    @Inject
    ActivationWriteRepository writeRepo;

    @Override
    public Optional<Activation> findByLicenseAndDomain(String licenseId, String domain) {
        var results = em.createQuery(
                "FROM ActivationEntity WHERE licenseId = :licenseId AND domain = :domain", ActivationEntity.class)
            .setParameter("licenseId", licenseId)
            .setParameter("domain", domain)
            .getResultList();
        return results.isEmpty() ? Optional.empty() : Optional.of(ActivationMapper.toDomain(results.get(0)));
    }

    @Override
    public List<Activation> findActiveByLicense(String licenseId) {
        return em.createQuery(
                "FROM ActivationEntity WHERE licenseId = :licenseId AND active = true ORDER BY activatedAt",
                ActivationEntity.class)
            .setParameter("licenseId", licenseId)
            .getResultList()
            .stream()
            .map(ActivationMapper::toDomain)
            .toList();
    }

    @Override
    public List<Activation> findByLicense(String licenseId) {
        return em.createQuery("FROM ActivationEntity WHERE licenseId = :licenseId ORDER BY activatedAt",
                ActivationEntity.class)
            .setParameter("licenseId", licenseId)
            .getResultList()
            .stream()
            .map(ActivationMapper::toDomain)
            .toList();
    }

    // Write operations delegate to WriteRepository
    @Override
    public void persist(Activation activation) {
        writeRepo.persistActivation(activation);
    }

    @Override
    public void update(Activation activation) {
        writeRepo.updateActivation(activation);
    }

    @Override
    public Optional<Activation> touch(String licenseId, String domain, Instant seenAt, String ipHash,
                                      String userAgentHash) {
        if (writeRepo.touchActive(licenseId, domain, seenAt, ipHash, userAgentHash) == 0) {
            return Optional.empty();
        }
        em.clear();
        return findByLicenseAndDomain(licenseId, domain).filter(a -> a.active);
    }

    @Override
    public boolean deactivate(String licenseId, String domain, Instant at, String reason) {
        return writeRepo.deactivateActive(licenseId, domain, at, reason) > 0;
    }

    @Override
    public long deleteByLicense(String licenseId) {
        return writeRepo.deleteAllForLicense(licenseId);
    }
}
