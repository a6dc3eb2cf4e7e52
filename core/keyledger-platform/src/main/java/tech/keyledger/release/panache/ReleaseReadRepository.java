package tech.keyledger.release.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.keyledger.release.Release;
import tech.keyledger.release.ReleaseRepository;
import tech.keyledger.release.entity.ReleaseEntity;
import tech.keyledger.release.mapper.ReleaseMapper;

import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for Release entities.
 */
@ApplicationScoped
public class ReleaseReadRepository implements ReleaseRepository {

    @Inject
    EntityManager em;

    @Inject
    ReleaseWriteRepository writeRepo;

    @Override
    public Optional<Release> findById(String id) {
        return Optional.ofNullable(em.find(ReleaseEntity.class, id)).map(ReleaseMapper::toDomain);
    }

    @Override
    public List<Release> findActiveByProductAndSlug(String productId, String slug) {
        return em.createQuery(
                "FROM ReleaseEntity WHERE productId = :productId AND slug = :slug AND active = true",
                ReleaseEntity.class)
            .setParameter("productId", productId)
            .setParameter("slug", slug)
            .getResultList()
            .stream()
            .map(ReleaseMapper::toDomain)
            .toList();
    }

    @Override
    public boolean existsActiveForProduct(String productId) {
        Long count = em.createQuery(
                "SELECT COUNT(e) FROM ReleaseEntity e WHERE e.productId = :productId AND e.active = true", Long.class)
            .setParameter("productId", productId)
            .getSingleResult();
        return count > 0;
    }

    // Write operations delegate to WriteRepository
    @Override
    public void persist(Release release) {
        writeRepo.persistRelease(release);
    }

    @Override
    public void update(Release release) {
        writeRepo.updateRelease(release);
    }
}
