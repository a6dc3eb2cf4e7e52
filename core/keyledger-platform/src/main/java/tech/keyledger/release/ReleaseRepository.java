package tech.keyledger.release;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Release entities.
 */
public interface ReleaseRepository {

    // Read operations
    Optional<Release> findById(String id);
    List<Release> findActiveByProductAndSlug(String productId, String slug);
    boolean existsActiveForProduct(String productId);

    // Write operations
    void persist(Release release);
    void update(Release release);
}
