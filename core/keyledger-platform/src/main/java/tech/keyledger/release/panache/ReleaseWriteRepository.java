package tech.keyledger.release.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.keyledger.release.Release;
import tech.keyledger.release.entity.ReleaseEntity;
import tech.keyledger.release.mapper.ReleaseMapper;

import java.time.Instant;

/**
 * Write-side repository for Release entities.
 */
@ApplicationScoped
public class ReleaseWriteRepository implements PanacheRepositoryBase<ReleaseEntity, String> {

    public void persistRelease(Release release) {
        if (release.releasedAt == null) {
            release.releasedAt = Instant.now();
        }
        persist(ReleaseMapper.toEntity(release));
    }

    public void updateRelease(Release release) {
        ReleaseEntity entity = findById(release.id);
        if (entity != null) {
            ReleaseMapper.updateEntity(entity, release);
        }
    }
}
