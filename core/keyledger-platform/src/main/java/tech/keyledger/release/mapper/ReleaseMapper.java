package tech.keyledger.release.mapper;

import tech.keyledger.release.Release;
import tech.keyledger.release.entity.ReleaseEntity;

/**
 * Mapper for converting between Release domain model and JPA entity.
 */
public final class ReleaseMapper {

    private ReleaseMapper() {
    }

    public static Release toDomain(ReleaseEntity entity) {
        if (entity == null) {
            return null;
        }

        Release domain = new Release();
        domain.id = entity.id;
        domain.productId = entity.productId;
        domain.slug = entity.slug;
        domain.version = entity.version;
        domain.filePath = entity.filePath;
        domain.fileSize = entity.fileSize;
        domain.fileHash = entity.fileHash;
        domain.changelog = entity.changelog;
        domain.requires = entity.requires;
        domain.requiresRuntime = entity.requiresRuntime;
        domain.testedUpTo = entity.testedUpTo;
        domain.active = entity.active;
        domain.releasedAt = entity.releasedAt;
        return domain;
    }

    public static ReleaseEntity toEntity(Release domain) {
        if (domain == null) {
            return null;
        }

        ReleaseEntity entity = new ReleaseEntity();
        entity.id = domain.id;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(ReleaseEntity entity, Release domain) {
        entity.productId = domain.productId;
        entity.slug = domain.slug;
        entity.version = domain.version;
        entity.filePath = domain.filePath;
        entity.fileSize = domain.fileSize;
        entity.fileHash = domain.fileHash;
        entity.changelog = domain.changelog;
        entity.requires = domain.requires;
        entity.requiresRuntime = domain.requiresRuntime;
        entity.testedUpTo = domain.testedUpTo;
        entity.active = domain.active;
        entity.releasedAt = domain.releasedAt;
    }
}
