package tech.keyledger.activation.mapper;

import tech.keyledger.activation.Activation;
import tech.keyledger.activation.entity.ActivationEntity;

/**
 * Mapper for converting between Activation domain model and JPA entity.
 */
public final class ActivationMapper {

    private ActivationMapper() {
    }

    public static Activation toDomain(ActivationEntity entity) {
        if (entity == null) {
            return null;
        }

        Activation domain = new Activation();
        domain.id = entity.id;
        domain.licenseId = entity.licenseId;
        domain.domain = entity.domain;
        domain.ipHash = entity.ipHash;
        domain.userAgentHash = entity.userAgentHash;
        domain.activatedAt = entity.activatedAt;
        domain.lastSeenAt = entity.lastSeenAt;
        domain.validationCount = entity.validationCount;
        domain.active = entity.active;
        domain.deactivatedAt = entity.deactivatedAt;
        domain.deactivationReason = entity.deactivationReason;
        return domain;
    }

    public static ActivationEntity toEntity(Activation domain) {
        if (domain == null) {
            return null;
        }

        ActivationEntity entity = new ActivationEntity();
        entity.id = domain.id;
        entity.licenseId = domain.licenseId;
        entity.domain = domain.domain;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(ActivationEntity entity, Activation domain) {
        entity.ipHash = domain.ipHash;
        entity.userAgentHash = domain.userAgentHash;
        entity.activatedAt = domain.activatedAt;
        entity.lastSeenAt = domain.lastSeenAt;
        entity.validationCount = domain.validationCount;
        entity.active = domain.active;
        entity.deactivatedAt = domain.deactivatedAt;
        entity.deactivationReason = domain.deactivationReason;
    }
}
