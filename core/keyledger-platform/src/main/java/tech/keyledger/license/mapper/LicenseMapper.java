package tech.keyledger.license.mapper;

import tech.keyledger.license.License;
import tech.keyledger.license.LicenseStatus;
import tech.keyledger.license.entity.LicenseEntity;

/**
 * Mapper for converting between License domain model and JPA entity.
 */
public final class LicenseMapper {

    private LicenseMapper() {
    }

    public static License toDomain(LicenseEntity entity) {
        if (entity == null) {
            return null;
        }

        License domain = new License();
        domain.id = entity.id;
        domain.ownerId = entity.ownerId;
        domain.productId = entity.productId;
        domain.orderRef = entity.orderRef;
        domain.keyHash = entity.keyHash;
        domain.keyVerificationHash = entity.keyVerificationHash;
        domain.status = entity.status;
        domain.expiresAt = entity.expiresAt;
        domain.graceUntil = entity.graceUntil;
        domain.maxActivations = entity.maxActivations;
        domain.failedAttempts = entity.failedAttempts;
        domain.lastValidatedAt = entity.lastValidatedAt;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static LicenseEntity toEntity(License domain) {
        if (domain == null) {
            return null;
        }

        LicenseEntity entity = new LicenseEntity();
        entity.id = domain.id;
        entity.keyHash = domain.keyHash;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    /**
     * Copy mutable fields. The key hash and creation time never change after insert.
     */
    public static void updateEntity(LicenseEntity entity, License domain) {
        entity.ownerId = domain.ownerId;
        entity.productId = domain.productId;
        entity.orderRef = domain.orderRef;
        entity.keyVerificationHash = domain.keyVerificationHash;
        entity.status = domain.status != null ? domain.status : LicenseStatus.ACTIVE;
        entity.expiresAt = domain.expiresAt;
        entity.graceUntil = domain.graceUntil;
        entity.maxActivations = domain.maxActivations;
        entity.failedAttempts = domain.failedAttempts;
        entity.lastValidatedAt = domain.lastValidatedAt;
        entity.updatedAt = domain.updatedAt;
    }
}
