package tech.keyledger.license.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.keyledger.license.License;
import tech.keyledger.license.entity.LicenseEntity;
import tech.keyledger.license.mapper.LicenseMapper;

import java.time.Instant;

/**
 * Write-side repository for License entities.
 */
@ApplicationScoped
public class LicenseWriteRepository implements PanacheRepositoryBase<LicenseEntity, String> {

    public void persistLicense(License license) {
        if (license.createdAt == null) {
            license.createdAt = Instant.now();
        }
        if (license.updatedAt == null) {
            license.updatedAt = license.createdAt;
        }
        persist(LicenseMapper.toEntity(license));
    }

    public void updateLicense(License license) {
        if (license.updatedAt == null) {
            license.updatedAt = Instant.now();
        }
        LicenseEntity entity = findById(license.id);
        if (entity != null) {
            LicenseMapper.updateEntity(entity, license);
        }
    }

    public int markValidated(String id, Instant at) {
        return update("lastValidatedAt = ?1 WHERE id = ?2", at, id);
    }

    public boolean deleteLicenseById(String id) {
        return deleteById(id);
    }
}
