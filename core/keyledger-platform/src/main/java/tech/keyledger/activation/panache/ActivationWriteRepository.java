package tech.keyledger.activation.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.keyledger.activation.Activation;
import tech.keyledger.activation.entity.ActivationEntity;
import tech.keyledger.activation.mapper.ActivationMapper;

import java.time.Instant;

/**
 * Write-side repository for Activation entities.
 *
 * <p>Heartbeat refresh and deactivation are single conditional UPDATE statements so they
 * stay correct without holding the license lock.
 */
@ApplicationScoped
public class ActivationWriteRepository implements PanacheRepositoryBase<ActivationEntity, String> {

    public void persistActivation(Activation activation) {
        persist(ActivationMapper.toEntity(activation));
    }

    public void updateActivation(Activation activation) {
        ActivationEntity entity = findById(activation.id);
        if (entity != null) {
            ActivationMapper.updateEntity(entity, activation);
        }
    }

    public int touchActive(String licenseId, String domain, Instant seenAt, String ipHash, String userAgentHash) {
        return update("validationCount = validationCount + 1, lastSeenAt = ?1, ipHash = coalesce(?2, ipHash), "
                + "userAgentHash = coalesce(?3, userAgentHash) "
                + "WHERE licenseId = ?4 AND domain = ?5 AND active = true",
            seenAt, ipHash, userAgentHash, licenseId, domain);
    }

    public int deactivateActive(String licenseId, String domain, Instant at, String reason) {
        return update("active = false, deactivatedAt = ?1, deactivationReason = ?2 "
                + "WHERE licenseId = ?3 AND domain = ?4 AND active = true",
            at, reason, licenseId, domain);
    }

    public long deleteAllForLicense(String licenseId) {
        return delete("licenseId", licenseId);
    }
}
