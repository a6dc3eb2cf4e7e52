package tech.keyledger.license.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import tech.keyledger.license.LicenseStatus;

import java.time.Instant;

/**
 * JPA entity for licenses table.
 */
@Entity
@Table(name = "licenses", indexes = {
    @Index(name = "idx_licenses_owner", columnList = "owner_id")
})
public class LicenseEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "owner_id", nullable = false, length = 100)
    public String ownerId;

    @Column(name = "product_id", nullable = false, length = 100)
    public String productId;

    @Column(name = "order_ref", length = 100)
    public String orderRef;

    @Column(name = "key_hash", nullable = false, unique = true, length = 64)
    public String keyHash;

    @Column(name = "key_verification_hash", nullable = false, length = 64)
    public String keyVerificationHash;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    public LicenseStatus status;

    @Column(name = "expires_at")
    public Instant expiresAt;

    @Column(name = "grace_until")
    public Instant graceUntil;

    @Column(name = "max_activations")
    public Integer maxActivations;

    @Column(name = "failed_attempts", nullable = false)
    public int failedAttempts;

    @Column(name = "last_validated_at")
    public Instant lastValidatedAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public LicenseEntity() {
    }
}
