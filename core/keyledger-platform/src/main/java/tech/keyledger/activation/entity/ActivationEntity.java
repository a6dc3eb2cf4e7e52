package tech.keyledger.activation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for activations table.
 */
@Entity
@Table(name = "activations",
    uniqueConstraints = @UniqueConstraint(name = "uq_activations_license_domain", columnNames = {"license_id", "domain"}),
    indexes = @Index(name = "idx_activations_license_active", columnList = "license_id, active"))
public class ActivationEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "license_id", nullable = false, length = 17)
    public String licenseId;

    @Column(name = "domain", nullable = false, length = 253)
    public String domain;

    @Column(name = "ip_hash", length = 64)
    public String ipHash;

    @Column(name = "user_agent_hash", length = 64)
    public String userAgentHash;

    @Column(name = "activated_at", nullable = false)
    public Instant activatedAt;

    @Column(name = "last_seen_at", nullable = false)
    public Instant lastSeenAt;

    @Column(name = "validation_count", nullable = false)
    public long validationCount;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "deactivated_at")
    public Instant deactivatedAt;

    @Column(name = "deactivation_reason", length = 100)
    public String deactivationReason;

    public ActivationEntity() {
    }
}
