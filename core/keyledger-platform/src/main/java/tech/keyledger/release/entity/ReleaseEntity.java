package tech.keyledger.release.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for releases table.
 */
@Entity
@Table(name = "releases",
    uniqueConstraints = @UniqueConstraint(name = "uq_releases_product_slug_version",
        columnNames = {"product_id", "slug", "version"}),
    indexes = @Index(name = "idx_releases_product_slug", columnList = "product_id, slug"))
public class ReleaseEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "product_id", nullable = false, length = 100)
    public String productId;

    @Column(name = "slug", nullable = false, length = 100)
    public String slug;

    @Column(name = "version", nullable = false, length = 50)
    public String version;

    @Column(name = "file_path", nullable = false, length = 500)
    public String filePath;

    @Column(name = "file_size")
    public Long fileSize;

    @Column(name = "file_hash", length = 64)
    public String fileHash;

    @Column(name = "changelog", columnDefinition = "TEXT")
    public String changelog;

    @Column(name = "requires", length = 20)
    public String requires;

    @Column(name = "requires_runtime", length = 20)
    public String requiresRuntime;

    @Column(name = "tested_up_to", length = 20)
    public String testedUpTo;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "released_at", nullable = false)
    public Instant releasedAt;

    public ReleaseEntity() {
    }
}
