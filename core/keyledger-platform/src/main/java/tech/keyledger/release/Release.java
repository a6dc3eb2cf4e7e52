package tech.keyledger.release;

import java.time.Instant;

/**
 * A published version of a product's package.
 */
public class Release {

    public String id;

    public String productId;

    /**
     * Package slug clients identify themselves with.
     */
    public String slug;

    public String version;

    /**
     * Archive location relative to the releases directory.
     */
    public String filePath;

    public Long fileSize;

    /**
     * SHA-256 of the archive, hex.
     */
    public String fileHash;

    public String changelog;

    /**
     * Minimum host platform version.
     */
    public String requires;

    /**
     * Minimum runtime version.
     */
    public String requiresRuntime;

    public String testedUpTo;

    public boolean active = true;

    public Instant releasedAt;

    public Release() {
    }
}
