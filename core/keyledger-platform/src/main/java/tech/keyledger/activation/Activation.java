package tech.keyledger.activation;

import java.time.Instant;

/**
 * Binding of one license to one normalized domain.
 *
 * <p>Rows are soft-deactivated and reused on re-activation, so there is at most one row
 * per (license, domain) and its history survives.
 */
public class Activation {

    public String id;

    public String licenseId;

    /**
     * Normalized hostname, see {@link tech.keyledger.activation.hostname.DomainNormalizer}.
     */
    public String domain;

    /**
     * Salted hash of the client IP. The address itself is never stored.
     */
    public String ipHash;

    public String userAgentHash;

    public Instant activatedAt;

    public Instant lastSeenAt;

    /**
     * Incremented on every heartbeat and re-activation.
     */
    public long validationCount;

    public boolean active;

    public Instant deactivatedAt;

    public String deactivationReason;

    public Activation() {
    }
}
