package tech.keyledger.license;

import java.time.Instant;

/**
 * One entitlement grant.
 *
 * <p>{@link #status} records administrative intent only. Whether the license can be used
 * right now is derived on every request by {@link LicenseStateMachine} from the status,
 * {@link #expiresAt}, {@link #graceUntil} and the current time; that result is never stored.
 *
 * <p>Only hashes of the license key are kept, see
 * {@link tech.keyledger.license.key.LicenseKeyService}.
 */
public class License {

    public String id;

    public String ownerId;

    public String productId;

    /**
     * Order or subscription reference from the fulfillment system, if any.
     */
    public String orderRef;

    /**
     * HMAC of the plaintext key with the server hash salt. Lookup key.
     */
    public String keyHash;

    /**
     * HMAC of {@link #keyHash} with the server key secret.
     */
    public String keyVerificationHash;

    public LicenseStatus status = LicenseStatus.ACTIVE;

    /**
     * Null means perpetual.
     */
    public Instant expiresAt;

    /**
     * End of the grace period, never before {@link #expiresAt}.
     */
    public Instant graceUntil;

    /**
     * Null means unlimited.
     */
    public Integer maxActivations;

    public int failedAttempts;

    public Instant lastValidatedAt;

    public Instant createdAt;

    public Instant updatedAt;

    public License() {
    }

    public boolean hasActivationLimit() {
        return maxActivations != null;
    }
}
