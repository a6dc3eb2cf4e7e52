package tech.keyledger.activation;

import tech.keyledger.license.EffectiveStatus;

import java.time.Instant;

/**
 * Outcome of a successful heartbeat validation.
 */
public record HeartbeatReceipt(
    String licenseId,
    String productId,
    String domain,
    EffectiveStatus status,
    Instant expiresAt,
    Instant graceUntil,
    long validationCount
) {
}
