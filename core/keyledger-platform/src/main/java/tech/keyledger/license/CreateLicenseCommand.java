package tech.keyledger.license;

import lombok.Builder;

import java.time.Instant;

/**
 * Request from order fulfillment to issue a license.
 *
 * @param orderRef order or subscription reference, optional
 * @param maxActivations null for unlimited
 * @param expiresAt null for perpetual
 * @param graceUntil optional, requires {@code expiresAt} and may not precede it
 */
@Builder
public record CreateLicenseCommand(
    String ownerId,
    String productId,
    String orderRef,
    Integer maxActivations,
    Instant expiresAt,
    Instant graceUntil
) {
}
