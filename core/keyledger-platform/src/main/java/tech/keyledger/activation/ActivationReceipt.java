package tech.keyledger.activation;

import tech.keyledger.license.EffectiveStatus;

import java.time.Instant;

/**
 * Outcome of a successful activation.
 *
 * @param remainingActivations free non-exempt slots, null when the license is unlimited
 * @param exempt whether the domain matched the allow-list and consumed no capacity
 * @param alreadyActive whether the domain was already bound and only refreshed
 */
public record ActivationReceipt(
    String licenseId,
    String domain,
    EffectiveStatus status,
    Instant expiresAt,
    Integer remainingActivations,
    boolean exempt,
    boolean alreadyActive
) {
}
