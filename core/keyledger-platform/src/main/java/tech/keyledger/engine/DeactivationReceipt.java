package tech.keyledger.engine;

/**
 * Outcome of a successful deactivation.
 *
 * @param remainingActivations free slots after the release, null when unlimited
 */
public record DeactivationReceipt(String licenseId, String domain, Integer remainingActivations) {
}
