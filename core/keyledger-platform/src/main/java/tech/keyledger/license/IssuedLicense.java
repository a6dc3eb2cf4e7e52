package tech.keyledger.license;

import tech.keyledger.license.key.LicenseKey;

/**
 * A freshly created license together with its plaintext key.
 *
 * <p>This is the only place the plaintext exists. Deliver it to the purchaser and then
 * {@link LicenseKey#close() close} it.
 */
public record IssuedLicense(String licenseId, LicenseKey key) {
}
