package tech.keyledger.license;

/**
 * Administrative status of a license, as set by fulfillment or an operator.
 */
public enum LicenseStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED,
    REVOKED
}
