package tech.keyledger.license;

/**
 * Status of a license at a given instant, derived by {@link LicenseStateMachine}.
 */
public enum EffectiveStatus {
    ACTIVE("active"),
    GRACE("grace"),
    EXPIRED("expired"),
    INACTIVE("inactive");

    private final String code;

    EffectiveStatus(String code) {
        this.code = code;
    }

    /**
     * Wire value returned to clients.
     */
    public String code() {
        return code;
    }

    /**
     * Whether activation and validation may succeed.
     */
    public boolean isUsable() {
        return this == ACTIVE || this == GRACE;
    }
}
