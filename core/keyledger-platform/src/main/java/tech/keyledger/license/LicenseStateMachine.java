package tech.keyledger.license;

import java.time.Instant;

/**
 * Derives the effective status of a license.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>administrative status revoked, suspended or inactive: {@code INACTIVE}</li>
 *   <li>no expiry: {@code ACTIVE}</li>
 *   <li>{@code now < expiresAt}: {@code ACTIVE}</li>
 *   <li>{@code graceUntil} set and {@code now <= graceUntil}: {@code GRACE}</li>
 *   <li>otherwise {@code EXPIRED}</li>
 * </ol>
 *
 * <p>Pure. Callers must evaluate it per request with the current time.
 */
public final class LicenseStateMachine {

    private LicenseStateMachine() {
    }

    public static EffectiveStatus evaluate(LicenseStatus status, Instant expiresAt, Instant graceUntil, Instant now) {
        if (status != LicenseStatus.ACTIVE) {
            return EffectiveStatus.INACTIVE;
        }
        if (expiresAt == null) {
            return EffectiveStatus.ACTIVE;
        }
        if (now.isBefore(expiresAt)) {
            return EffectiveStatus.ACTIVE;
        }
        if (graceUntil != null && !now.isAfter(graceUntil)) {
            return EffectiveStatus.GRACE;
        }
        return EffectiveStatus.EXPIRED;
    }

    public static EffectiveStatus evaluate(License license, Instant now) {
        return evaluate(license.status, license.expiresAt, license.graceUntil, now);
    }
}
