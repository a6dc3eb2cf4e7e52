package tech.keyledger.platform.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for licensing denials.
 *
 * Errors are categorized by type to enable consistent HTTP status mapping
 * and client-side handling. The {@link #code()} is the stable reason string
 * returned to clients ({@code not_found}, {@code expired}, {@code activation_limit}, ...).
 *
 * Messages stay coarse on purpose: a caller must not be able to tell a wrong key
 * from a wrong domain, or learn why a signature was rejected.
 */
public sealed interface LicensingError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Malformed key, domain or request parameter, rejected before any storage access.
     * Maps to HTTP 400 Bad Request.
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements LicensingError {}

    /**
     * Key or license could not be resolved.
     * Maps to HTTP 404 Not Found.
     */
    record NotFoundError(
        String code,
        String message,
        Map<String, Object> details
    ) implements LicensingError {}

    /**
     * License is past its expiry and grace period.
     * Maps to HTTP 403 Forbidden.
     */
    record ExpiredError(
        String code,
        String message,
        Map<String, Object> details
    ) implements LicensingError {}

    /**
     * License is inactive, suspended or revoked.
     * Maps to HTTP 403 Forbidden.
     */
    record InactiveError(
        String code,
        String message,
        Map<String, Object> details
    ) implements LicensingError {}

    /**
     * Activation would exceed the license's capacity.
     * Maps to HTTP 409 Conflict.
     */
    record CapacityExceededError(
        String code,
        String message,
        Map<String, Object> details
    ) implements LicensingError {}

    /**
     * Domain has no active binding for this license.
     * Maps to HTTP 403 Forbidden.
     */
    record DomainNotAuthorizedError(
        String code,
        String message,
        Map<String, Object> details
    ) implements LicensingError {}

    /**
     * Caller exceeded its request budget or is blocked.
     * Maps to HTTP 429 Too Many Requests.
     */
    record RateLimitedError(
        String code,
        String message,
        Map<String, Object> details
    ) implements LicensingError {}

    /**
     * Download capability token failed verification or expired.
     * Maps to HTTP 403 Forbidden.
     */
    record SignatureInvalidError(
        String code,
        String message,
        Map<String, Object> details
    ) implements LicensingError {}

    /**
     * No release can be offered for the requested product/slug.
     * Maps to HTTP 404 Not Found (or 503 when the release file is unavailable).
     */
    record ReleaseUnavailableError(
        String code,
        String message,
        Map<String, Object> details
    ) implements LicensingError {}

    // ========================================
    // Factories for the standard reasons
    // ========================================

    static ValidationError invalidRequest(String message) {
        return new ValidationError("invalid_request", message, Map.of());
    }

    static NotFoundError notFound() {
        return new NotFoundError("not_found", "License not found", Map.of());
    }

    static ExpiredError expired() {
        return new ExpiredError("expired", "License has expired", Map.of());
    }

    static InactiveError inactive() {
        return new InactiveError("inactive", "License is inactive", Map.of());
    }

    static CapacityExceededError activationLimit(int maxActivations) {
        return new CapacityExceededError("activation_limit", "Activation limit reached",
            Map.of("maxActivations", maxActivations));
    }

    static DomainNotAuthorizedError domainNotActivated() {
        return new DomainNotAuthorizedError("domain_not_activated",
            "Domain is not activated for this license", Map.of());
    }

    static RateLimitedError rateLimited() {
        return new RateLimitedError("rate_limited", "Too many requests", Map.of());
    }

    static SignatureInvalidError invalidSignature() {
        return new SignatureInvalidError("invalid_signature", "Invalid or expired download link", Map.of());
    }

    static ReleaseUnavailableError noRelease() {
        return new ReleaseUnavailableError("no_release", "No releases available for this product", Map.of());
    }

    static ReleaseUnavailableError slugMismatch() {
        return new ReleaseUnavailableError("slug_mismatch", "Plugin slug does not match license", Map.of());
    }

    static ReleaseUnavailableError releaseFileUnavailable() {
        return new ReleaseUnavailableError("release_unavailable", "Release file temporarily unavailable", Map.of());
    }
}
