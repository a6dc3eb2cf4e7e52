package tech.keyledger.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import tech.keyledger.activation.ActivationReceipt;
import tech.keyledger.activation.HeartbeatReceipt;
import tech.keyledger.engine.DeactivationReceipt;
import tech.keyledger.platform.common.errors.LicensingError;
import tech.keyledger.release.UpdateCheck;

import java.time.Instant;

/**
 * Request and response bodies of the client-facing license API.
 */
public final class LicenseApi {

    private LicenseApi() {}

    // ========================================================================
    // Requests
    // ========================================================================

    @Schema(description = "Bind or refresh a domain for a license key")
    public record ActivateRequest(
        @Schema(description = "License key", example = "3F2A9C1B-77D0E4A8-0B5C6D7E-8F9A0B1C")
        @JsonProperty("license_key") String licenseKey,
        @Schema(description = "Site hostname or URL", example = "https://www.example.com")
        @JsonProperty("domain") String domain
    ) {}

    @Schema(description = "Heartbeat for an activated domain")
    public record ValidateRequest(
        @JsonProperty("license_key") String licenseKey,
        @JsonProperty("domain") String domain
    ) {}

    @Schema(description = "Release a domain binding")
    public record DeactivateRequest(
        @JsonProperty("license_key") String licenseKey,
        @JsonProperty("domain") String domain
    ) {}

    @Schema(description = "Ask whether a newer release is available")
    public record UpdateCheckRequest(
        @JsonProperty("license_key") String licenseKey,
        @JsonProperty("domain") String domain,
        @Schema(description = "Package slug", example = "my-plugin")
        @JsonProperty("slug") String slug,
        @Schema(description = "Installed version", example = "1.4.2")
        @JsonProperty("version") String version
    ) {}

    // ========================================================================
    // Responses
    // ========================================================================

    @Schema(description = "Successful activation")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record ActivationResponse(
        @JsonProperty("success") boolean success,
        @Schema(description = "Effective license status", example = "active")
        @JsonProperty("status") String status,
        @JsonProperty("expires_at") Instant expiresAt,
        @Schema(description = "Free activation slots, null when unlimited")
        @JsonProperty("remaining_activations") Integer remainingActivations,
        @JsonProperty("exempt") boolean exempt
    ) {
        public static ActivationResponse from(ActivationReceipt receipt) {
            return new ActivationResponse(true, receipt.status().code(), receipt.expiresAt(),
                receipt.remainingActivations(), receipt.exempt());
        }
    }

    @Schema(description = "Successful heartbeat")
    public record ValidationResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("status") String status,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("grace_until") Instant graceUntil
    ) {
        public static ValidationResponse from(HeartbeatReceipt receipt) {
            return new ValidationResponse(true, receipt.status().code(), receipt.expiresAt(), receipt.graceUntil());
        }
    }

    @Schema(description = "Successful deactivation")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record DeactivationResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("remaining_activations") Integer remainingActivations
    ) {
        public static DeactivationResponse from(DeactivationReceipt receipt) {
            return new DeactivationResponse(true, receipt.remainingActivations());
        }
    }

    @Schema(description = "Update check result")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UpdateCheckResponse(
        @JsonProperty("ok") boolean ok,
        @Schema(description = "up_to_date when no newer release exists")
        @JsonProperty("reason") String reason,
        @JsonProperty("new_version") String newVersion,
        @Schema(description = "Signed download URL")
        @JsonProperty("package") String packageUrl,
        @JsonProperty("expires") Instant expires,
        @JsonProperty("requires") String requires,
        @JsonProperty("requires_runtime") String requiresRuntime,
        @JsonProperty("tested") String tested,
        @JsonProperty("changelog") String changelog,
        @JsonProperty("download_size") Long downloadSize,
        @JsonProperty("last_updated") Instant lastUpdated
    ) {
        public static UpdateCheckResponse from(UpdateCheck check) {
            if (!check.updateAvailable()) {
                return new UpdateCheckResponse(false, "up_to_date", check.latestVersion(),
                    null, null, null, null, null, null, null, null);
            }
            var release = check.release();
            return new UpdateCheckResponse(true, null, release.version, check.download().url(),
                check.download().expiresAt(), release.requires, release.requiresRuntime, release.testedUpTo,
                release.changelog, release.fileSize, release.releasedAt);
        }
    }

    @Schema(description = "Denied request")
    public record FailureResponse(
        @JsonProperty("success") boolean success,
        @Schema(description = "Stable reason code", example = "activation_limit")
        @JsonProperty("reason") String reason,
        @JsonProperty("message") String message
    ) {
        public static FailureResponse from(LicensingError error) {
            return new FailureResponse(false, error.code(), error.message());
        }

        public static FailureResponse of(String reason, String message) {
            return new FailureResponse(false, reason, message);
        }
    }
}
