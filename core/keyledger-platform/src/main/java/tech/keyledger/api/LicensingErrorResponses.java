package tech.keyledger.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import tech.keyledger.platform.common.errors.LicensingError;

/**
 * HTTP rendering of {@link LicensingError}.
 */
public final class LicensingErrorResponses {

    private LicensingErrorResponses() {
    }

    public static Response toResponse(LicensingError error) {
        return Response.status(statusOf(error))
            .type(MediaType.APPLICATION_JSON)
            .entity(LicenseApi.FailureResponse.from(error))
            .build();
    }

    public static Response rateLimited() {
        return toResponse(LicensingError.rateLimited());
    }

    static int statusOf(LicensingError error) {
        if (error instanceof LicensingError.ValidationError) {
            return 400;
        } else if (error instanceof LicensingError.NotFoundError) {
            return 404;
        } else if (error instanceof LicensingError.CapacityExceededError) {
            return 409;
        } else if (error instanceof LicensingError.RateLimitedError) {
            return 429;
        } else if (error instanceof LicensingError.ReleaseUnavailableError r) {
            return "release_unavailable".equals(r.code()) ? 503 : 404;
        }
        // expired, inactive, domain_not_activated, invalid_signature
        return 403;
    }
}
