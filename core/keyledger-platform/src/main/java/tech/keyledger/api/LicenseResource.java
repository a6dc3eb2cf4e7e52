package tech.keyledger.api;

import io.vertx.core.http.HttpServerRequest;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.keyledger.activation.ActivationReceipt;
import tech.keyledger.activation.HeartbeatReceipt;
import tech.keyledger.api.LicenseApi.ActivateRequest;
import tech.keyledger.api.LicenseApi.ActivationResponse;
import tech.keyledger.api.LicenseApi.DeactivateRequest;
import tech.keyledger.api.LicenseApi.DeactivationResponse;
import tech.keyledger.api.LicenseApi.FailureResponse;
import tech.keyledger.api.LicenseApi.ValidateRequest;
import tech.keyledger.api.LicenseApi.ValidationResponse;
import tech.keyledger.engine.DeactivationReceipt;
import tech.keyledger.engine.LicensingEngine;
import tech.keyledger.platform.common.Result;
import tech.keyledger.platform.common.errors.LicensingError;
import tech.keyledger.platform.ratelimit.RateLimitAction;

/**
 * Client-facing activation, heartbeat and deactivation endpoints.
 */
@Path("/api/v1/license")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "License", description = "Activate, validate and deactivate license keys")
public class LicenseResource {

    @Inject
    LicensingEngine engine;

    @POST
    @Path("/activate")
    @Operation(operationId = "activateLicense", summary = "Bind a domain to a license key")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Domain activated or refreshed",
            content = @Content(mediaType = MediaType.APPLICATION_JSON,
                schema = @Schema(implementation = ActivationResponse.class))),
        @APIResponse(responseCode = "400", description = "Malformed key or domain"),
        @APIResponse(responseCode = "403", description = "License expired or inactive",
            content = @Content(schema = @Schema(implementation = FailureResponse.class))),
        @APIResponse(responseCode = "404", description = "License not found"),
        @APIResponse(responseCode = "409", description = "Activation limit reached"),
        @APIResponse(responseCode = "429", description = "Too many requests"),
        @APIResponse(responseCode = "503", description = "Storage temporarily unavailable")
    })
    public Response activate(ActivateRequest request, @Context HttpHeaders headers,
                             @Context HttpServerRequest httpRequest) {
        RequestContext ctx = RequestContext.of(headers, httpRequest);
        if (!engine.checkRate(ctx.clientIp(), RateLimitAction.ACTIVATE)) {
            return LicensingErrorResponses.rateLimited();
        }
        if (request == null) {
            return LicensingErrorResponses.toResponse(LicensingError.invalidRequest("Request body is required"));
        }

        Result<ActivationReceipt> result = engine.activate(
            request.licenseKey(), request.domain(), ctx.clientIp(), ctx.userAgent());
        if (result instanceof Result.Success<ActivationReceipt> s) {
            return Response.ok(ActivationResponse.from(s.value())).build();
        }
        return LicensingErrorResponses.toResponse(((Result.Failure<ActivationReceipt>) result).error());
    }

    @POST
    @Path("/validate")
    @Operation(operationId = "validateLicense", summary = "Heartbeat for an activated domain")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "License usable on this domain",
            content = @Content(mediaType = MediaType.APPLICATION_JSON,
                schema = @Schema(implementation = ValidationResponse.class))),
        @APIResponse(responseCode = "400", description = "Malformed key or domain"),
        @APIResponse(responseCode = "403", description = "Domain not activated, license expired or inactive"),
        @APIResponse(responseCode = "404", description = "License not found"),
        @APIResponse(responseCode = "429", description = "Too many requests")
    })
    public Response validate(ValidateRequest request, @Context HttpHeaders headers,
                             @Context HttpServerRequest httpRequest) {
        RequestContext ctx = RequestContext.of(headers, httpRequest);
        if (!engine.checkRate(ctx.clientIp(), RateLimitAction.VALIDATE)) {
            return LicensingErrorResponses.rateLimited();
        }
        if (request == null) {
            return LicensingErrorResponses.toResponse(LicensingError.invalidRequest("Request body is required"));
        }

        Result<HeartbeatReceipt> result = engine.validateHeartbeat(request.licenseKey(), request.domain(), ctx.clientIp());
        if (result instanceof Result.Success<HeartbeatReceipt> s) {
            return Response.ok(ValidationResponse.from(s.value())).build();
        }
        return LicensingErrorResponses.toResponse(((Result.Failure<HeartbeatReceipt>) result).error());
    }

    @POST
    @Path("/deactivate")
    @Operation(operationId = "deactivateLicense", summary = "Release a domain binding")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Domain released",
            content = @Content(mediaType = MediaType.APPLICATION_JSON,
                schema = @Schema(implementation = DeactivationResponse.class))),
        @APIResponse(responseCode = "400", description = "Malformed key or domain"),
        @APIResponse(responseCode = "403", description = "Domain was not activated"),
        @APIResponse(responseCode = "404", description = "License not found"),
        @APIResponse(responseCode = "429", description = "Too many requests")
    })
    public Response deactivate(DeactivateRequest request, @Context HttpHeaders headers,
                             @Context HttpServerRequest httpRequest) {
        RequestContext ctx = RequestContext.of(headers, httpRequest);
        if (!engine.checkRate(ctx.clientIp(), RateLimitAction.DEACTIVATE)) {
            return LicensingErrorResponses.rateLimited();
        }
        if (request == null) {
            return LicensingErrorResponses.toResponse(LicensingError.invalidRequest("Request body is required"));
        }

        Result<DeactivationReceipt> result = engine.deactivate(request.licenseKey(), request.domain());
        if (result instanceof Result.Success<DeactivationReceipt> s) {
            return Response.ok(DeactivationResponse.from(s.value())).build();
        }
        return LicensingErrorResponses.toResponse(((Result.Failure<DeactivationReceipt>) result).error());
    }
}
