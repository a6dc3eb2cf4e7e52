package tech.keyledger.api;

import io.vertx.core.http.HttpServerRequest;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
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
import tech.keyledger.api.LicenseApi.UpdateCheckRequest;
import tech.keyledger.api.LicenseApi.UpdateCheckResponse;
import tech.keyledger.engine.LicensingEngine;
import tech.keyledger.platform.common.Result;
import tech.keyledger.platform.common.errors.LicensingError;
import tech.keyledger.platform.ratelimit.RateLimitAction;
import tech.keyledger.release.ReleaseFile;
import tech.keyledger.release.UpdateCheck;
import tech.keyledger.release.UpdateService;

/**
 * Update check and signed download endpoints.
 */
@Path("/api/v1/updates")
@Tag(name = "Updates", description = "Check for and download package updates")
public class UpdateResource {

    static final String ZIP = "application/zip";

    @Inject
    UpdateService updateService;

    @Inject
    LicensingEngine engine;

    @POST
    @Path("/check")
    @Produces(MediaType.APPLICATION_JSON)
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(operationId = "checkForUpdate", summary = "Check for a newer release")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Update offered or already up to date",
            content = @Content(mediaType = MediaType.APPLICATION_JSON,
                schema = @Schema(implementation = UpdateCheckResponse.class))),
        @APIResponse(responseCode = "403", description = "Domain not activated, license expired or inactive"),
        @APIResponse(responseCode = "404", description = "License, release or slug not found"),
        @APIResponse(responseCode = "429", description = "Too many requests"),
        @APIResponse(responseCode = "503", description = "Release file unavailable")
    })
    public Response check(UpdateCheckRequest request, @Context HttpHeaders headers,
                             @Context HttpServerRequest httpRequest) {
        RequestContext ctx = RequestContext.of(headers, httpRequest);
        if (!engine.checkRate(ctx.clientIp(), RateLimitAction.UPDATE_CHECK)) {
            return LicensingErrorResponses.rateLimited();
        }
        if (request == null) {
            return LicensingErrorResponses.toResponse(LicensingError.invalidRequest("Request body is required"));
        }

        Result<UpdateCheck> result = updateService.checkForUpdate(
            request.licenseKey(), request.domain(), request.slug(), request.version(), ctx.clientIp());
        if (result instanceof Result.Success<UpdateCheck> s) {
            return Response.ok(UpdateCheckResponse.from(s.value())).build();
        }
        return LicensingErrorResponses.toResponse(((Result.Failure<UpdateCheck>) result).error());
    }

    @GET
    @Path("/download")
    @Produces({ZIP, MediaType.APPLICATION_JSON})
    @Operation(operationId = "downloadRelease", summary = "Stream a release archive through a signed link")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Release archive",
            content = @Content(mediaType = ZIP)),
        @APIResponse(responseCode = "403", description = "Invalid or expired link, or license no longer usable"),
        @APIResponse(responseCode = "404", description = "Release not found"),
        @APIResponse(responseCode = "429", description = "Too many requests"),
        @APIResponse(responseCode = "503", description = "Release file unavailable")
    })
    public Response download(@QueryParam("license_id") String licenseId,
                             @QueryParam("release_id") String releaseId,
                             @QueryParam("expires") Long expires,
                             @QueryParam("sig") String signature,
                             @Context HttpHeaders headers,
                             @Context HttpServerRequest httpRequest) {
        RequestContext ctx = RequestContext.of(headers, httpRequest);
        if (!engine.checkRate(ctx.clientIp(), RateLimitAction.DOWNLOAD)) {
            return LicensingErrorResponses.rateLimited();
        }
        if (licenseId == null || releaseId == null || expires == null || signature == null) {
            return LicensingErrorResponses.toResponse(LicensingError.invalidSignature());
        }

        Result<ReleaseFile> result = updateService.openDownload(licenseId, releaseId, expires, signature);
        if (result instanceof Result.Success<ReleaseFile> s) {
            ReleaseFile file = s.value();
            return Response.ok(file.path().toFile(), ZIP)
                .header("Content-Disposition", "attachment; filename=\"" + file.fileName() + "\"")
                .header("Content-Length", file.size())
                .header("Cache-Control", "no-store")
                .build();
        }
        return LicensingErrorResponses.toResponse(((Result.Failure<ReleaseFile>) result).error());
    }
}
