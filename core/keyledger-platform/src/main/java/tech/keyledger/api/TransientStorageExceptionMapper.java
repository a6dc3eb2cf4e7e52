package tech.keyledger.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import tech.keyledger.platform.common.TransientStorageException;

/**
 * JAX-RS exception mapper for TransientStorageException.
 *
 * Returns 503 with a Retry-After hint. The underlying cause is logged where it is
 * raised and never returned to the client.
 */
@Provider
public class TransientStorageExceptionMapper implements ExceptionMapper<TransientStorageException> {

    static final String RETRY_AFTER_SECONDS = "5";

    @Override
    public Response toResponse(TransientStorageException exception) {
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
            .type(MediaType.APPLICATION_JSON)
            .header("Retry-After", RETRY_AFTER_SECONDS)
            .entity(LicenseApi.FailureResponse.of("service_unavailable", "Service temporarily unavailable, retry shortly"))
            .build();
    }
}
