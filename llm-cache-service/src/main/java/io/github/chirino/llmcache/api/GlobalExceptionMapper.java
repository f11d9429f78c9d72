package io.github.chirino.llmcache.api;

import io.github.chirino.llmcache.api.dto.ErrorResponse;
import io.github.chirino.llmcache.storage.CacheItemNotFoundException;
import io.github.chirino.llmcache.storage.ConcurrentItemUpdateException;
import io.github.chirino.llmcache.storage.InvalidCacheRequestException;
import io.github.chirino.llmcache.vector.VectorSearchFailedException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Global exception mapper that ensures all unhandled exceptions are logged with full stack traces
 * and returned as structured JSON error responses.
 */
public class GlobalExceptionMapper {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @ServerExceptionMapper
    public Response handleConstraintViolation(ConstraintViolationException e) {
        List<Map<String, String>> violations =
                e.getConstraintViolations().stream()
                        .map(
                                v ->
                                        Map.of(
                                                "field", extractFieldName(v),
                                                "message", v.getMessage()))
                        .toList();
        return respond(
                Response.Status.BAD_REQUEST,
                new ErrorResponse(
                        "Validation failed", "validation_error", Map.of("violations", violations)));
    }

    private String extractFieldName(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot >= 0 ? path.substring(lastDot + 1) : path;
    }

    @ServerExceptionMapper
    public Response handleInvalidRequest(InvalidCacheRequestException e) {
        return respond(
                Response.Status.BAD_REQUEST, new ErrorResponse(e.getMessage(), "invalid_request"));
    }

    @ServerExceptionMapper
    public Response handleNotFound(CacheItemNotFoundException e) {
        return respond(
                Response.Status.NOT_FOUND,
                new ErrorResponse(
                        "not_found",
                        "not_found",
                        Map.of("ns", e.getNamespace(), "item_id", e.getItemId())));
    }

    @ServerExceptionMapper
    public Response handleConcurrentUpdate(ConcurrentItemUpdateException e) {
        LOG.warnf("Rejected write: %s", e.getMessage());
        return respond(
                Response.Status.CONFLICT,
                new ErrorResponse(
                        e.getMessage(), "concurrent_update", Map.of("item_id", e.getItemId())));
    }

    @ServerExceptionMapper
    public Response handleSearchFailure(VectorSearchFailedException e) {
        LOG.warnf(e, "Vector search failed");
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return respond(
                Response.Status.INTERNAL_SERVER_ERROR,
                new ErrorResponse(
                        "vector_search_failed",
                        "vector_search_failed",
                        Map.of(
                                "message",
                                cause.getMessage() != null
                                        ? cause.getMessage()
                                        : cause.getClass().getName(),
                                "type",
                                cause.getClass().getSimpleName())));
    }

    @ServerExceptionMapper
    public Response handleException(Exception e) {
        // For WebApplicationException (includes JAX-RS responses), preserve the original status
        if (e instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            if (status >= 500) {
                LOG.errorf(e, "Server error %d", status);
            }
            return wae.getResponse();
        }

        LOG.errorf(e, "Unhandled exception");
        return respond(
                Response.Status.INTERNAL_SERVER_ERROR,
                new ErrorResponse(
                        "Internal server error",
                        "internal_error",
                        Map.of(
                                "message",
                                e.getMessage() != null ? e.getMessage() : e.getClass().getName())));
    }

    private static Response respond(Response.Status status, ErrorResponse error) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(error).build();
    }
}
