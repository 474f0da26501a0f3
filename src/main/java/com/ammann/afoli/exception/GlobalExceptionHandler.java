/* (C)2026 */
package com.ammann.afoli.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.time.LocalDateTime;

/**
 * Global JAX-RS exception mapper that turns engine and framework exceptions into
 * structured JSON error responses.
 *
 * <p>Configuration and range errors fail the request with 400 and no partial result.
 * Flag-file failures and unhandled exceptions are logged and returned as 500.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception) {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof MaskRangeException) {
            LOG.debugf("Range error on %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "RANGE_ERROR",
                    path
            );
        }

        if (exception instanceof ValidationException) {
            LOG.debugf("Validation error on %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path
            );
        }

        if (exception instanceof FlagFileException) {
            LOG.errorf(exception, "Flag file error on %s", path);
            return createResponse(
                    Response.Status.INTERNAL_SERVER_ERROR,
                    exception.getMessage(),
                    "FLAG_FILE_ERROR",
                    path
            );
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    path
            );
        }

        if (exception instanceof WebApplicationException webException) {
            Response.Status status = Response.Status.fromStatusCode(webException.getResponse().getStatus());
            if (status != null && status != Response.Status.INTERNAL_SERVER_ERROR) {
                return createResponse(
                        status,
                        exception.getMessage(),
                        status == Response.Status.BAD_REQUEST ? "VALIDATION_ERROR" : status.name(),
                        path
                );
            }
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path) {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status.getStatusCode());
        return Response.status(status).entity(errorResponse).build();
    }

    /**
     * Structured error response body returned to API clients.
     */
    public static class ErrorResponse {
        public String code;
        public String message;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;

        public ErrorResponse(String code, String message, String path, Integer status) {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
            this.path = path;
            this.status = status;
        }
    }
}
