/* (C)2026 */
package com.ammann.afoli.exception;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null;
    }

    @Test
    void mapsValidationExceptionToBadRequest() {
        Response response = handler.toResponse(new ValidationException("bad input"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.path).isNull();
        assertThat(body.code).isEqualTo("VALIDATION_ERROR");
        assertThat(body.status).isEqualTo(400);
        assertThat(body.timestamp).isNotNull();
    }

    @Test
    void mapsRangeExceptionToRangeError() {
        Response response = handler.toResponse(new MaskRangeException("extremes", 60, 50, "masking the entire spectrum"));

        assertThat(response.getStatus()).isEqualTo(400);
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("RANGE_ERROR");
        assertThat(body.message).contains("extremes");
    }

    @Test
    void mapsFlagFileExceptionToServerError() {
        Response response = handler.toResponse(new FlagFileException(Path.of("x.txt"), new RuntimeException("io")));

        assertThat(response.getStatus()).isEqualTo(500);
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("FLAG_FILE_ERROR");
    }

    @Test
    void mapsNotFoundTo404() {
        Response response = handler.toResponse(new NotFoundException("missing"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("NOT_FOUND");
        assertThat(body.message).contains("missing");
    }

    @Test
    void mapsMalformedRequestToValidationError() {
        Response response = handler.toResponse(new BadRequestException("unreadable body"));

        assertThat(response.getStatus()).isEqualTo(400);
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("VALIDATION_ERROR");
    }

    @Test
    void mapsUnhandledTo500WithoutLeakingMessage() {
        Response response = handler.toResponse(new RuntimeException("boom"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("INTERNAL_ERROR");
        assertThat(body.message).doesNotContain("boom");
    }
}
