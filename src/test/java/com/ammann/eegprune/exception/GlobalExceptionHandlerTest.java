package com.ammann.eegprune.exception;

import com.ammann.eegprune.enumeration.PipelineStep;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest
{

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp()
    {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null;
    }

    @Test
    void mapsValidationExceptionToBadRequest()
    {
        Response response = handler.toResponse(ValidationException.sizeMismatch("timestampsMillis", 10, 9));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.path).isNull();
        assertThat(body.code).isEqualTo("VALIDATION_ERROR");
        assertThat(body.message).contains("timestampsMillis");
    }

    @Test
    void mapsPipelineStepFailureToUnprocessableEntity()
    {
        PipelineStepException exception = new PipelineStepException(
                "night-01", PipelineStep.RELOCATE, new IllegalArgumentException("bad gap"));

        Response response = handler.toResponse(exception);

        assertThat(response.getStatus()).isEqualTo(422);
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("PIPELINE_STEP_FAILED");
        assertThat(body.message).contains("night-01").contains("relocate").contains("bad gap");
        assertThat(body.status).isEqualTo(422);
    }

    @Test
    void mapsSpanErrorsToUnprocessableEntity()
    {
        Response invalid = handler.toResponse(InvalidSpanException.reversed(10, 5));
        Response range = handler.toResponse(ExcisionRangeException.outOfBounds(90, 120, 100));

        assertThat(invalid.getStatus()).isEqualTo(422);
        assertThat(range.getStatus()).isEqualTo(422);
        assertThat(((GlobalExceptionHandler.ErrorResponse) range.getEntity()).code).isEqualTo("SPAN_REJECTED");
    }

    @Test
    void mapsNotFoundTo404()
    {
        Response response = handler.toResponse(new NotFoundException("missing"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("NOT_FOUND");
    }

    @Test
    void keepsStatusOfOtherWebExceptions()
    {
        Response response = handler.toResponse(new BadRequestException("malformed body"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        assertThat(((GlobalExceptionHandler.ErrorResponse) response.getEntity()).code).isEqualTo("BAD_REQUEST");
    }

    @Test
    void mapsUnhandledTo500()
    {
        Response response = handler.toResponse(new RuntimeException("boom"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("INTERNAL_ERROR");
        assertThat(body.message).isEqualTo("An unexpected error occurred");
    }
}
