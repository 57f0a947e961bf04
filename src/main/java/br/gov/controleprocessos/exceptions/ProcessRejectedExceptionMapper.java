package br.gov.controleprocessos.exceptions;

import br.gov.controleprocessos.aggregates.process.exceptions.ProcessRejectedException;
import br.gov.controleprocessos.aggregates.process.services.dto.Rejection;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class ProcessRejectedExceptionMapper implements ExceptionMapper<ProcessRejectedException> {

    @Override
    public Response toResponse(ProcessRejectedException exception) {
        return Response.status(statusFor(exception.getErrorType()))
                .type(MediaType.APPLICATION_JSON)
                .entity(Rejection.of(exception))
                .build();
    }

    public static Response.Status statusFor(ProcessRejectedException.ErrorType errorType) {
        return switch (errorType) {
            case VALIDATION -> Response.Status.BAD_REQUEST;
            case NOT_FOUND -> Response.Status.NOT_FOUND;
            case CONFLICT, ILLEGAL_TRANSITION -> Response.Status.CONFLICT;
        };
    }
}
